package io.teenet.client.core.task;

import com.google.common.base.Preconditions;
import com.google.protobuf.ByteString;

import io.grpc.Context;

import io.teenet.client.core.config.ChannelSettings;
import io.teenet.client.core.config.ClientConstants;
import io.teenet.client.core.config.NodeConfig;
import io.teenet.client.core.grpc.AuthenticatedClient;
import io.teenet.client.core.grpc.ChannelFactory;
import io.teenet.client.core.grpc.RetryPolicy;
import io.teenet.client.core.tls.TlsMaterial;
import io.teenet.client.exception.NotConnectedException;
import io.teenet.client.exception.SigningException;
import io.teenet.client.exception.TransportException;
import io.teenet.client.proto.keymanagement.SignRequest;
import io.teenet.client.proto.keymanagement.SignResponse;
import io.teenet.client.proto.keymanagement.UserTaskGrpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes signing tasks on the trusted-execution node over mTLS.
 *
 * <p>Transient failures ({@code UNAVAILABLE}, {@code DEADLINE_EXCEEDED} by default) are retried by
 * the channel according to the {@link RetryPolicy}; everything else surfaces immediately as a
 * {@link TransportException}.
 */
public class TaskClient extends AuthenticatedClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(TaskClient.class);

    private final NodeConfig config;

    public TaskClient(NodeConfig config) {
        this(config, ChannelFactory.create(), ChannelSettings.defaults(), RetryPolicy.defaults());
    }

    public TaskClient(
            NodeConfig config,
            ChannelFactory channelFactory,
            ChannelSettings settings,
            RetryPolicy retryPolicy) {
        super(
                "TEE server",
                Preconditions.checkNotNull(config, "config").getRpcAddress(),
                UserTaskGrpc.SERVICE_NAME,
                ClientConstants.DEFAULT_TASK_TIMEOUT,
                channelFactory,
                settings,
                retryPolicy);
        this.config = config;
    }

    /** Connects with this node's own identity, trusting the TEE certificate from the config. */
    public void connect(Context context) {
        connect(context, TlsMaterial.forTrustedExecutionPeer(config));
    }

    public byte[] sign(byte[] message, byte[] publicKey, SignProtocol protocol, Curve curve) {
        return sign(Context.current(), message, publicKey, protocol, curve);
    }

    public byte[] sign(
            Context context, byte[] message, byte[] publicKey, SignProtocol protocol, Curve curve) {
        Preconditions.checkNotNull(protocol, "protocol");
        Preconditions.checkNotNull(curve, "curve");
        return sign(context, message, publicKey, protocol.getCode(), curve.getCode());
    }

    /**
     * Signs {@code message} with the key identified by {@code publicKey}.
     *
     * @return the raw signature bytes
     * @throws IllegalArgumentException if message or public key is empty
     * @throws NotConnectedException if {@link #connect} has not succeeded
     * @throws TransportException if the call failed, carrying the gRPC status
     * @throws SigningException if the node answered {@code success=false}
     */
    public byte[] sign(Context context, byte[] message, byte[] publicKey, int protocol, int curve) {
        Preconditions.checkArgument(message != null && message.length > 0, "message cannot be empty");
        Preconditions.checkArgument(
                publicKey != null && publicKey.length > 0, "public key cannot be empty");
        UserTaskGrpc.UserTaskBlockingStub stub = UserTaskGrpc.newBlockingStub(requireChannel());

        SignRequest request =
                SignRequest.newBuilder()
                        .setFrom((int) config.getNodeId())
                        .setPublicKeyInfo(ByteString.copyFrom(publicKey))
                        .setMsg(ByteString.copyFrom(message))
                        .setProtocol(protocol)
                        .setCurve(curve)
                        .build();
        LOGGER.debug(
                "[Task] Sign request from node {} protocol={} curve={} sizeBytes={}",
                config.getNodeId(),
                protocol,
                curve,
                message.length);

        SignResponse response =
                invoke(context, "Sign", deadline -> stub.withDeadline(deadline).sign(request));
        if (!response.getSuccess()) {
            String error = response.getError().isEmpty() ? "unknown error" : response.getError();
            LOGGER.warn("[Task] Signing rejected by TEE server: {}", error);
            throw new SigningException(error);
        }
        return response.getSignature().toByteArray();
    }

    public NodeConfig getNodeConfig() {
        return config;
    }
}

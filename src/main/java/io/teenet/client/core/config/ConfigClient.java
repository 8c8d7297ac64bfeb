package io.teenet.client.core.config;

import com.google.common.base.Preconditions;

import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import io.teenet.client.core.grpc.ChannelFactory;
import io.teenet.client.exception.ConfigurationException;
import io.teenet.client.exception.ConnectionException;
import io.teenet.client.proto.nodemanagement.CLIRPCServiceGrpc;
import io.teenet.client.proto.nodemanagement.GetNodeInfoRequest;
import io.teenet.client.proto.nodemanagement.GetNodeInfoResponse;
import io.teenet.client.proto.nodemanagement.GetPeerNodeRequest;
import io.teenet.client.proto.nodemanagement.GetPeerNodeResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Pulls this node's identity and its peers from the configuration service.
 *
 * <p>The bootstrap channel is plaintext: it only distributes the certificates that later
 * authenticated channels trust. Each {@link #getConfig} opens its own channel and shuts it down
 * before returning; nothing happens on the network at construction time.
 */
public class ConfigClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigClient.class);

    private final String serverAddress;
    private final ChannelFactory channelFactory;
    private final ChannelSettings settings;
    private volatile Duration timeout = ClientConstants.DEFAULT_CONFIG_TIMEOUT;

    public ConfigClient(String serverAddress) {
        this(serverAddress, ChannelFactory.create(), ChannelSettings.defaults());
    }

    public ConfigClient(String serverAddress, ChannelFactory channelFactory, ChannelSettings settings) {
        this.serverAddress = serverAddress;
        this.channelFactory = Preconditions.checkNotNull(channelFactory, "channelFactory");
        this.settings = Preconditions.checkNotNull(settings, "settings");
    }

    public NodeConfig getConfig() {
        return getConfig(Context.current());
    }

    /**
     * Fetches node info then the peer list under one sub-deadline of {@code now + timeout},
     * bounded by {@code parentContext}.
     *
     * @throws ConfigurationException if the channel cannot be built, either call fails, or the
     *     peer list has neither a trusted-execution nor an application node
     */
    public NodeConfig getConfig(Context parentContext) {
        Preconditions.checkNotNull(parentContext, "parentContext");
        Deadline deadline =
                Deadline.after(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        ManagedChannel channel;
        try {
            channel = channelFactory.createInsecureChannel(serverAddress, settings);
        } catch (ConnectionException e) {
            throw new ConfigurationException(
                    "failed to connect to config server: " + e.getMessage(), e);
        }
        Context previous = parentContext.attach();
        try {
            CLIRPCServiceGrpc.CLIRPCServiceBlockingStub stub =
                    CLIRPCServiceGrpc.newBlockingStub(channel).withDeadline(deadline);

            GetNodeInfoResponse nodeInfo;
            try {
                nodeInfo = stub.getNodeInfo(GetNodeInfoRequest.getDefaultInstance());
            } catch (StatusRuntimeException e) {
                throw new ConfigurationException("failed to get node info: " + describe(e), e);
            }

            GetPeerNodeResponse peers;
            try {
                peers = stub.getPeerNode(GetPeerNodeRequest.getDefaultInstance());
            } catch (StatusRuntimeException e) {
                throw new ConfigurationException("failed to get peer nodes: " + describe(e), e);
            }

            NodeConfig config = resolve(nodeInfo, peers.getPeersList());
            LOGGER.info("[Config] Retrieved config from server, node ID: {}", config.getNodeId());
            return config;
        } finally {
            parentContext.detach(previous);
            channel.shutdownNow();
        }
    }

    /**
     * Sub-deadline applied to {@link #getConfig} calls started after this returns. Values beyond
     * the longest deadline grpc supports are capped to it.
     */
    public void setTimeout(Duration timeout) {
        Preconditions.checkArgument(
                timeout != null && !timeout.isNegative() && !timeout.isZero(),
                "timeout must be positive");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public String getServerAddress() {
        return serverAddress;
    }

    /**
     * Single pass over the peers: the first trusted-execution node and the first application node
     * win, later ones of the same type are ignored. Only one of the two is required.
     */
    static NodeConfig resolve(
            GetNodeInfoResponse nodeInfo,
            List<io.teenet.client.proto.nodemanagement.Peer> peers) {
        Peer teeNode = null;
        Peer appNode = null;
        for (io.teenet.client.proto.nodemanagement.Peer candidate : peers) {
            Peer peer = Peer.fromProto(candidate);
            if (peer.getType() == NodeType.TRUSTED_EXECUTION && teeNode == null) {
                teeNode = peer;
            } else if (peer.getType() == NodeType.APPLICATION && appNode == null) {
                appNode = peer;
            }
            if (teeNode != null && appNode != null) {
                break;
            }
        }

        if (teeNode == null && appNode == null) {
            throw new ConfigurationException("no TEE or App node found");
        }
        if (teeNode == null) {
            LOGGER.warn("[Config] No TEE node in peer list, signing will be unavailable");
        } else if (appNode == null) {
            LOGGER.warn("[Config] No App node in peer list, app id lookups will be unavailable");
        }

        NodeConfig.NodeConfigBuilder config =
                NodeConfig.builder()
                        .nodeId(Integer.toUnsignedLong(nodeInfo.getNodeId()))
                        .cert(nodeInfo.getCert())
                        .key(nodeInfo.getKey());
        if (teeNode != null) {
            config.rpcAddress(teeNode.getRpcAddress()).targetCert(teeNode.getCert());
        }
        if (appNode != null) {
            config.appNodeAddress(appNode.getRpcAddress()).appNodeCert(appNode.getCert());
        }
        return config.build();
    }

    private static String describe(StatusRuntimeException e) {
        Status status = e.getStatus();
        return status.getDescription() == null
                ? status.getCode().toString()
                : status.getCode() + ": " + status.getDescription();
    }
}

package io.teenet.client.core;

import com.google.common.base.Preconditions;
import com.google.common.io.BaseEncoding;

import io.grpc.Context;

import io.teenet.client.core.appid.AppIdClient;
import io.teenet.client.core.appid.AppPublicKey;
import io.teenet.client.core.config.ChannelSettings;
import io.teenet.client.core.config.ClientConstants;
import io.teenet.client.core.config.ConfigClient;
import io.teenet.client.core.config.NodeConfig;
import io.teenet.client.core.grpc.ChannelFactory;
import io.teenet.client.core.grpc.RetryPolicy;
import io.teenet.client.core.task.Curve;
import io.teenet.client.core.task.SignProtocol;
import io.teenet.client.core.task.TaskClient;
import io.teenet.client.core.tls.TlsMaterial;
import io.teenet.client.exception.ConfigurationException;
import io.teenet.client.exception.NotConnectedException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Entry point for applications: bootstraps the node configuration, then connects a {@link
 * TaskClient} to the trusted-execution node and an {@link AppIdClient} to the application node.
 *
 * <pre>{@code
 * try (KeyManagementClient client = new KeyManagementClient("config-host:50052")) {
 *     client.init();
 *     byte[] signature = client.signWithAppId(message, "my-app");
 * }
 * }</pre>
 */
public class KeyManagementClient implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeyManagementClient.class);

    private final ConfigClient configClient;
    private final ChannelFactory channelFactory;
    private final ChannelSettings settings;
    private final RetryPolicy retryPolicy;

    private NodeConfig config;
    private TaskClient taskClient;
    private AppIdClient appIdClient;
    private Duration timeout = ClientConstants.DEFAULT_CLIENT_TIMEOUT;

    public KeyManagementClient(String configServerAddress) {
        this(
                configServerAddress,
                ChannelFactory.create(),
                ChannelSettings.defaults(),
                RetryPolicy.defaults());
    }

    public KeyManagementClient(
            String configServerAddress,
            ChannelFactory channelFactory,
            ChannelSettings settings,
            RetryPolicy retryPolicy) {
        this.channelFactory = Preconditions.checkNotNull(channelFactory, "channelFactory");
        this.settings = Preconditions.checkNotNull(settings, "settings");
        this.retryPolicy = Preconditions.checkNotNull(retryPolicy, "retryPolicy");
        this.configClient = new ConfigClient(configServerAddress, channelFactory, settings);
    }

    public void init() {
        init(Context.current());
    }

    /**
     * Fetches the configuration and connects to every peer it names. Calling it again replaces
     * the previous connections. If any step fails the connections opened so far are closed and
     * the client is left uninitialized.
     */
    public void init(Context context) {
        close();
        config = null;
        NodeConfig resolved = configClient.getConfig(context);

        TaskClient task = null;
        AppIdClient appId = null;
        try {
            if (resolved.hasTrustedExecutionPeer()) {
                task = new TaskClient(resolved, channelFactory, settings, retryPolicy);
                task.setTimeout(timeout);
                task.connect(context, TlsMaterial.forTrustedExecutionPeer(resolved));
            }
            if (resolved.hasApplicationPeer()) {
                appId =
                        new AppIdClient(
                                resolved.getAppNodeAddress(), channelFactory, settings, retryPolicy);
                appId.setTimeout(timeout);
                appId.connect(context, TlsMaterial.forApplicationPeer(resolved));
            }
        } catch (RuntimeException e) {
            if (task != null) {
                task.close();
            }
            if (appId != null) {
                appId.close();
            }
            throw e;
        }

        this.config = resolved;
        this.taskClient = task;
        this.appIdClient = appId;
        LOGGER.info("Client initialized successfully, node ID: {}", resolved.getNodeId());
    }

    public byte[] sign(byte[] message, byte[] publicKey, SignProtocol protocol, Curve curve) {
        Preconditions.checkNotNull(protocol, "protocol");
        Preconditions.checkNotNull(curve, "curve");
        return sign(message, publicKey, protocol.getCode(), curve.getCode());
    }

    public byte[] sign(byte[] message, byte[] publicKey, int protocol, int curve) {
        if (taskClient == null) {
            throw new NotConnectedException("client not initialized");
        }
        return taskClient.sign(Context.current(), message, publicKey, protocol, curve);
    }

    public AppPublicKey getPublicKeyByAppId(String appId) {
        if (appIdClient == null) {
            throw new NotConnectedException("user management client not initialized");
        }
        return appIdClient.getPublicKey(Context.current(), appId);
    }

    /** Signs with the key registered for {@code appId}, using its published protocol and curve. */
    public byte[] signWithAppId(byte[] message, String appId) {
        AppPublicKey key = getPublicKeyByAppId(appId);
        int protocol = SignProtocol.codeOf(key.getProtocol());
        int curve = Curve.codeOf(key.getCurve());
        byte[] publicKey;
        try {
            publicKey = BaseEncoding.base64().decode(key.getPublicKey().trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    "failed to decode public key for app id " + appId + ": " + e.getMessage(), e);
        }
        return sign(message, publicKey, protocol, curve);
    }

    /** Node id from the last successful {@link #init}, or 0. */
    public long getNodeId() {
        return config == null ? 0 : config.getNodeId();
    }

    /** Configuration from the last successful {@link #init}, or null. */
    public NodeConfig getNodeConfig() {
        return config;
    }

    /** Applies to the bootstrap round and to every call made through the connected clients. */
    public void setTimeout(Duration timeout) {
        configClient.setTimeout(timeout);
        this.timeout = timeout;
        if (taskClient != null) {
            taskClient.setTimeout(timeout);
        }
        if (appIdClient != null) {
            appIdClient.setTimeout(timeout);
        }
    }

    @Override
    public void close() {
        if (taskClient != null) {
            taskClient.close();
            taskClient = null;
        }
        if (appIdClient != null) {
            appIdClient.close();
            appIdClient = null;
        }
    }
}

package io.teenet.client.core.grpc;

import com.google.common.net.HostAndPort;
import com.google.protobuf.ByteString;

import io.grpc.ChannelCredentials;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.TlsChannelCredentials;

import io.teenet.client.core.config.ChannelSettings;
import io.teenet.client.core.tls.PemUtils;
import io.teenet.client.core.tls.TlsMaterial;
import io.teenet.client.exception.ConnectionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/** Knows how to construct grpc channels using the Credentials API. */
public class ChannelFactory {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelFactory.class);

    public static ChannelFactory create() {
        return new ChannelFactory();
    }

    protected ChannelFactory() {}

    /** Plaintext channel, used only for the bootstrap connection to the configuration service. */
    public ManagedChannel createInsecureChannel(String address, ChannelSettings settings) {
        HostAndPort endpoint = parseAddress(address);
        ManagedChannelBuilder<?> builder =
                newChannelBuilder(endpoint, InsecureChannelCredentials.create(), settings);
        applySettings(builder, settings);
        LOGGER.debug("[GRPC] Creating plaintext channel to {}", endpoint);
        return builder.build();
    }

    /**
     * Mutually-authenticated channel. A non-empty {@code serviceConfig} is installed as the
     * channel default, which is how the retry policy reaches the transport.
     */
    public ManagedChannel createTlsChannel(
            String address,
            TlsMaterial tls,
            ChannelSettings settings,
            Map<String, ?> serviceConfig) {
        HostAndPort endpoint = parseAddress(address);
        ChannelCredentials credentials = buildTlsCredentials(tls);
        ManagedChannelBuilder<?> builder;
        try {
            // the transport parses the key material again and may reject what BouncyCastle accepted
            builder = newChannelBuilder(endpoint, credentials, settings);
        } catch (IllegalArgumentException e) {
            LOGGER.error("Error in create TLS credentials: {}", e.getMessage());
            throw new ConnectionException("failed to create TLS credentials: " + e.getMessage(), e);
        }
        applySettings(builder, settings);
        if (serviceConfig != null && !serviceConfig.isEmpty()) {
            builder.defaultServiceConfig(serviceConfig);
            builder.enableRetry();
        }
        LOGGER.debug("[GRPC] Creating mTLS channel to {}", endpoint);
        return builder.build();
    }

    /** Transport-specific builder. Keepalive is configured here since not every transport has it. */
    protected ManagedChannelBuilder<?> newChannelBuilder(
            HostAndPort endpoint, ChannelCredentials credentials, ChannelSettings settings) {
        return Grpc.newChannelBuilderForAddress(endpoint.getHost(), endpoint.getPort(), credentials)
                .keepAliveTime(settings.getKeepAliveTimeMillis(), TimeUnit.MILLISECONDS)
                .keepAliveTimeout(settings.getKeepAliveTimeoutMillis(), TimeUnit.MILLISECONDS)
                .keepAliveWithoutCalls(settings.isKeepAliveWithoutCalls());
    }

    static HostAndPort parseAddress(String address) {
        if (PemUtils.isBlank(address)) {
            throw new ConnectionException("no address configured");
        }
        HostAndPort endpoint;
        try {
            endpoint = HostAndPort.fromString(address.trim());
        } catch (IllegalArgumentException e) {
            throw new ConnectionException("invalid address '" + address + "'", e);
        }
        if (!endpoint.hasPort()) {
            throw new ConnectionException("address '" + address + "' has no port");
        }
        return endpoint;
    }

    private void applySettings(ManagedChannelBuilder<?> builder, ChannelSettings settings) {
        builder.maxInboundMessageSize(settings.getMaxInboundMessageSize());
        builder.maxInboundMetadataSize(settings.getMaxInboundMetadataSize());
    }

    private ChannelCredentials buildTlsCredentials(TlsMaterial tls) {
        if (tls == null) {
            throw new ConnectionException("TLS material is required");
        }
        try {
            byte[] trusted = requirePem(tls.getTrustedCertPem(), "trusted certificate");
            byte[] cert = requirePem(tls.getClientCertPem(), "client certificate");
            byte[] key = requirePem(tls.getClientKeyPem(), "client private key");
            PemUtils.readCertificates(trusted);
            PemUtils.readCertificates(cert);
            String password = tls.getKeyPassword();
            byte[] pkcs8 =
                    PemUtils.normalizePrivateKeyToPkcs8Pem(
                            key, password == null ? null : password.toCharArray());
            return TlsChannelCredentials.newBuilder()
                    .keyManager(new ByteArrayInputStream(cert), new ByteArrayInputStream(pkcs8))
                    .trustManager(new ByteArrayInputStream(trusted))
                    .build();
        } catch (IOException e) {
            LOGGER.error("Error in create TLS credentials: {}", e.getMessage());
            throw new ConnectionException("failed to create TLS credentials: " + e.getMessage(), e);
        }
    }

    private static byte[] requirePem(ByteString pem, String what) throws IOException {
        if (pem == null || pem.isEmpty()) {
            throw new IOException(what + " is empty");
        }
        return pem.toByteArray();
    }
}

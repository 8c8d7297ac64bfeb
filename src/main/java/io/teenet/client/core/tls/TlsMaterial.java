package io.teenet.client.core.tls;

import com.google.protobuf.ByteString;

import io.teenet.client.core.config.NodeConfig;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * PEM material for a mutually-authenticated channel.
 *
 * <p>The client presents {@code clientCertPem}/{@code clientKeyPem} and trusts only
 * {@code trustedCertPem}, which is the remote node's certificate handed out by the
 * configuration service.
 */
@Data
@Builder
public class TlsMaterial {
    /** Client certificate chain (PEM). */
    private final ByteString clientCertPem;

    /** Client private key (PEM: PKCS#8, SEC1 or PKCS#1). */
    @ToString.Exclude private final ByteString clientKeyPem;

    /** Server certificate or CA bundle to trust (PEM). */
    private final ByteString trustedCertPem;

    /** Password for an encrypted private key. Optional. */
    @ToString.Exclude private final String keyPassword;

    /** Material for the trusted-execution node: own identity, trusting {@code targetCert}. */
    public static TlsMaterial forTrustedExecutionPeer(NodeConfig config) {
        return forPeer(config, config.getTargetCert());
    }

    /** Material for the application node: own identity, trusting {@code appNodeCert}. */
    public static TlsMaterial forApplicationPeer(NodeConfig config) {
        return forPeer(config, config.getAppNodeCert());
    }

    private static TlsMaterial forPeer(NodeConfig config, ByteString peerCert) {
        return TlsMaterial.builder()
                .clientCertPem(config.getCert())
                .clientKeyPem(config.getKey())
                .trustedCertPem(peerCert)
                .build();
    }
}

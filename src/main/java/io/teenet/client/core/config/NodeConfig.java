package io.teenet.client.core.config;

import com.google.protobuf.ByteString;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * Configuration snapshot resolved by one {@link ConfigClient#getConfig} round.
 *
 * <p>Immutable: PEM material is held as {@link ByteString}. A peer that was not reported by the
 * configuration service leaves its address empty and its certificate {@link ByteString#EMPTY}.
 */
@Data
@Builder(toBuilder = true)
public class NodeConfig {
    /** Local node id, an unsigned 32-bit value. */
    private final long nodeId;

    /** This node's certificate (PEM). */
    @Builder.Default private final ByteString cert = ByteString.EMPTY;

    /** This node's private key (PEM). */
    @ToString.Exclude @Builder.Default private final ByteString key = ByteString.EMPTY;

    /** Address of the trusted-execution node. */
    @Builder.Default private final String rpcAddress = "";

    /** Certificate of the trusted-execution node (PEM). */
    @Builder.Default private final ByteString targetCert = ByteString.EMPTY;

    /** Address of the application node. */
    @Builder.Default private final String appNodeAddress = "";

    /** Certificate of the application node (PEM). */
    @Builder.Default private final ByteString appNodeCert = ByteString.EMPTY;

    public boolean hasTrustedExecutionPeer() {
        return !rpcAddress.isEmpty();
    }

    public boolean hasApplicationPeer() {
        return !appNodeAddress.isEmpty();
    }
}

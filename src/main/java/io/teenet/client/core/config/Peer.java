package io.teenet.client.core.config;

import com.google.protobuf.ByteString;

import lombok.Builder;
import lombok.Data;

/** A node discovered through the configuration service. Discarded once a {@link NodeConfig} is built. */
@Data
@Builder
public class Peer {
    private final long id;
    private final String rpcAddress;
    private final ByteString cert;
    private final NodeType type;

    static Peer fromProto(io.teenet.client.proto.nodemanagement.Peer peer) {
        return Peer.builder()
                .id(Integer.toUnsignedLong(peer.getId()))
                .rpcAddress(peer.getRpcAddress())
                .cert(peer.getCert())
                .type(NodeType.fromCode(peer.getType()))
                .build();
    }
}

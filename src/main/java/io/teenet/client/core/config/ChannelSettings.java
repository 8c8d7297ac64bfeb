package io.teenet.client.core.config;

import lombok.Builder;
import lombok.Data;

/** Channel tuning shared by every client. Defaults fit the TEENet node services. */
@Data
@Builder
public class ChannelSettings {
    @Builder.Default private final int maxInboundMessageSize = 4194304;

    @Builder.Default private final int maxInboundMetadataSize = 8192;

    /** Milliseconds {@code close()} waits for in-flight calls before forcing shutdown. */
    @Builder.Default private final int awaitTerminationTimeout = 5000;

    @Builder.Default private final long keepAliveTimeMillis = 30000;

    @Builder.Default private final long keepAliveTimeoutMillis = 5000;

    // Servers reject pings on idle connections unless they opt in.
    @Builder.Default private final boolean keepAliveWithoutCalls = false;

    public static ChannelSettings defaults() {
        return ChannelSettings.builder().build();
    }
}

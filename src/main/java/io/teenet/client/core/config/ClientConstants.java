package io.teenet.client.core.config;

import java.time.Duration;

public final class ClientConstants {
    private ClientConstants() {}

    /** Default budget for the composite client's own operations (init, sign, lookups). */
    public static final Duration DEFAULT_CLIENT_TIMEOUT = Duration.ofSeconds(10);

    /** Default sub-deadline of one {@link ConfigClient#getConfig} round. */
    public static final Duration DEFAULT_CONFIG_TIMEOUT = Duration.ofSeconds(10);

    /** Default sub-deadline of one signing call. */
    public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(10);
}

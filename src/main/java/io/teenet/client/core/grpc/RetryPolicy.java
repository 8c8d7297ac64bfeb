package io.teenet.client.core.grpc;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import io.grpc.Status;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declarative retry policy for unary calls, applied by the gRPC channel rather than by the
 * caller.
 *
 * <p>{@link #toServiceConfig(String...)} renders the policy as a gRPC service config (the same
 * JSON shape as the {@code retryPolicy} block of the gRPC service-config spec) which {@link
 * ChannelFactory} installs as the channel default. The channel waits a random delay in {@code [0,
 * backoffCeiling(n)]} before retry {@code n}.
 */
@Data
@Builder
public class RetryPolicy {
    /** Total attempts including the first one. */
    @Builder.Default private final int maxAttempts = 3;

    @Builder.Default private final Duration initialBackoff = Duration.ofMillis(100);

    @Builder.Default private final Duration maxBackoff = Duration.ofSeconds(1);

    @Builder.Default private final double backoffMultiplier = 2.0;

    @Builder.Default
    private final Set<Status.Code> retryableStatusCodes =
            ImmutableSet.of(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED);

    public static RetryPolicy defaults() {
        return RetryPolicy.builder().build();
    }

    /** A policy that makes a single attempt. */
    public static RetryPolicy none() {
        return RetryPolicy.builder().maxAttempts(1).retryableStatusCodes(ImmutableSet.of()).build();
    }

    public boolean isRetryable(Status.Code code) {
        return maxAttempts > 1 && retryableStatusCodes.contains(code);
    }

    /** Upper bound of the delay before the given retry, 1 being the first retry. */
    public Duration backoffCeiling(int retry) {
        Preconditions.checkArgument(retry >= 1, "retry must be >= 1, got: %s", retry);
        double nanos = initialBackoff.toNanos() * Math.pow(backoffMultiplier, retry - 1);
        if (nanos >= maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * Renders this policy as a service config scoped to the given fully-qualified service names.
     * Returns an empty map when the policy makes a single attempt.
     */
    public Map<String, Object> toServiceConfig(String... serviceNames) {
        validate();
        Preconditions.checkArgument(serviceNames.length > 0, "at least one service name required");
        if (maxAttempts == 1) {
            return ImmutableMap.of();
        }
        ImmutableList.Builder<Object> names = ImmutableList.builder();
        for (String service : serviceNames) {
            names.add(ImmutableMap.of("service", service));
        }
        Map<String, Object> retryPolicy =
                ImmutableMap.<String, Object>builder()
                        .put("maxAttempts", (double) maxAttempts)
                        .put("initialBackoff", toJsonDuration(initialBackoff))
                        .put("maxBackoff", toJsonDuration(maxBackoff))
                        .put("backoffMultiplier", backoffMultiplier)
                        .put("retryableStatusCodes", statusCodeNames())
                        .build();
        Map<String, Object> methodConfig =
                ImmutableMap.of("name", names.build(), "retryPolicy", retryPolicy);
        return ImmutableMap.of("methodConfig", ImmutableList.of(methodConfig));
    }

    private void validate() {
        Preconditions.checkState(maxAttempts >= 1, "maxAttempts must be >= 1, got: %s", maxAttempts);
        Preconditions.checkState(
                !initialBackoff.isNegative() && !initialBackoff.isZero(),
                "initialBackoff must be positive");
        Preconditions.checkState(
                maxBackoff.compareTo(initialBackoff) >= 0, "maxBackoff must be >= initialBackoff");
        Preconditions.checkState(backoffMultiplier > 0, "backoffMultiplier must be positive");
        Preconditions.checkState(
                maxAttempts == 1 || !retryableStatusCodes.isEmpty(),
                "retryableStatusCodes must not be empty when retrying");
    }

    private List<Object> statusCodeNames() {
        ImmutableList.Builder<Object> codes = ImmutableList.builder();
        for (Status.Code code : Status.Code.values()) {
            if (retryableStatusCodes.contains(code)) {
                codes.add(code.name());
            }
        }
        return codes.build();
    }

    static String toJsonDuration(Duration duration) {
        return BigDecimal.valueOf(duration.toNanos(), 9).stripTrailingZeros().toPlainString() + "s";
    }
}

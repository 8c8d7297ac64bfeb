package io.teenet.client.core.grpc;

import com.google.common.base.Preconditions;

import io.grpc.Context;
import io.grpc.Deadline;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

import io.teenet.client.core.config.ChannelSettings;
import io.teenet.client.core.tls.TlsMaterial;
import io.teenet.client.exception.ConnectionException;
import io.teenet.client.exception.NotConnectedException;
import io.teenet.client.exception.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Owns one mutually-authenticated channel to a remote node.
 *
 * <p>Lifecycle is {@code UNCONNECTED -> CONNECTED -> CLOSED}. {@link #connect} replaces any
 * existing channel, {@link #close} is the only way to release it and may be called any number of
 * times. There is no internal synchronization: calls through a connected client may run
 * concurrently, but {@code connect} and {@code close} must be serialized by the caller.
 */
public abstract class AuthenticatedClient implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(AuthenticatedClient.class);

    public enum State {
        UNCONNECTED,
        CONNECTED,
        CLOSED
    }

    private final String peerName;
    private final String address;
    private final String serviceName;
    private final ChannelFactory channelFactory;
    private final ChannelSettings settings;
    private final RetryPolicy retryPolicy;

    private volatile ManagedChannel channel;
    private volatile State state = State.UNCONNECTED;
    private volatile Duration timeout;

    protected AuthenticatedClient(
            String peerName,
            String address,
            String serviceName,
            Duration defaultTimeout,
            ChannelFactory channelFactory,
            ChannelSettings settings,
            RetryPolicy retryPolicy) {
        this.peerName = peerName;
        this.address = address;
        this.serviceName = serviceName;
        this.timeout = defaultTimeout;
        this.channelFactory = Preconditions.checkNotNull(channelFactory, "channelFactory");
        this.settings = Preconditions.checkNotNull(settings, "settings");
        this.retryPolicy = Preconditions.checkNotNull(retryPolicy, "retryPolicy");
    }

    /**
     * Opens the channel. A previously opened channel is closed first, so at most one is live. On
     * failure the client is left {@code UNCONNECTED}.
     *
     * @throws ConnectionException if the address or the TLS material is unusable, or the context
     *     is already cancelled
     */
    public void connect(Context context, TlsMaterial material) {
        Preconditions.checkNotNull(context, "context");
        if (channel != null) {
            LOGGER.info("[GRPC] Replacing existing connection to {}", peerName);
            shutdown(channel);
            channel = null;
        }
        state = State.UNCONNECTED;
        if (context.isCancelled()) {
            throw new ConnectionException(
                    "failed to connect to " + peerName + ": context cancelled",
                    context.cancellationCause());
        }
        ManagedChannel created;
        try {
            created =
                    channelFactory.createTlsChannel(
                            address, material, settings, retryPolicy.toServiceConfig(serviceName));
        } catch (ConnectionException e) {
            throw new ConnectionException(
                    "failed to connect to " + peerName + ": " + e.getMessage(), e);
        }
        // kick off the handshake without waiting for it
        created.getState(true);
        channel = created;
        state = State.CONNECTED;
        LOGGER.info("[GRPC] Connected to {} at {}", peerName, address);
    }

    /** Releases the channel. A no-op when nothing is open. */
    @Override
    public void close() {
        if (channel == null) {
            return;
        }
        shutdown(channel);
        channel = null;
        state = State.CLOSED;
        LOGGER.info("[GRPC] Closed connection to {}", peerName);
    }

    public State getState() {
        return state;
    }

    public boolean isConnected() {
        return state == State.CONNECTED;
    }

    public String getAddress() {
        return address;
    }

    public Duration getTimeout() {
        return timeout;
    }

    /** Sub-deadline applied to calls started after this returns; oversized values are capped. */
    public void setTimeout(Duration timeout) {
        Preconditions.checkArgument(
                timeout != null && !timeout.isNegative() && !timeout.isZero(),
                "timeout must be positive");
        this.timeout = timeout;
    }

    protected ManagedChannel requireChannel() {
        ManagedChannel current = channel;
        if (current == null) {
            throw new NotConnectedException("not connected to " + peerName);
        }
        return current;
    }

    /**
     * Runs a blocking call inside {@code parent} with a deadline of {@code now + timeout}. The
     * effective deadline is the earlier of that and the parent's own; cancelling the parent
     * cancels the call and any pending retry.
     */
    protected <T> T invoke(Context parent, String operation, Function<Deadline, T> call) {
        Preconditions.checkNotNull(parent, "context");
        Deadline deadline =
                Deadline.after(TimeUnit.NANOSECONDS.convert(timeout), TimeUnit.NANOSECONDS);
        Context previous = parent.attach();
        try {
            return call.apply(deadline);
        } catch (StatusRuntimeException e) {
            Status status = e.getStatus();
            LOGGER.warn(
                    "[GRPC] {} to {} failed: {} {}",
                    operation,
                    peerName,
                    status.getCode(),
                    status.getDescription());
            throw new TransportException(
                    "gRPC call failed [" + status.getCode() + "]: " + status.getDescription(),
                    status,
                    e);
        } finally {
            parent.detach(previous);
        }
    }

    private void shutdown(ManagedChannel ch) {
        try {
            if (!ch.shutdown()
                    .awaitTermination(settings.getAwaitTerminationTimeout(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn(
                        "[GRPC] Channel to {} did not terminate within {} ms, forcing shutdown",
                        peerName,
                        settings.getAwaitTerminationTimeout());
                ch.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ch.shutdownNow();
        }
    }
}

package io.teenet.client.exception;

import io.grpc.Status;

/**
 * An RPC failed at the transport level, either immediately for a non-retryable status or after
 * the retry policy gave up. The original {@link Status} is kept for inspection.
 */
public class TransportException extends ClientException {
    private final transient Status status;

    public TransportException(String message, Status status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public Status getStatus() {
        return status;
    }

    public Status.Code getCode() {
        return status.getCode();
    }
}

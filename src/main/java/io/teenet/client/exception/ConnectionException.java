package io.teenet.client.exception;

/** A gRPC channel to a remote node could not be built. */
public class ConnectionException extends ClientException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}

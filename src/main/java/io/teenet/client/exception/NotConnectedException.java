package io.teenet.client.exception;

/** Thrown before any network I/O when a call is made on a client without a live channel. */
public class NotConnectedException extends ClientException {

    public NotConnectedException(String message) {
        super(message);
    }
}

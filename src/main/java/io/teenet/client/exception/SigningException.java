package io.teenet.client.exception;

/** The signing RPC completed but the trusted-execution node reported {@code success=false}. */
public class SigningException extends ClientException {
    private final String serverError;

    public SigningException(String serverError) {
        super("signing failed: " + serverError);
        this.serverError = serverError;
    }

    public String getServerError() {
        return serverError;
    }
}

package io.teenet.client.exception;

/**
 * Base runtime exception for every failure raised by the TEENet client.
 *
 * <pre>
 * ClientException
 * ├── {@link ConnectionException}    - channel could not be established
 * ├── {@link ConfigurationException} - identity or peer data missing from the config service
 * ├── {@link NotConnectedException}  - call attempted without a live channel
 * ├── {@link TransportException}     - RPC failed, carries the gRPC status
 * └── {@link SigningException}       - RPC succeeded but the node reported a signing failure
 * </pre>
 *
 * <p>Empty message or public key arguments are reported with {@link IllegalArgumentException}.
 */
public class ClientException extends RuntimeException {

    public ClientException(String message) {
        super(message);
    }

    public ClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

package io.teenet.client.core.appid;

import lombok.Builder;
import lombok.Data;

/** Public key registered for an application id, as published by the application node. */
@Data
@Builder
public class AppPublicKey {
    /** Base64-encoded public key. */
    private final String publicKey;

    /** Protocol name, e.g. {@code schnorr} or {@code ecdsa}. */
    private final String protocol;

    /** Curve name, e.g. {@code ed25519}. */
    private final String curve;
}

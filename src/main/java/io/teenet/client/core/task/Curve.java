package io.teenet.client.core.task;

import java.util.Locale;

/** Curve tags understood by the trusted-execution node. */
public enum Curve {
    ED25519(1),
    SECP256K1(2),
    SECP256R1(3);

    private final int code;

    Curve(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Resolves a curve name as published by the app-id service. Names are case-insensitive,
     * numeric values pass through unchanged and anything else falls back to Ed25519.
     */
    public static int codeOf(String value) {
        if (value == null) {
            return ED25519.code;
        }
        String trimmed = value.trim();
        for (Curve curve : values()) {
            if (curve.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return curve.code;
            }
        }
        Integer numeric = Codes.parseUnsigned(trimmed);
        return numeric != null ? numeric : ED25519.code;
    }
}

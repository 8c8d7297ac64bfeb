package io.teenet.client.core.task;

import java.util.Locale;

/** Signature protocol tags understood by the trusted-execution node. */
public enum SignProtocol {
    ECDSA(1),
    SCHNORR(2);

    private final int code;

    SignProtocol(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Resolves a protocol name as published by the app-id service. Names are case-insensitive,
     * numeric values pass through unchanged and anything else falls back to Schnorr.
     */
    public static int codeOf(String value) {
        if (value == null) {
            return SCHNORR.code;
        }
        String trimmed = value.trim();
        for (SignProtocol protocol : values()) {
            if (protocol.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return protocol.code;
            }
        }
        Integer numeric = Codes.parseUnsigned(trimmed);
        return numeric != null ? numeric : SCHNORR.code;
    }
}

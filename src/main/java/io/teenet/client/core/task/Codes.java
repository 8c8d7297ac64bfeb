package io.teenet.client.core.task;

import com.google.common.primitives.UnsignedInts;

final class Codes {
    private Codes() {}

    /** Parses an unsigned 32-bit decimal, or returns null. */
    static Integer parseUnsigned(String value) {
        if (value.isEmpty()) {
            return null;
        }
        try {
            return UnsignedInts.parseUnsignedInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

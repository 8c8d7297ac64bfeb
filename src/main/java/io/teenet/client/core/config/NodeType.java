package io.teenet.client.core.config;

/** Node type tags reported by the configuration service for each peer. */
public enum NodeType {
    INVALID(0),
    TRUSTED_EXECUTION(1),
    MESH(2),
    APPLICATION(3);

    private final int code;

    NodeType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /** Unknown codes map to {@link #INVALID}. */
    public static NodeType fromCode(int code) {
        for (NodeType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        return INVALID;
    }
}

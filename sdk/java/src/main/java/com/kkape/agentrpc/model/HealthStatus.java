package com.kkape.agentrpc.model;

/**
 * Serving status reported by the health check. Codes are stable on the wire.
 */
public enum HealthStatus {
    UNKNOWN(0),
    SERVING(1),
    NOT_SERVING(2);

    private final int code;

    HealthStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Map a wire code to a status. Codes this client does not know are UNKNOWN.
     */
    public static HealthStatus fromCode(int code) {
        for (HealthStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}

package com.kkape.agentrpc.model;

/**
 * Kind of log line produced by osquery's logger plugin.
 *
 * <p>The numeric codes match osquery's own enumeration and are what the JSON-RPC
 * transport puts on the wire. The gRPC schema only knows three log types, see
 * {@code LogTypes} in the codec package.</p>
 */
public enum LogType {
    STRING(0),
    SNAPSHOT(1),
    HEALTH(2),
    INIT(3),
    STATUS(4);

    private final int code;

    LogType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static LogType fromCode(int code) {
        for (LogType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown log type: " + code);
    }
}

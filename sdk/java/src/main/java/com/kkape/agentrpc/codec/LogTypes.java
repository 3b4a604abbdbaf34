package com.kkape.agentrpc.codec;

import com.kkape.agentrpc.model.LogType;
import com.kkape.agentrpc.proto.KolideAgentProto;

/**
 * Mapping between osquery log types and the three log types of the gRPC schema.
 *
 * <p>The mapping is lossy: osquery has more log types than the wire enum. Status maps to
 * STATUS, string and snapshot map to RESULT, and everything else is sent as AGENT.
 * Deployed servers depend on this exact behaviour.</p>
 */
public final class LogTypes {

    private LogTypes() {
    }

    public static KolideAgentProto.LogCollection.LogType toWire(LogType logType) {
        if (logType == null) {
            return KolideAgentProto.LogCollection.LogType.AGENT;
        }
        switch (logType) {
            case STATUS:
                return KolideAgentProto.LogCollection.LogType.STATUS;
            case STRING:
            case SNAPSHOT:
                return KolideAgentProto.LogCollection.LogType.RESULT;
            default:
                return KolideAgentProto.LogCollection.LogType.AGENT;
        }
    }

    /**
     * Map a wire log type back to osquery's. Only STATUS and RESULT have a counterpart.
     *
     * @throws IllegalArgumentException for any other wire value
     */
    public static LogType fromWire(KolideAgentProto.LogCollection.LogType wire) {
        switch (wire) {
            case STATUS:
                return LogType.STATUS;
            case RESULT:
                return LogType.SNAPSHOT;
            default:
                throw new IllegalArgumentException("logType " + wire.getNumber() + " not implemented");
        }
    }
}

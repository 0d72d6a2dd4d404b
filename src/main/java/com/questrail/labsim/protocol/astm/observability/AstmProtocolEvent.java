package com.questrail.labsim.protocol.astm.observability;

import java.time.Instant;

/**
 * Record representing a protocol-level happening within a session.
 */
public record AstmProtocolEvent(
    Instant timestamp,
    String sessionId,
    Kind kind,
    String detail
) {
    public enum Kind {
        ENQ_RECEIVED,
        FRAME_ACCEPTED,
        FRAME_DUPLICATE,
        FRAME_REJECTED,
        FRAME_SENT,
        FRAME_NAKED,
        CONTENTION,
        RECEIVER_INTERRUPT,
        FIELD_QUERY_DETECTED,
        STRAY_INPUT,
        CONTENT_REJECTED
    }
}

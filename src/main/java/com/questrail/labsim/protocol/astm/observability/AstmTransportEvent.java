package com.questrail.labsim.protocol.astm.observability;

import java.time.Instant;

/**
 * Record representing a connection lifecycle event.
 */
public record AstmTransportEvent(
    Instant timestamp,
    String sessionId,
    Kind kind,
    String remoteAddress
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED,
        IDLE_TIMEOUT,
        REJECTED_AT_CAPACITY
    }
}

package com.questrail.labsim.protocol.astm.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in a session.
 */
public record AstmErrorEvent(
    Instant timestamp,
    String sessionId,
    String message,
    Throwable cause
) {
}

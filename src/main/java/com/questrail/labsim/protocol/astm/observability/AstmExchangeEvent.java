package com.questrail.labsim.protocol.astm.observability;

import com.questrail.labsim.protocol.astm.ExchangeOutcome;
import com.questrail.labsim.protocol.astm.internal.state.SessionRole;

import java.time.Instant;

/**
 * Terminal status of one exchange (one ENQ..EOT transfer).
 */
public record AstmExchangeEvent(
    Instant timestamp,
    String sessionId,
    SessionRole role,
    ExchangeOutcome outcome,
    int recordCount
) {
}

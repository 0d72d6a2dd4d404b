package com.questrail.labsim.protocol.astm.observability;

import com.questrail.labsim.protocol.astm.internal.state.AstmSessionState;

import java.time.Instant;

/**
 * A session moved from one state to another.
 */
public record AstmPhaseTransitionEvent(
    Instant timestamp,
    String sessionId,
    AstmSessionState oldState,
    AstmSessionState newState
) {
    public boolean isPhaseChange() {
        return oldState.phase() != newState.phase();
    }
}

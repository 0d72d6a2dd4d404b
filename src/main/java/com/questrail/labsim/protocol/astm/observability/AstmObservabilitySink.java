package com.questrail.labsim.protocol.astm.observability;

/**
 * Main interface for receiving link-session observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Sinks are called from session threads, possibly concurrently for different
 * sessions, and must be thread-safe.</p>
 */
public interface AstmObservabilitySink {
    /**
     * Called when a session changes phase.
     */
    void onPhaseTransition(AstmPhaseTransitionEvent event);

    /**
     * Called for protocol-level happenings (frame accepted or rejected, contention).
     */
    void onProtocolEvent(AstmProtocolEvent event);

    /**
     * Called for connection lifecycle events.
     */
    void onTransportEvent(AstmTransportEvent event);

    /**
     * Called when a send or receive exchange ends, successfully or not.
     */
    void onExchangeCompleted(AstmExchangeEvent event);

    /**
     * Called when an error or anomaly occurs in a session.
     */
    void onError(AstmErrorEvent event);
}

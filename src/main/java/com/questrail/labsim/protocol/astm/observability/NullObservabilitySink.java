package com.questrail.labsim.protocol.astm.observability;

/**
 * No-op implementation of AstmObservabilitySink.
 */
public final class NullObservabilitySink implements AstmObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPhaseTransition(AstmPhaseTransitionEvent event) {}

    @Override
    public void onProtocolEvent(AstmProtocolEvent event) {}

    @Override
    public void onTransportEvent(AstmTransportEvent event) {}

    @Override
    public void onExchangeCompleted(AstmExchangeEvent event) {}

    @Override
    public void onError(AstmErrorEvent event) {}
}

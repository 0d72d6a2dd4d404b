package com.questrail.labsim.protocol.astm.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of AstmObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jAstmObservabilitySink implements AstmObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jAstmObservabilitySink.class);

    @Override
    public void onPhaseTransition(AstmPhaseTransitionEvent event) {
        if (event.isPhaseChange()) {
            log.debug("[{}] Phase {} -> {} ({})",
                event.sessionId(),
                event.oldState().phase(),
                event.newState().phase(),
                event.newState().role());
        }
    }

    @Override
    public void onProtocolEvent(AstmProtocolEvent event) {
        switch (event.kind()) {
            case FRAME_REJECTED:
            case FRAME_NAKED:
            case CONTENTION:
            case RECEIVER_INTERRUPT:
            case CONTENT_REJECTED:
                log.warn("[{}] {}: {}", event.sessionId(), event.kind(), event.detail());
                break;
            case FIELD_QUERY_DETECTED:
                log.info("[{}] Field query detected, sending field list", event.sessionId());
                break;
            default:
                log.debug("[{}] {}: {}", event.sessionId(), event.kind(), event.detail());
        }
    }

    @Override
    public void onTransportEvent(AstmTransportEvent event) {
        if (event.kind() == AstmTransportEvent.Kind.REJECTED_AT_CAPACITY) {
            log.warn("[{}] Connection from {} rejected: session limit reached",
                event.sessionId(), event.remoteAddress());
            return;
        }
        log.info("[{}] {} {}", event.sessionId(), event.kind(), event.remoteAddress());
    }

    @Override
    public void onExchangeCompleted(AstmExchangeEvent event) {
        if (event.outcome().isSuccess()) {
            log.info("[{}] {} exchange completed ({} records)",
                event.sessionId(), event.role(), event.recordCount());
        } else {
            log.warn("[{}] {} exchange failed: {}",
                event.sessionId(), event.role(), event.outcome());
        }
    }

    @Override
    public void onError(AstmErrorEvent event) {
        log.error("[{}] {}", event.sessionId(), event.message(), event.cause());
    }
}

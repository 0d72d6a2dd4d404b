package com.questrail.labsim.protocol.astm.internal.events;

import java.time.Instant;

/**
 * LinkControlEvent
 * -----------------------------------------------------------------------------
 * Single control characters received outside a frame.
 */
public sealed interface LinkControlEvent extends LinkEvent
        permits LinkControlEvent.EnqReceived, LinkControlEvent.EotReceived
{
    /** Peer requests to establish (or re-establish) a transfer. */
    final class EnqReceived extends LinkEvent.Base implements LinkControlEvent {
        public EnqReceived(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Peer ends the transfer. */
    final class EotReceived extends LinkEvent.Base implements LinkControlEvent {
        public EotReceived(Instant timestamp) {
            super(timestamp);
        }
    }
}

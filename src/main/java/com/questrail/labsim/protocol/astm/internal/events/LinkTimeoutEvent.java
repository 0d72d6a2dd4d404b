package com.questrail.labsim.protocol.astm.internal.events;

import java.time.Instant;

/**
 * LinkTimeoutEvent
 * -----------------------------------------------------------------------------
 * Deadline expiries visible to the receiver state machine.
 */
public sealed interface LinkTimeoutEvent extends LinkEvent
        permits LinkTimeoutEvent.ReceiverTimeout
{
    /** No frame or EOT arrived within the receiver timeout. */
    final class ReceiverTimeout extends LinkEvent.Base implements LinkTimeoutEvent {
        public ReceiverTimeout(Instant timestamp) {
            super(timestamp);
        }
    }
}

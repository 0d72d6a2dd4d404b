package com.questrail.labsim.protocol.astm.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * LinkEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything the receiver state machine reacts to.
 *
 * <p>The session driver turns link bytes and expired deadlines into events and
 * feeds them to the reducer one at a time. Events are immutable and carry only
 * what is needed to advance state; the timestamp is for observability.</p>
 */
public interface LinkEvent
{
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements LinkEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}

package com.questrail.labsim.protocol.astm.internal.events;

import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;
import com.questrail.labsim.protocol.astm.internal.state.FrameRejection;

import java.time.Instant;
import java.util.Objects;

/**
 * LinkFrameEvent
 * -----------------------------------------------------------------------------
 * Outcome of reading one {@code STX ... LF} unit from the link.
 */
public sealed interface LinkFrameEvent extends LinkEvent
        permits LinkFrameEvent.FrameReceived, LinkFrameEvent.FrameRejected
{
    /** A frame passed structure and checksum validation. */
    final class FrameReceived extends LinkEvent.Base implements LinkFrameEvent {
        private final AstmFrame frame;

        public FrameReceived(Instant timestamp, AstmFrame frame) {
            super(timestamp);
            this.frame = Objects.requireNonNull(frame, "frame");
        }

        public AstmFrame frame() {
            return frame;
        }
    }

    /** A frame failed decoding. */
    final class FrameRejected extends LinkEvent.Base implements LinkFrameEvent {
        private final FrameRejection reason;
        private final String detail;

        public FrameRejected(Instant timestamp, FrameRejection reason, String detail) {
            super(timestamp);
            this.reason = Objects.requireNonNull(reason, "reason");
            this.detail = detail == null ? "" : detail;
        }

        public FrameRejection reason() {
            return reason;
        }

        public String detail() {
            return detail;
        }
    }
}

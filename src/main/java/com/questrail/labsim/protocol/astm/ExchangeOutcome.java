package com.questrail.labsim.protocol.astm;

/**
 * Terminal status of one ENQ..EOT exchange, as reported to logs and to
 * control-surface callers.
 */
public enum ExchangeOutcome {
    /** All frames acknowledged and EOT exchanged. */
    COMPLETED,

    /** The receiver answered a frame with EOT; transmission stopped early. */
    RECEIVER_INTERRUPT,

    /** Six consecutive failures on one frame; the session was closed. */
    RETRANSMISSION_LIMIT_EXCEEDED,

    /** No reply to ENQ within the establishment timeout. */
    ESTABLISHMENT_TIMEOUT,

    /** No reply to a frame within the frame ACK timeout. */
    FRAME_ACK_TIMEOUT,

    /** No frame or EOT within the receiver timeout. */
    RECEIVER_TIMEOUT,

    /** ENQ contention persisted beyond the configured retry limit. */
    CONTENTION_UNRESOLVED,

    /** The peer answered ENQ with NAK. */
    ESTABLISHMENT_REFUSED,

    /** A record holds a character not allowed in frame text; nothing was sent. */
    CONTENT_REJECTED,

    /** The connection closed mid-exchange. */
    TRANSPORT_CLOSED;

    public boolean isSuccess() {
        return this == COMPLETED;
    }
}

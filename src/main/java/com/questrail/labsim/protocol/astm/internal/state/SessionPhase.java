package com.questrail.labsim.protocol.astm.internal.state;

/**
 * Phases of one link session.
 */
public enum SessionPhase {
    /** Neutral: no transfer in progress. */
    IDLE,

    /** ENQ sent as Initiator; waiting for ACK, NAK or a contending ENQ. */
    AWAIT_ESTABLISH_RESPONSE,

    /** Peer is sending; frames are being accepted. */
    ESTABLISHED_RECEIVER,

    /** Simulator is sending frames and waiting for frame ACKs. */
    ESTABLISHED_SENDER,

    /** Both sides sent ENQ; backing off before retrying. */
    CONTENTION,

    /** Sending EOT to end a transfer. */
    TERMINATING,

    /** Retransmission limit exceeded; the session is closing. */
    ABORTED
}

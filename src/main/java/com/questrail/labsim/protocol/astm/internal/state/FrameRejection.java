package com.questrail.labsim.protocol.astm.internal.state;

import com.questrail.labsim.protocol.astm.codec.AstmFrameException;

/**
 * Reasons a received frame is answered with NAK. All of them count toward the
 * same retransmission budget.
 */
public enum FrameRejection {
    CHECKSUM_MISMATCH,
    MALFORMED_FRAME,
    FRAME_SEQUENCE_ERROR;

    public static FrameRejection from(AstmFrameException.Reason reason) {
        switch (reason) {
            case CHECKSUM_MISMATCH: return CHECKSUM_MISMATCH;
            case MALFORMED_FRAME:   return MALFORMED_FRAME;
            default: throw new IllegalArgumentException("Unknown reason: " + reason);
        }
    }
}

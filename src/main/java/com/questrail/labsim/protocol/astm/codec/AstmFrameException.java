package com.questrail.labsim.protocol.astm.codec;

import java.util.Objects;

/**
 * AstmFrameException
 * -----------------------------------------------------------------------------
 * Raised by an {@link AstmFrameDecoder} when a received byte sequence is not an
 * acceptable frame. The session answers every such failure with NAK.
 */
public final class AstmFrameException extends Exception
{
    /**
     * Why a frame was rejected.
     */
    public enum Reason {
        /** Structure violated: delimiters, frame digit, checksum digits or restricted text bytes. */
        MALFORMED_FRAME,

        /** Structure valid but the transmitted checksum differs from the computed one. */
        CHECKSUM_MISMATCH
    }

    private final Reason reason;

    public AstmFrameException(Reason reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason()
    {
        return reason;
    }
}

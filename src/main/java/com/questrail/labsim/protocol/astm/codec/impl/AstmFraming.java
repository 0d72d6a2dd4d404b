package com.questrail.labsim.protocol.astm.codec.impl;

/**
 * AstmFraming
 * -----------------------------------------------------------------------------
 * Structural constants and restricted-character rules for LIS1-A frames.
 */
final class AstmFraming
{
    /** STX + digit + ETX + two checksum digits + CR + LF, with empty text. */
    static final int MIN_FRAME_LENGTH = 7;

    /** Bytes following the text: terminator, two checksum digits, CR, LF. */
    static final int TRAILER_LENGTH = 5;

    /** Offset of the first text byte (after STX and the frame digit). */
    static final int TEXT_OFFSET = 2;

    private AstmFraming() {}

    /**
     * Returns true if the byte may not appear inside record text.
     *
     * <p>Restricted: 0x01-0x06, 0x10-0x17 (which covers NAK and ETB) and LF.
     * The only LF on the wire is the final byte of the frame.</p>
     */
    static boolean isRestricted(byte b)
    {
        int v = b & 0xFF;
        return (v >= 0x01 && v <= 0x06)
                || (v >= 0x10 && v <= 0x17)
                || v == 0x0A;
    }

    /**
     * Returns the index of the first restricted byte in the range, or -1.
     */
    static int firstRestricted(byte[] data, int off, int len)
    {
        for (int i = off; i < off + len; i++) {
            if (isRestricted(data[i])) {
                return i;
            }
        }
        return -1;
    }

    static boolean isFrameDigit(byte b)
    {
        return b >= '1' && b <= '7';
    }
}

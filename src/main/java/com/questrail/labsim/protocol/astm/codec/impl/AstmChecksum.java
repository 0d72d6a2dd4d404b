package com.questrail.labsim.protocol.astm.codec.impl;

/**
 * AstmChecksum
 * -----------------------------------------------------------------------------
 * LIS1-A frame checksum.
 *
 * <p>The checksum is the sum of every byte from the frame-number digit through
 * the ETX (or ETB) byte inclusive, modulo 256, transmitted as two uppercase
 * hexadecimal ASCII digits (most significant nibble first).</p>
 */
final class AstmChecksum
{
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private AstmChecksum() {}

    /**
     * Computes the modulo-256 sum of {@code data[off .. off+len)}.
     */
    static int compute(byte[] data, int off, int len)
    {
        int sum = 0;
        for (int i = off; i < off + len; i++) {
            sum += data[i] & 0xFF;
        }
        return sum & 0xFF;
    }

    /**
     * Renders a checksum as its two uppercase hex digits.
     */
    static byte[] toHexDigits(int checksum)
    {
        return new byte[] {
                (byte) HEX[(checksum >>> 4) & 0x0F],
                (byte) HEX[checksum & 0x0F]
        };
    }

    /**
     * Parses two transmitted hex digits. Lowercase digits are tolerated.
     *
     * @return the checksum value, or -1 if either byte is not a hex digit
     */
    static int parseHexDigits(byte hi, byte lo)
    {
        int h = Character.digit((char) (hi & 0xFF), 16);
        int l = Character.digit((char) (lo & 0xFF), 16);
        if (h < 0 || l < 0) {
            return -1;
        }
        return (h << 4) | l;
    }
}

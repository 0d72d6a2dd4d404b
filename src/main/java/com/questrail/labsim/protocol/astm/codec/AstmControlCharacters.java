package com.questrail.labsim.protocol.astm.codec;

/**
 * AstmControlCharacters
 * -----------------------------------------------------------------------------
 * Single-byte control characters of the CLSI LIS1-A link layer.
 */
public final class AstmControlCharacters
{
    public static final byte ENQ = 0x05;
    public static final byte ACK = 0x06;
    public static final byte NAK = 0x15;
    public static final byte EOT = 0x04;
    public static final byte STX = 0x02;
    public static final byte ETX = 0x03;
    public static final byte ETB = 0x17;
    public static final byte CR  = 0x0D;
    public static final byte LF  = 0x0A;

    private AstmControlCharacters() {}

    /**
     * Returns a printable name for a link byte, used in logs.
     */
    public static String describe(int b)
    {
        switch (b & 0xFF) {
            case ENQ: return "<ENQ>";
            case ACK: return "<ACK>";
            case NAK: return "<NAK>";
            case EOT: return "<EOT>";
            case STX: return "<STX>";
            case ETX: return "<ETX>";
            case ETB: return "<ETB>";
            case CR:  return "<CR>";
            case LF:  return "<LF>";
            default:
                int v = b & 0xFF;
                if (v >= 0x20 && v < 0x7F) {
                    return String.valueOf((char) v);
                }
                return String.format("<0x%02X>", v);
        }
    }
}

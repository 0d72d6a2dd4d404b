package com.questrail.labsim.protocol.astm.codec.impl;

import com.questrail.labsim.protocol.astm.codec.AstmFrameException;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultAstmFrameDecoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultAstmFrameDecoder}.
 *
 * <p>Frames are assembled byte by byte here rather than through the encoder,
 * so each test controls exactly what goes on the wire.</p>
 */
final class DefaultAstmFrameDecoderTest
{
    private final DefaultAstmFrameDecoder decoder = new DefaultAstmFrameDecoder();

    @Test
    void decodesFinalFrame() throws Exception
    {
        AstmFrame frame = decoder.decode(frame("1", "L|1|N", 0x03, "F7"));

        assertEquals(1, frame.frameNumber());
        assertEquals("L|1|N", frame.text());
        assertFalse(frame.intermediate());
    }

    @Test
    void decodesIntermediateFrame() throws Exception
    {
        AstmFrame frame = decoder.decode(frame("1", "ABC", 0x17, "0E"));

        assertEquals("ABC", frame.text());
        assertTrue(frame.intermediate());
    }

    @Test
    void decodesEmptyText() throws Exception
    {
        AstmFrame frame = decoder.decode(frame("1", "", 0x03, "34"));
        assertEquals("", frame.text());
    }

    @Test
    void acceptsLowercaseChecksumDigits() throws Exception
    {
        assertEquals("L|1|N", decoder.decode(frame("1", "L|1|N", 0x03, "f7")).text());
    }

    @Test
    void wrongChecksumIsMismatchNotMalformed()
    {
        AstmFrameException e = assertThrows(AstmFrameException.class,
                () -> decoder.decode(frame("1", "L|1|N", 0x03, "00")));
        assertEquals(AstmFrameException.Reason.CHECKSUM_MISMATCH, e.reason());
    }

    @Test
    void changedFrameNumberBreaksChecksum()
    {
        AstmFrameException e = assertThrows(AstmFrameException.class,
                () -> decoder.decode(frame("2", "L|1|N", 0x03, "F7")));
        assertEquals(AstmFrameException.Reason.CHECKSUM_MISMATCH, e.reason());
    }

    @Test
    void missingStxIsMalformed()
    {
        byte[] bytes = frame("1", "L|1|N", 0x03, "F7");
        bytes[0] = 'X';
        assertMalformed(bytes);
    }

    @Test
    void missingCrLfIsMalformed()
    {
        byte[] bytes = frame("1", "L|1|N", 0x03, "F7");
        bytes[bytes.length - 2] = ' ';
        assertMalformed(bytes);
    }

    @Test
    void missingEtxIsMalformed()
    {
        byte[] bytes = frame("1", "L|1|N", 0x03, "F7");
        bytes[bytes.length - 5] = 'N';
        assertMalformed(bytes);
    }

    @Test
    void frameNumberOutsideOneToSevenIsMalformed()
    {
        assertMalformed(frame("0", "L|1|N", 0x03, "F6"));
        assertMalformed(frame("8", "L|1|N", 0x03, "FE"));
    }

    @Test
    void nonHexChecksumIsMalformed()
    {
        assertMalformed(frame("1", "L|1|N", 0x03, "ZZ"));
    }

    @Test
    void restrictedCharacterInTextIsMalformed()
    {
        assertMalformed(frame("1", "A\u0005B", 0x03, checksum("1", "A\u0005B", 0x03)));
        assertMalformed(frame("1", "A\u0015B", 0x03, checksum("1", "A\u0015B", 0x03)));
        assertMalformed(frame("1", "A\nB", 0x03, checksum("1", "A\nB", 0x03)));
    }

    @Test
    void carriageReturnInTextIsAllowed() throws Exception
    {
        AstmFrame frame = decoder.decode(frame("1", "P|1\r", 0x03, checksum("1", "P|1\r", 0x03)));
        assertEquals("P|1\r", frame.text());
    }

    @Test
    void tooShortIsMalformed()
    {
        assertMalformed(new byte[] { 0x02, '1', 0x03, '\r', '\n' });
    }

    @Test
    void multiByteUtf8TextIsDecoded() throws Exception
    {
        // micro sign is C2 B5; 31 + C2 + B5 + 03 = 0x1AB
        byte[] bytes = { 0x02, '1', (byte) 0xC2, (byte) 0xB5, 0x03, 'A', 'B', '\r', '\n' };
        assertEquals("\u00B5", decoder.decode(bytes).text());
    }

    @Test
    void invalidUtf8TextIsMalformedEvenWithMatchingChecksum()
    {
        // C3 28 is a truncated two-byte sequence; 31 + 52 + C3 + 28 + 03 = 0x171
        assertMalformed(new byte[] { 0x02, '1', 'R', (byte) 0xC3, 0x28, 0x03, '7', '1', '\r', '\n' });
    }

    private void assertMalformed(byte[] bytes)
    {
        AstmFrameException e = assertThrows(AstmFrameException.class, () -> decoder.decode(bytes));
        assertEquals(AstmFrameException.Reason.MALFORMED_FRAME, e.reason());
    }

    private static byte[] frame(String digit, String text, int terminator, String checksum)
    {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x02);
        out.writeBytes(digit.getBytes(StandardCharsets.US_ASCII));
        out.writeBytes(text.getBytes(StandardCharsets.US_ASCII));
        out.write(terminator);
        out.writeBytes(checksum.getBytes(StandardCharsets.US_ASCII));
        out.write('\r');
        out.write('\n');
        return out.toByteArray();
    }

    private static String checksum(String digit, String text, int terminator)
    {
        int sum = terminator;
        for (byte b : (digit + text).getBytes(StandardCharsets.US_ASCII)) {
            sum += b & 0xFF;
        }
        return String.format("%02X", sum & 0xFF);
    }
}

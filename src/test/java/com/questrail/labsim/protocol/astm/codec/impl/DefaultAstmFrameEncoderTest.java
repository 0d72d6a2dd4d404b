package com.questrail.labsim.protocol.astm.codec.impl;

import com.questrail.labsim.protocol.astm.codec.AstmControlCharacters;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultAstmFrameEncoderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultAstmFrameEncoder}: exact wire bytes, ETB
 * frames, restricted characters and agreement with the decoder.
 */
final class DefaultAstmFrameEncoderTest
{
    private final DefaultAstmFrameEncoder encoder = new DefaultAstmFrameEncoder();

    @Test
    void encodesHeaderFrameExactly()
    {
        byte[] expected = "\u00021H|\\^&|||A^B^1.0|||||||LIS2-A2\u000338\r\n".getBytes(StandardCharsets.US_ASCII);
        byte[] actual = encoder.encode(1, "H|\\^&|||A^B^1.0|||||||LIS2-A2");

        assertEquals(AstmControlCharacters.describe(expected), AstmControlCharacters.describe(actual));
    }

    @Test
    void encodesTerminatorFrameExactly()
    {
        byte[] expected = "\u00021L|1|N\u0003F7\r\n".getBytes(StandardCharsets.US_ASCII);
        assertArrayEquals(expected, encoder.encode(1, "L|1|N"));
    }

    @Test
    void intermediateFrameEndsWithEtb()
    {
        byte[] bytes = encoder.encode(new AstmFrame(1, "ABC", true));
        assertEquals(AstmControlCharacters.ETB, bytes[bytes.length - 5]);
        assertEquals('0', bytes[bytes.length - 4]);
        assertEquals('E', bytes[bytes.length - 3]);
    }

    @Test
    void checksumDigitsAreUppercase()
    {
        byte[] bytes = encoder.encode(1, "L|1|N");
        assertEquals('F', bytes[bytes.length - 4]);
    }

    @Test
    void rejectsRestrictedCharacters()
    {
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, "A\u0002B"));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, "A\u0017B"));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode(1, "A\nB"));
    }

    @Test
    void decoderRecoversNumberTextAndTerminator() throws Exception
    {
        DefaultAstmFrameDecoder decoder = new DefaultAstmFrameDecoder();
        String[] texts = {
                "",
                "H|\\^&|||Sysmex^XN-1000^V1.0|||||||LIS2-A2|20250115080000",
                "R|1|^^^WBC^White Blood Cell Count|5.8|10^3/uL|4.5-11.0|N||F",
                "P|1||PAT\r",
                "O|1|SAMPLE-001||^^^WBC\\^^^RBC"
        };
        for (int n = 1; n <= 7; n++) {
            for (String text : texts) {
                AstmFrame frame = new AstmFrame(n, text, n % 2 == 0);
                assertEquals(frame, decoder.decode(encoder.encode(frame)));
            }
        }
    }
}

package com.questrail.labsim.protocol.astm.codec.impl;

import com.questrail.labsim.protocol.astm.codec.AstmControlCharacters;
import com.questrail.labsim.protocol.astm.codec.AstmFrameEncoder;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * DefaultAstmFrameEncoder
 * -----------------------------------------------------------------------------
 * Default implementation of {@link AstmFrameEncoder}.
 *
 * <p>Outbound layout:</p>
 * <pre>
 *   STX  digit  text  ETX|ETB  cs-hi  cs-lo  CR  LF
 * </pre>
 *
 * <p>The checksum is computed over the UTF-8 encoded bytes from the digit
 * through the terminator.</p>
 */
public final class DefaultAstmFrameEncoder implements AstmFrameEncoder
{
    @Override
    public byte[] encode(AstmFrame frame)
    {
        Objects.requireNonNull(frame, "frame");

        byte[] text = frame.text().getBytes(StandardCharsets.UTF_8);
        int restricted = AstmFraming.firstRestricted(text, 0, text.length);
        if (restricted >= 0) {
            throw new IllegalArgumentException(String.format(
                    "Record text contains restricted character %s at index %d",
                    AstmControlCharacters.describe(text[restricted]), restricted));
        }

        byte[] out = new byte[text.length + AstmFraming.MIN_FRAME_LENGTH];
        int i = 0;
        out[i++] = AstmControlCharacters.STX;
        out[i++] = (byte) ('0' + frame.frameNumber());
        System.arraycopy(text, 0, out, i, text.length);
        i += text.length;
        out[i++] = frame.intermediate() ? AstmControlCharacters.ETB : AstmControlCharacters.ETX;

        byte[] cs = AstmChecksum.toHexDigits(AstmChecksum.compute(out, 1, i - 1));
        out[i++] = cs[0];
        out[i++] = cs[1];
        out[i++] = AstmControlCharacters.CR;
        out[i] = AstmControlCharacters.LF;
        return out;
    }
}

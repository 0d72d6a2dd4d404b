package com.questrail.labsim.protocol.astm.codec.impl;

import com.questrail.labsim.protocol.astm.codec.AstmControlCharacters;
import com.questrail.labsim.protocol.astm.codec.AstmFrameDecoder;
import com.questrail.labsim.protocol.astm.codec.AstmFrameException;
import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static com.questrail.labsim.protocol.astm.codec.AstmFrameException.Reason.CHECKSUM_MISMATCH;
import static com.questrail.labsim.protocol.astm.codec.AstmFrameException.Reason.MALFORMED_FRAME;

/**
 * DefaultAstmFrameDecoder
 * -----------------------------------------------------------------------------
 * Default implementation of {@link AstmFrameDecoder}.
 *
 * <h2>Decoding pipeline</h2>
 * <ol>
 *   <li>Validate delimiters: STX first, CR LF last, ETX or ETB before the
 *       checksum digits</li>
 *   <li>Validate the frame-number digit ('1'..'7')</li>
 *   <li>Parse the two checksum digits</li>
 *   <li>Reject restricted bytes in the text</li>
 *   <li>Recompute and compare the checksum</li>
 *   <li>Decode the text as strict UTF-8</li>
 * </ol>
 *
 * <p>Every structural failure is reported as {@code MALFORMED_FRAME}; only a
 * structurally valid frame whose sum disagrees yields {@code CHECKSUM_MISMATCH}.</p>
 */
public final class DefaultAstmFrameDecoder implements AstmFrameDecoder
{
    @Override
    public AstmFrame decode(byte[] frameBytes) throws AstmFrameException
    {
        Objects.requireNonNull(frameBytes, "frameBytes");

        final int len = frameBytes.length;
        if (len < AstmFraming.MIN_FRAME_LENGTH) {
            throw new AstmFrameException(MALFORMED_FRAME, "Frame too short: " + len + " bytes");
        }
        if (frameBytes[0] != AstmControlCharacters.STX) {
            throw new AstmFrameException(MALFORMED_FRAME, "Frame does not start with STX");
        }
        if (frameBytes[len - 2] != AstmControlCharacters.CR
                || frameBytes[len - 1] != AstmControlCharacters.LF) {
            throw new AstmFrameException(MALFORMED_FRAME, "Frame does not end with CR LF");
        }

        final int terminatorIndex = len - AstmFraming.TRAILER_LENGTH;
        final byte terminator = frameBytes[terminatorIndex];
        if (terminator != AstmControlCharacters.ETX && terminator != AstmControlCharacters.ETB) {
            throw new AstmFrameException(MALFORMED_FRAME, "Missing ETX/ETB before checksum");
        }

        final byte digit = frameBytes[1];
        if (!AstmFraming.isFrameDigit(digit)) {
            throw new AstmFrameException(MALFORMED_FRAME,
                    "Invalid frame number " + AstmControlCharacters.describe(digit));
        }

        final int transmitted = AstmChecksum.parseHexDigits(
                frameBytes[terminatorIndex + 1], frameBytes[terminatorIndex + 2]);
        if (transmitted < 0) {
            throw new AstmFrameException(MALFORMED_FRAME, "Checksum digits are not hexadecimal");
        }

        final int textLength = terminatorIndex - AstmFraming.TEXT_OFFSET;
        final int restricted = AstmFraming.firstRestricted(frameBytes, AstmFraming.TEXT_OFFSET, textLength);
        if (restricted >= 0) {
            throw new AstmFrameException(MALFORMED_FRAME, String.format(
                    "Restricted character %s at offset %d",
                    AstmControlCharacters.describe(frameBytes[restricted]), restricted));
        }

        // Digit through terminator inclusive.
        final int computed = AstmChecksum.compute(frameBytes, 1, terminatorIndex);
        if (computed != transmitted) {
            throw new AstmFrameException(CHECKSUM_MISMATCH, String.format(
                    "Checksum mismatch: transmitted=%02X computed=%02X", transmitted, computed));
        }

        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(frameBytes, AstmFraming.TEXT_OFFSET, textLength))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new AstmFrameException(MALFORMED_FRAME, "Frame text is not valid UTF-8");
        }
        return new AstmFrame(digit - '0', text, terminator == AstmControlCharacters.ETB);
    }
}

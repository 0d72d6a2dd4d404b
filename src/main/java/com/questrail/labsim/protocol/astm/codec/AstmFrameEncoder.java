package com.questrail.labsim.protocol.astm.codec;

import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;

/**
 * AstmFrameEncoder
 * -----------------------------------------------------------------------------
 * Byte-level encoder for LIS1-A frames.
 */
public interface AstmFrameEncoder
{
    /**
     * Encode a frame into {@code STX n text ETX|ETB cs1 cs2 CR LF}.
     *
     * @throws IllegalArgumentException if the text contains a restricted byte
     */
    byte[] encode(AstmFrame frame);

    /**
     * Convenience for the common case of a final (ETX) frame.
     */
    default byte[] encode(int frameNumber, String recordText)
    {
        return encode(new AstmFrame(frameNumber, recordText, false));
    }
}

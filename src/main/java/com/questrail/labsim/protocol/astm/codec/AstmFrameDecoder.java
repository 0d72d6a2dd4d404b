package com.questrail.labsim.protocol.astm.codec;

import com.questrail.labsim.protocol.astm.internal.frame.AstmFrame;

/**
 * AstmFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for one LIS1-A frame.
 *
 * <p>The input is exactly one frame as read from the link, from {@code STX}
 * through the trailing {@code LF}. The decoder validates structure and checksum
 * and constructs an {@link AstmFrame}; it never looks at frame sequencing.</p>
 */
public interface AstmFrameDecoder
{
    /**
     * Decode a complete frame.
     *
     * @param frameBytes bytes from STX through LF inclusive
     * @return the decoded frame
     * @throws AstmFrameException if the bytes are malformed or fail the checksum
     */
    AstmFrame decode(byte[] frameBytes) throws AstmFrameException;
}

package com.questrail.labsim.protocol.astm.internal.frame;

import java.util.Objects;

/**
 * AstmFrame
 * -----------------------------------------------------------------------------
 * Immutable representation of one LIS1-A frame <em>after</em> delimiting and
 * checksum validation.
 *
 * <h2>What a frame is</h2>
 * A frame carries one numbered chunk of record text. A record that fits in one
 * frame is sent in a final frame (terminated by ETX). Longer records are split
 * across intermediate frames (terminated by ETB) followed by a final frame.
 *
 * <h2>What a frame is not</h2>
 * <ul>
 *   <li>It does not carry the checksum. The checksum is a wire concern and is
 *       always recomputed by the codec, never stored or trusted.</li>
 *   <li>It does not know whether its number is in sequence. That is decided by
 *       the session.</li>
 * </ul>
 */
public final class AstmFrame
{
    public static final int MIN_FRAME_NUMBER = 1;
    public static final int MAX_FRAME_NUMBER = 7;

    private final int frameNumber;
    private final String text;
    private final boolean intermediate;

    /**
     * @param frameNumber  frame number in 1..7
     * @param text         record text (may be empty, never null)
     * @param intermediate true if the frame is terminated by ETB rather than ETX
     */
    public AstmFrame(int frameNumber, String text, boolean intermediate)
    {
        if (frameNumber < MIN_FRAME_NUMBER || frameNumber > MAX_FRAME_NUMBER) {
            throw new IllegalArgumentException("frameNumber must be in 1..7: " + frameNumber);
        }
        this.frameNumber = frameNumber;
        this.text = Objects.requireNonNull(text, "text");
        this.intermediate = intermediate;
    }

    public int frameNumber() {
        return frameNumber;
    }

    public String text() {
        return text;
    }

    /**
     * Returns true if this frame is terminated by ETB (more text follows).
     */
    public boolean intermediate() {
        return intermediate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstmFrame)) return false;
        AstmFrame other = (AstmFrame) o;
        return frameNumber == other.frameNumber
                && intermediate == other.intermediate
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frameNumber, text, intermediate);
    }

    @Override
    public String toString() {
        return "AstmFrame{" +
                "frameNumber=" + frameNumber +
                ", intermediate=" + intermediate +
                ", text='" + text + '\'' +
                '}';
    }
}

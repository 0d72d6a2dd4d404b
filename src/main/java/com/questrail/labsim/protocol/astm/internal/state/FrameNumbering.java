package com.questrail.labsim.protocol.astm.internal.state;

/**
 * FrameNumbering
 * -----------------------------------------------------------------------------
 * LIS1-A frame-number arithmetic. Numbers cycle 1..7 then wrap to 1 (never 0).
 */
public final class FrameNumbering
{
    /** Sentinel for "no frame accepted yet in this transfer". */
    public static final int UNSET = 0;

    /**
     * How a received frame number relates to the last accepted one.
     */
    public enum Classification {
        /** The expected next frame (or any valid first frame). */
        NEW,
        /** Same number as the last accepted frame: our ACK was lost. */
        DUPLICATE,
        /** Anything else. */
        OUT_OF_SEQUENCE
    }

    private FrameNumbering() {}

    /**
     * Returns the frame number that follows {@code n}. {@code next(UNSET)} is 1.
     */
    public static int next(int n)
    {
        return (n % 7) + 1;
    }

    public static Classification classify(int lastAccepted, int received)
    {
        if (received < 1 || received > 7) {
            return Classification.OUT_OF_SEQUENCE;
        }
        if (lastAccepted == UNSET) {
            return Classification.NEW;
        }
        if (received == lastAccepted) {
            return Classification.DUPLICATE;
        }
        return received == next(lastAccepted)
                ? Classification.NEW
                : Classification.OUT_OF_SEQUENCE;
    }
}

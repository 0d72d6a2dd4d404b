package com.questrail.labsim.protocol.astm.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every link deadline (establishment, frame ACK, receiver,
 * idle) and for push scheduling.
 *
 * <p>Wall-clock time may jump; deadlines computed from it could fire early or
 * never. Only elapsed-time arithmetic on these ticks is meaningful.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     */
    long nowNanos();
}

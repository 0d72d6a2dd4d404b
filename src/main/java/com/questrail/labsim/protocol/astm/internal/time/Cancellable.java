package com.questrail.labsim.protocol.astm.internal.time;

/**
 * Cancellation handle for a scheduled task.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancelled; {@code false} if it already ran or was
     *         cancelled before
     */
    boolean cancel();
}

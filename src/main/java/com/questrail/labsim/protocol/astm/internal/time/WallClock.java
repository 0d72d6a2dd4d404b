package com.questrail.labsim.protocol.astm.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for event timestamps, observability records and the
 * date/time fields of generated ASTM records.
 *
 * <p>Never used for deadlines; see {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}

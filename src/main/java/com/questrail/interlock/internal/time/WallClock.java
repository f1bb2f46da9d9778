package com.questrail.interlock.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly to timestamp observability events.
 * It MUST NOT be used for deadlines.
 */
public interface WallClock
{
    Instant now();
}

package com.tasknexus.channel.feishu.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for observability timestamps.
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();
}

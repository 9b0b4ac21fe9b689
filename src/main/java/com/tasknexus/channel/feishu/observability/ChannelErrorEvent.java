package com.tasknexus.channel.feishu.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the Feishu channel.
 *
 * @param cause the underlying failure; may be {@code null}
 */
public record ChannelErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

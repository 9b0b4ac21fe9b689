package com.tasknexus.channel.feishu.observability;

import java.time.Instant;

/**
 * Record describing an inbound event that was not delivered to the consumer.
 *
 * @param messageId platform message id; may be {@code null} when the event
 *                  carried none
 * @param cause     decode failure, if any
 */
public record DroppedEventNotice(
    Instant timestamp,
    String messageId,
    Reason reason,
    Throwable cause
) {
    public enum Reason {
        /** Message id already present in the dedup window. */
        DUPLICATE,
        /** Content or envelope could not be decoded. */
        MALFORMED,
        /** Delivered by a connection that has since been superseded or stopped. */
        STALE_CONNECTION,
        /** Accepted, but no consumer is registered. */
        NO_CONSUMER
    }
}

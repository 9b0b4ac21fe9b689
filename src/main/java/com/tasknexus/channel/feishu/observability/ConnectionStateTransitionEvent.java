package com.tasknexus.channel.feishu.observability;

import com.tasknexus.channel.feishu.internal.exec.ConnectionState;

import java.time.Instant;

/**
 * Record representing a connection state transition.
 *
 * @param attempt sequence number of the start attempt the transition belongs to
 */
public record ConnectionStateTransitionEvent(
    Instant timestamp,
    long attempt,
    ConnectionState oldState,
    ConnectionState newState
) {
}

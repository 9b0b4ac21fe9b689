package com.tasknexus.channel.feishu.internal.exec;

/**
 * Lifecycle of the Feishu long connection as seen by its supervisor.
 *
 * <pre>
 *   IDLE ──start──▶ STARTING ──ready──▶ RUNNING
 *                      │                   │
 *                      └──failure──▶ FAILED ◀──thread died
 *
 *   any ──stop──▶ STOPPED;  FAILED / STOPPED ──start──▶ STARTING
 * </pre>
 */
public enum ConnectionState
{
    /** Constructed, never started. */
    IDLE,

    /** Connection thread launched, readiness not yet signalled. */
    STARTING,

    /** The connection signalled readiness and its thread is alive. */
    RUNNING,

    /** Startup raised, or the connection thread ended unexpectedly. */
    FAILED,

    /** {@code stop()} was called. */
    STOPPED;

    /**
     * @return {@code true} while an attempt is in flight and a new start must be refused
     */
    public boolean isActive() {
        return this == STARTING || this == RUNNING;
    }
}

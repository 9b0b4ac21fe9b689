package com.tasknexus.channel.feishu.config;

import java.time.Duration;
import java.util.Objects;

/**
 * SupervisionPolicy
 * -----------------------------------------------------------------------------
 * Timing configuration for the long connection supervisor.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>readinessTimeout</b>: How long {@code start} waits for the
 *       connection thread to report either readiness or a startup failure.
 *       Elapsing is not an error: the caller proceeds and the connection is
 *       presumed not yet established.</li>
 *   <li><b>livenessInterval</b>: Period of the keep-alive loop that checks
 *       whether the connection thread is still alive. Millisecond
 *       resolution, at least 1 ms.</li>
 * </ul>
 */
public record SupervisionPolicy(
        Duration readinessTimeout,
        Duration livenessInterval
) {
    public SupervisionPolicy {
        Objects.requireNonNull(readinessTimeout, "readinessTimeout");
        Objects.requireNonNull(livenessInterval, "livenessInterval");

        if (readinessTimeout.isNegative() || readinessTimeout.isZero()) {
            throw new IllegalArgumentException("readinessTimeout must be positive");
        }
        // Object.wait(0) would never return
        if (livenessInterval.toMillis() < 1) {
            throw new IllegalArgumentException("livenessInterval must be at least 1 ms");
        }
    }

    /**
     * Default values:
     * <ul>
     *   <li>readinessTimeout: 10s</li>
     *   <li>livenessInterval: 1s</li>
     * </ul>
     */
    public static SupervisionPolicy defaults() {
        return new SupervisionPolicy(Duration.ofSeconds(10), Duration.ofSeconds(1));
    }

    public SupervisionPolicy withReadinessTimeout(Duration readinessTimeout) {
        return new SupervisionPolicy(readinessTimeout, livenessInterval);
    }

    public SupervisionPolicy withLivenessInterval(Duration livenessInterval) {
        return new SupervisionPolicy(readinessTimeout, livenessInterval);
    }
}

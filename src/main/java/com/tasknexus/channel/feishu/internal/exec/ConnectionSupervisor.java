package com.tasknexus.channel.feishu.internal.exec;

import com.tasknexus.channel.api.ChannelStartupException;
import com.tasknexus.channel.feishu.config.FeishuChannelConfig;
import com.tasknexus.channel.feishu.internal.time.WallClock;
import com.tasknexus.channel.feishu.observability.ChannelErrorEvent;
import com.tasknexus.channel.feishu.observability.ChannelObservabilitySink;
import com.tasknexus.channel.feishu.observability.ConnectionStateTransitionEvent;
import com.tasknexus.channel.feishu.observability.DroppedEventNotice;
import com.tasknexus.channel.feishu.transport.FeishuTransportFactory;
import com.tasknexus.channel.feishu.transport.InboundEvent;
import com.tasknexus.channel.feishu.transport.InboundEventListener;
import com.tasknexus.channel.feishu.transport.LongConnection;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * ConnectionSupervisor
 * =============================================================================
 * Owns the lifecycle of the Feishu long connection and runs it on a dedicated
 * thread, isolated from the thread that calls {@link #start}.
 *
 * <h2>Why a dedicated thread</h2>
 * The vendor connection runs its own scheduling loop and blocks the thread
 * that drives it. Hosting it on the caller's thread would stall the host;
 * sharing a pool with the host would let the two loops contend. Each start
 * attempt therefore gets a fresh daemon thread with a one-shot readiness
 * signal and a captured-failure slot back to the caller.
 *
 * <h2>Threading Model</h2>
 * <pre>
 *   caller thread                         connection thread
 *   -------------                         -----------------
 *   start()  ── launches ──────────────▶  openConnection()
 *     │                                   connect()
 *     │  ◀── ready / failure signal ───   (RUNNING or FAILED)
 *     ▼  (bounded by readinessTimeout)    awaitClosed()  ◀── events dispatched here
 *   awaitTermination()
 *     └─ every livenessInterval: is the connection thread alive?
 * </pre>
 *
 * <h2>Start semantics</h2>
 * <ul>
 *   <li>Startup failure: state becomes {@link ConnectionState#FAILED} and the
 *       failure is rethrown to the caller as a {@link ChannelStartupException}.</li>
 *   <li>Readiness timeout: not an error. A warning is reported, the call
 *       returns, and the state stays {@link ConnectionState#STARTING} until
 *       the thread signals.</li>
 * </ul>
 *
 * <h2>Stop semantics</h2>
 * {@link #stop()} is cooperative. It flips the running flag, records
 * {@link ConnectionState#STOPPED}, and asks the connection to close. The SDK
 * offers no shutdown primitive, so its own threads may outlive the stop.
 * Events that connection still delivers are dropped as
 * {@link DroppedEventNotice.Reason#STALE_CONNECTION}, as are events from any
 * attempt superseded by a later {@link #start}.
 *
 * <p>No reconnect is attempted. A connection loss ends
 * {@link #awaitTermination()}; restarting is the host's decision.</p>
 */
public final class ConnectionSupervisor
{
    private final FeishuTransportFactory transport;
    private final ChannelObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final Object lock = new Object();

    // guarded by lock
    private ConnectionState state = ConnectionState.IDLE;
    private long attemptCount;

    private volatile Attempt current;
    private volatile boolean running;

    public ConnectionSupervisor(FeishuTransportFactory transport,
                                ChannelObservabilitySink observabilitySink,
                                WallClock wallClock)
    {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Launch the connection thread and wait, bounded by the configured
     * readiness timeout, for it to report readiness or failure.
     *
     * @param config   credentials and supervision timings
     * @param listener receives events on the connection thread
     * @throws IllegalStateException   if an attempt is already starting or running
     * @throws ChannelStartupException if the connection failed to start
     */
    public void start(FeishuChannelConfig config, InboundEventListener listener)
    {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(listener, "listener");

        final Attempt attempt;
        synchronized (lock) {
            if (state.isActive()) {
                throw new IllegalStateException("Feishu connection is already " + state);
            }
            attempt = new Attempt(++attemptCount, config, listener);
            current = attempt;
            running = true;
            transition(attempt.number, ConnectionState.STARTING);
        }
        attempt.thread.start();

        Duration timeout = config.supervision().readinessTimeout();
        final boolean signalled;
        try {
            signalled = attempt.signal.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            stop();
            Thread.currentThread().interrupt();
            throw new ChannelStartupException("Interrupted while waiting for the Feishu connection", e);
        }

        if (!signalled) {
            observabilitySink.onWarning(new ChannelErrorEvent(
                    wallClock.now(),
                    "connection #" + attempt.number + " not ready after " + timeout.toMillis()
                            + " ms; continuing without confirmation",
                    null));
            return;
        }

        Throwable failure = attempt.failure;
        if (failure != null) {
            throw new ChannelStartupException("Feishu long connection failed to start", failure);
        }
    }

    /**
     * Keep-alive loop. Blocks while the supervisor is running, probing the
     * connection thread once per liveness interval.
     *
     * @return the state at exit: {@link ConnectionState#STOPPED} after
     *         {@link #stop()}, {@link ConnectionState#FAILED} after a connection
     *         loss, or the current state if nothing was running
     * @throws InterruptedException if the calling thread is interrupted
     */
    public ConnectionState awaitTermination() throws InterruptedException
    {
        while (true) {
            synchronized (lock) {
                Attempt attempt = current;
                if (!running || attempt == null) {
                    return state;
                }
                lock.wait(attempt.config.supervision().livenessInterval().toMillis());
                if (!running) {
                    return state;
                }
            }
            if (!checkLiveness()) {
                return state();
            }
        }
    }

    /**
     * Single liveness probe.
     *
     * <p>If the connection thread has terminated while the supervisor is still
     * running, the state moves to {@link ConnectionState#FAILED} and a warning
     * is reported.</p>
     *
     * @return {@code true} if the supervisor is running and its connection
     *         thread is alive
     */
    public boolean checkLiveness()
    {
        Attempt attempt = current;
        if (!running || attempt == null) {
            return false;
        }
        if (attempt.thread.isAlive()) {
            return true;
        }

        synchronized (lock) {
            if (current != attempt || !running) {
                return false;
            }
            running = false;
            transition(attempt.number, ConnectionState.FAILED);
        }
        observabilitySink.onWarning(new ChannelErrorEvent(
                wallClock.now(),
                "connection thread #" + attempt.number + " died unexpectedly",
                attempt.failure));
        return false;
    }

    /**
     * Advisory stop. Returns immediately; never joins the connection thread.
     */
    public void stop()
    {
        final Attempt attempt;
        synchronized (lock) {
            running = false;
            attempt = current;
            transition(attempt == null ? 0 : attempt.number, ConnectionState.STOPPED);
        }
        if (attempt != null) {
            closeQuietly(attempt);
        }
    }

    public ConnectionState state()
    {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isRunning()
    {
        return running;
    }

    // -------------------------------------------------------------------------
    // Connection thread
    // -------------------------------------------------------------------------

    private void runAttempt(Attempt attempt)
    {
        final LongConnection connection;
        try {
            connection = transport.openConnection(
                    attempt.config.credentials(),
                    event -> deliver(attempt, event));
            attempt.connection = connection;

            // stop() may have run before the connection existed
            if (!isActive(attempt)) {
                connection.close();
                attempt.signal.countDown();
                return;
            }
            connection.connect();
        } catch (Throwable t) {
            // includes Errors raised while loading the SDK
            attempt.failure = t;
            synchronized (lock) {
                if (current == attempt && running) {
                    running = false;
                    transition(attempt.number, ConnectionState.FAILED);
                }
            }
            observabilitySink.onError(new ChannelErrorEvent(
                    wallClock.now(),
                    "connection #" + attempt.number + " failed to start",
                    t));
            attempt.signal.countDown();
            return;
        }

        synchronized (lock) {
            if (current == attempt && running && state == ConnectionState.STARTING) {
                transition(attempt.number, ConnectionState.RUNNING);
            }
        }
        attempt.signal.countDown();

        try {
            connection.awaitClosed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Throwable t) {
            attempt.failure = t;
            if (isActive(attempt)) {
                observabilitySink.onError(new ChannelErrorEvent(
                        wallClock.now(),
                        "connection #" + attempt.number + " terminated",
                        t));
            }
        }
        // Thread exit is picked up by checkLiveness() when it was not requested.
    }

    private void deliver(Attempt attempt, InboundEvent event)
    {
        if (!isActive(attempt)) {
            observabilitySink.onEventDropped(new DroppedEventNotice(
                    wallClock.now(),
                    event == null ? null : event.messageId(),
                    DroppedEventNotice.Reason.STALE_CONNECTION,
                    null));
            return;
        }
        attempt.listener.onInboundEvent(event);
    }

    private boolean isActive(Attempt attempt)
    {
        return running && current == attempt;
    }

    private void closeQuietly(Attempt attempt)
    {
        LongConnection connection = attempt.connection;
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (RuntimeException e) {
            observabilitySink.onWarning(new ChannelErrorEvent(
                    wallClock.now(),
                    "failed to close connection #" + attempt.number,
                    e));
        }
    }

    // Caller holds lock.
    private void transition(long attemptNumber, ConnectionState next)
    {
        ConnectionState previous = state;
        state = next;
        lock.notifyAll();
        if (previous != next) {
            observabilitySink.onStateTransition(new ConnectionStateTransitionEvent(
                    wallClock.now(),
                    attemptNumber,
                    previous,
                    next));
        }
    }

    /**
     * One start attempt: its thread, readiness signal and captured failure.
     */
    private final class Attempt
    {
        final long number;
        final FeishuChannelConfig config;
        final InboundEventListener listener;
        final Thread thread;
        final CountDownLatch signal = new CountDownLatch(1);

        volatile LongConnection connection;
        volatile Throwable failure;

        Attempt(long number, FeishuChannelConfig config, InboundEventListener listener)
        {
            this.number = number;
            this.config = config;
            this.listener = listener;
            this.thread = new Thread(() -> runAttempt(this), "feishu-long-connection-" + number);
            this.thread.setDaemon(true);
        }
    }
}

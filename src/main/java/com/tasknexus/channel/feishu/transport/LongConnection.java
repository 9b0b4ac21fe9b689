package com.tasknexus.channel.feishu.transport;

/**
 * LongConnection
 * -----------------------------------------------------------------------------
 * Port for the platform's persistent, push-based event connection.
 *
 * <p>A connection is created, used and ended on a single dedicated thread
 * owned by the connection supervisor. Implementations may run their own
 * internal threads and scheduling; the supervisor never shares its caller's
 * thread with them.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   factory.openConnection(...)  builds the client (startup failures surface here)
 *   connect()                    establishes the connection
 *   awaitClosed()                blocks while the connection is alive
 *   close()                      best-effort request to end awaitClosed()
 * </pre>
 */
public interface LongConnection
{
    /**
     * Establish the connection. Returning normally signals readiness.
     *
     * @throws Exception if the connection cannot be established
     */
    void connect() throws Exception;

    /**
     * Block until the connection ends.
     *
     * <p>Returning (normally or exceptionally) while the channel is still
     * meant to be running is treated as an unexpected connection loss.</p>
     *
     * @throws Exception if the connection fails
     */
    void awaitClosed() throws Exception;

    /**
     * Ask the connection to end. Cooperative: implementations without a
     * shutdown primitive may only release {@link #awaitClosed()}, leaving
     * the underlying client running until process exit.
     */
    void close();
}

package com.tasknexus.channel.api;

import java.util.Map;

/**
 * ChannelPlugin
 * -----------------------------------------------------------------------------
 * {@code ChannelPlugin} is the contract between the host and a single chat
 * platform integration.
 *
 * <p>A channel carries exactly one inbound stream (delivered to the handler
 * registered via {@link #onMessage(MessageHandler)}) and one outbound path
 * ({@link #send(MessagePayload)}). It does no routing, fan-out or persistence;
 * those belong to the host.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   channel.onMessage(handler)     registers the consumer
 *   channel.start(config)          connects; returns once the connection is ready
 *   channel.awaitTermination()     keep-alive; returns on stop or connection loss
 *   channel.stop()                 advisory stop
 * </pre>
 *
 * <p>Channels do not reconnect on their own. When {@link #awaitTermination()}
 * returns without a prior {@link #stop()}, the host decides whether to start
 * the channel again.</p>
 */
public interface ChannelPlugin
{
    /**
     * Stable channel identifier used by the host's plugin registry.
     */
    String id();

    /**
     * Human-readable channel name.
     */
    String label();

    /**
     * Start receiving events.
     *
     * @param config platform configuration (credentials and optional tuning)
     * @throws ChannelConfigurationException if the configuration is incomplete;
     *         raised before any connection attempt
     * @throws ChannelStartupException if the connection fails during startup
     */
    void start(Map<String, String> config);

    /**
     * Block while the channel is running.
     *
     * @return {@code true} if the channel was stopped through {@link #stop()},
     *         {@code false} if the connection was lost
     * @throws InterruptedException if the waiting thread is interrupted
     */
    boolean awaitTermination() throws InterruptedException;

    /**
     * Request the channel to stop. Returns immediately.
     */
    void stop();

    /**
     * Send a text message. Never throws for delivery failures.
     *
     * @return {@code true} if the platform accepted the message
     */
    boolean send(MessagePayload payload);

    /**
     * Register the inbound consumer. The last registration wins.
     */
    void onMessage(MessageHandler handler);
}

package com.tasknexus.channel.api;

/**
 * MessageHandler
 * -----------------------------------------------------------------------------
 * Consumer of inbound {@link ChannelMessage}s.
 *
 * <h2>Threading</h2>
 * Channels invoke the handler from their own connection thread, not from the
 * thread that registered it. Implementations must be thread-safe, or hand the
 * message over to the host's own executor before doing any work that assumes
 * the host's execution context.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Called once per accepted inbound message.
     *
     * @param message the normalized message; ownership passes to the handler
     */
    void onMessage(ChannelMessage message);
}

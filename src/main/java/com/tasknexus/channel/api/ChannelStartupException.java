package com.tasknexus.channel.api;

/**
 * Raised by {@link ChannelPlugin#start} when the channel's connection could not
 * be established. The original failure is preserved as the cause.
 */
public final class ChannelStartupException extends RuntimeException
{
    public ChannelStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}

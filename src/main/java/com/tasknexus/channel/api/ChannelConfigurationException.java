package com.tasknexus.channel.api;

/**
 * Raised synchronously by {@link ChannelPlugin#start} when the supplied
 * configuration is incomplete or invalid. No connection is attempted.
 */
public final class ChannelConfigurationException extends RuntimeException
{
    public ChannelConfigurationException(String message) {
        super(message);
    }

    public ChannelConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.tasknexus.channel.feishu.codec;

/**
 * Indicates that an inbound Feishu event could not be translated into a
 * {@code ChannelMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Malformed JSON in the message content</li>
 *   <li>A required envelope field (message, chat or sender id) being absent</li>
 * </ul>
 */
public final class FeishuDecodeException extends RuntimeException
{
    public FeishuDecodeException(String message) {
        super(message);
    }

    public FeishuDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}

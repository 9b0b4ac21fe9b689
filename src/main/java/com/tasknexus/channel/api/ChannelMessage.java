package com.tasknexus.channel.api;

import java.util.Map;
import java.util.Objects;

/**
 * ChannelMessage
 * -----------------------------------------------------------------------------
 * Platform-agnostic inbound chat message handed from a channel plugin to the
 * host.
 *
 * <p>A {@code ChannelMessage} is created by the channel, passed once to the
 * registered {@link MessageHandler}, and is owned by the host afterwards. The
 * channel keeps no reference to it.</p>
 *
 * @param channelId  identifier of the producing channel (e.g. {@code "feishu"})
 * @param chatId     conversation the message was posted in
 * @param senderId   platform identifier of the sender
 * @param senderName display name of the sender; channels without a richer
 *                   lookup use {@code senderId}
 * @param content    decoded text content; empty for non-text messages
 * @param raw        platform fields preserved for auditing
 */
public record ChannelMessage(
        String channelId,
        String chatId,
        String senderId,
        String senderName,
        String content,
        Map<String, String> raw
) {
    public ChannelMessage {
        Objects.requireNonNull(channelId, "channelId");
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(senderId, "senderId");
        Objects.requireNonNull(senderName, "senderName");
        Objects.requireNonNull(content, "content");
        raw = Map.copyOf(Objects.requireNonNull(raw, "raw"));
    }
}

package com.tasknexus.channel.api;

import java.util.Objects;

/**
 * Outbound text message addressed to a single chat.
 */
public record MessagePayload(String chatId, String content) {
    public MessagePayload {
        Objects.requireNonNull(chatId, "chatId");
        Objects.requireNonNull(content, "content");
    }
}

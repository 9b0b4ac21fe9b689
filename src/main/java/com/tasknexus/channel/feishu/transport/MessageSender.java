package com.tasknexus.channel.feishu.transport;

/**
 * Port for the platform's outbound "create message" call.
 *
 * <p>Implementations must be safe to call from any thread.</p>
 */
public interface MessageSender
{
    /**
     * Post a text message to a chat.
     *
     * @throws FeishuApiException if the platform rejects the request
     * @throws RuntimeException   for transport failures
     */
    void sendText(String chatId, String text);
}

package com.tasknexus.channel.feishu.transport;

/**
 * Vendor-neutral projection of a Feishu {@code im.message.receive_v1} event.
 *
 * <p>Fields are copied as delivered. Any of them may be {@code null} when the
 * platform omits it; validation happens in the normalizer.</p>
 *
 * @param messageId   platform message id, the deduplication key
 * @param chatId      conversation id
 * @param senderId    sender's open id
 * @param messageType content type tag (e.g. {@code "text"}, {@code "image"})
 * @param content     content document as a JSON string
 * @param createTime  creation time in epoch milliseconds, as a string
 */
public record InboundEvent(
        String messageId,
        String chatId,
        String senderId,
        String messageType,
        String content,
        String createTime
) {
}

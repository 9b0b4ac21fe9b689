package com.tasknexus.channel.feishu.transport.lark;

import com.lark.oapi.Client;
import com.lark.oapi.service.im.v1.model.CreateMessageReq;
import com.lark.oapi.service.im.v1.model.CreateMessageReqBody;
import com.lark.oapi.service.im.v1.model.CreateMessageResp;
import com.tasknexus.channel.feishu.codec.TextContentCodec;
import com.tasknexus.channel.feishu.transport.FeishuApiException;
import com.tasknexus.channel.feishu.transport.MessageSender;

import java.util.Objects;

/**
 * {@link MessageSender} calling {@code im.v1.message.create} through the Lark
 * SDK {@link Client}. The SDK client is thread-safe.
 */
final class LarkMessageSender implements MessageSender
{
    private static final String RECEIVE_ID_TYPE_CHAT = "chat_id";

    private final Client client;
    private final TextContentCodec codec;

    LarkMessageSender(Client client, TextContentCodec codec)
    {
        this.client = Objects.requireNonNull(client, "client");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public void sendText(String chatId, String text)
    {
        CreateMessageReq request = CreateMessageReq.newBuilder()
                .receiveIdType(RECEIVE_ID_TYPE_CHAT)
                .createMessageReqBody(CreateMessageReqBody.newBuilder()
                        .receiveId(chatId)
                        .msgType(TextContentCodec.TEXT_MESSAGE_TYPE)
                        .content(codec.encode(text))
                        .build())
                .build();

        final CreateMessageResp response;
        try {
            response = client.im().message().create(request);
        } catch (Exception e) {
            throw new FeishuApiException("create message request failed: " + e.getMessage(), e);
        }

        if (!response.success()) {
            throw new FeishuApiException(response.getCode(), response.getMsg(), response.getRequestId());
        }
    }
}

package com.tasknexus.channel.feishu.transport.lark;

import com.lark.oapi.Client;
import com.tasknexus.channel.feishu.codec.TextContentCodec;
import com.tasknexus.channel.feishu.config.FeishuCredentials;
import com.tasknexus.channel.feishu.transport.FeishuTransportFactory;
import com.tasknexus.channel.feishu.transport.InboundEventListener;
import com.tasknexus.channel.feishu.transport.LongConnection;
import com.tasknexus.channel.feishu.transport.MessageSender;

import java.util.Objects;

/**
 * Production {@link FeishuTransportFactory} backed by the Lark open platform SDK.
 *
 * <p>The outbound {@link Client} and the websocket client are independent SDK
 * instances: the sender belongs to the thread calling {@code start}, the
 * websocket client to the supervisor's connection thread.</p>
 */
public final class LarkTransportFactory implements FeishuTransportFactory
{
    private final TextContentCodec codec;

    public LarkTransportFactory(TextContentCodec codec)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    @Override
    public LongConnection openConnection(FeishuCredentials credentials, InboundEventListener listener)
    {
        return new LarkLongConnection(credentials, listener);
    }

    @Override
    public MessageSender createSender(FeishuCredentials credentials)
    {
        Objects.requireNonNull(credentials, "credentials");
        Client client = Client.newBuilder(credentials.appId(), credentials.appSecret()).build();
        return new LarkMessageSender(client, codec);
    }
}

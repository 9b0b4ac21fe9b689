package com.tasknexus.channel.feishu.transport.lark;

import com.lark.oapi.event.EventDispatcher;
import com.lark.oapi.service.im.ImService;
import com.lark.oapi.service.im.v1.model.EventMessage;
import com.lark.oapi.service.im.v1.model.EventSender;
import com.lark.oapi.service.im.v1.model.P2MessageReceiveV1;
import com.lark.oapi.service.im.v1.model.P2MessageReceiveV1Data;
import com.tasknexus.channel.feishu.config.FeishuCredentials;
import com.tasknexus.channel.feishu.transport.InboundEvent;
import com.tasknexus.channel.feishu.transport.InboundEventListener;
import com.tasknexus.channel.feishu.transport.LongConnection;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;

/**
 * LarkLongConnection
 * =============================================================================
 * {@link LongConnection} backed by the Lark SDK websocket client.
 *
 * <h2>SDK containment rule</h2>
 * SDK types ({@code EventDispatcher}, {@code P2MessageReceiveV1}, the websocket
 * {@code Client}) MUST NOT escape this package. Received events are projected
 * into {@link InboundEvent} before they reach the listener.
 *
 * <h2>Lifecycle</h2>
 * The SDK client manages its own threads and reconnects internally. It has
 * no public shutdown call, so {@link #close()} only releases
 * {@link #awaitClosed()}; the websocket stays up until the process exits.
 *
 * <h2>Liveness</h2>
 * {@link #connect()} returns once {@code start()} hands the websocket to the
 * SDK's own threads, and the SDK exposes no signal for a lost connection.
 * {@link #awaitClosed()} therefore ends only on {@link #close()}: with this
 * binding the supervisor's liveness probe sees a live connection thread even
 * while the SDK is reconnecting, and never reports a lost websocket as
 * {@code FAILED}. Connection loss surfaces only through the SDK's own logs.
 */
final class LarkLongConnection implements LongConnection
{
    private final com.lark.oapi.ws.Client wsClient;
    private final CountDownLatch closed = new CountDownLatch(1);

    LarkLongConnection(FeishuCredentials credentials, InboundEventListener listener)
    {
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(listener, "listener");

        // Token and encrypt key only apply to HTTP callbacks, not the websocket.
        EventDispatcher dispatcher = EventDispatcher.newBuilder("", "")
                .onP2MessageReceiveV1(new ImService.P2MessageReceiveV1Handler() {
                    @Override
                    public void handle(P2MessageReceiveV1 event)
                    {
                        listener.onInboundEvent(toInboundEvent(event));
                    }
                })
                .build();

        this.wsClient = new com.lark.oapi.ws.Client.Builder(credentials.appId(), credentials.appSecret())
                .eventHandler(dispatcher)
                .build();
    }

    @Override
    public void connect() throws Exception
    {
        wsClient.start();
    }

    @Override
    public void awaitClosed() throws InterruptedException
    {
        closed.await();
    }

    @Override
    public void close()
    {
        closed.countDown();
    }

    static InboundEvent toInboundEvent(P2MessageReceiveV1 event)
    {
        P2MessageReceiveV1Data data = event == null ? null : event.getEvent();
        EventMessage message = data == null ? null : data.getMessage();
        EventSender sender = data == null ? null : data.getSender();

        String senderId = sender == null || sender.getSenderId() == null
                ? null
                : sender.getSenderId().getOpenId();

        if (message == null) {
            return new InboundEvent(null, null, senderId, null, null, null);
        }
        return new InboundEvent(
                message.getMessageId(),
                message.getChatId(),
                senderId,
                message.getMessageType(),
                message.getContent(),
                message.getCreateTime());
    }
}

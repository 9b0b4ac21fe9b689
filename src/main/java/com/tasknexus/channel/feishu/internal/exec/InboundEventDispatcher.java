package com.tasknexus.channel.feishu.internal.exec;

import com.tasknexus.channel.api.ChannelMessage;
import com.tasknexus.channel.api.MessageHandler;
import com.tasknexus.channel.feishu.codec.FeishuDecodeException;
import com.tasknexus.channel.feishu.internal.dedup.DedupWindow;
import com.tasknexus.channel.feishu.internal.normalize.FeishuEventNormalizer;
import com.tasknexus.channel.feishu.internal.time.WallClock;
import com.tasknexus.channel.feishu.observability.ChannelErrorEvent;
import com.tasknexus.channel.feishu.observability.ChannelObservabilitySink;
import com.tasknexus.channel.feishu.observability.DroppedEventNotice;
import com.tasknexus.channel.feishu.transport.InboundEvent;
import com.tasknexus.channel.feishu.transport.InboundEventListener;

import java.util.Objects;
import java.util.Optional;

/**
 * InboundEventDispatcher
 * =============================================================================
 * Per-event callback run on the long connection thread.
 *
 * <h2>Inbound Data Flow</h2>
 * <pre>
 *   LongConnection
 *        → DedupWindow.admit(messageId)      (duplicates dropped)
 *            → FeishuEventNormalizer         (malformed events dropped)
 *                → MessageHandler            (same thread, synchronous)
 * </pre>
 *
 * <h2>Failure containment</h2>
 * Nothing thrown while handling an event, including an {@link Error} raised
 * by the host's handler, unwinds into the SDK's dispatch loop. Failures are reported to the
 * observability sink and only the offending event is lost.
 *
 * <p>The handler is read on every event, so a registration made while the
 * connection is running takes effect for the next event.</p>
 */
public final class InboundEventDispatcher implements InboundEventListener
{
    private final String channelId;
    private final DedupWindow dedupWindow;
    private final FeishuEventNormalizer normalizer;
    private final ChannelObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private volatile MessageHandler handler;

    public InboundEventDispatcher(String channelId,
                                  DedupWindow dedupWindow,
                                  FeishuEventNormalizer normalizer,
                                  ChannelObservabilitySink observabilitySink,
                                  WallClock wallClock)
    {
        this.channelId = Objects.requireNonNull(channelId, "channelId");
        this.dedupWindow = Objects.requireNonNull(dedupWindow, "dedupWindow");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Replace the consumer. {@code null} unregisters it.
     */
    public void setHandler(MessageHandler handler)
    {
        this.handler = handler;
    }

    @Override
    public void onInboundEvent(InboundEvent event)
    {
        String messageId = event == null ? null : event.messageId();
        try {
            if (messageId == null || messageId.isEmpty()) {
                drop(messageId, DroppedEventNotice.Reason.MALFORMED,
                        new FeishuDecodeException("missing message_id"));
                return;
            }

            if (!dedupWindow.admit(messageId)) {
                drop(messageId, DroppedEventNotice.Reason.DUPLICATE, null);
                return;
            }

            Optional<ChannelMessage> message = normalizer.normalize(event, channelId);
            if (message.isEmpty()) {
                return;
            }

            MessageHandler current = handler;
            if (current == null) {
                drop(messageId, DroppedEventNotice.Reason.NO_CONSUMER, null);
                return;
            }
            current.onMessage(message.get());
        } catch (Throwable t) {
            // includes Errors raised by the handler
            observabilitySink.onError(new ChannelErrorEvent(
                    wallClock.now(),
                    "Error handling Feishu message " + messageId,
                    t));
        }
    }

    private void drop(String messageId, DroppedEventNotice.Reason reason, Throwable cause)
    {
        observabilitySink.onEventDropped(new DroppedEventNotice(wallClock.now(), messageId, reason, cause));
    }
}

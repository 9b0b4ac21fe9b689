package com.tasknexus.channel.feishu.internal.exec;

import com.tasknexus.channel.api.ChannelMessage;
import com.tasknexus.channel.feishu.codec.TextContentCodec;
import com.tasknexus.channel.feishu.internal.dedup.DedupWindow;
import com.tasknexus.channel.feishu.internal.normalize.FeishuEventNormalizer;
import com.tasknexus.channel.feishu.internal.time.WallClock;
import com.tasknexus.channel.feishu.observability.DroppedEventNotice;
import com.tasknexus.channel.feishu.observability.RecordingObservabilitySink;
import com.tasknexus.channel.feishu.transport.InboundEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InboundEventDispatcherTest {

    private final WallClock clock = () -> Instant.EPOCH;
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final DedupWindow window = new DedupWindow(100);
    private final InboundEventDispatcher dispatcher = new InboundEventDispatcher(
        "feishu",
        window,
        new FeishuEventNormalizer(new TextContentCodec(), sink, clock),
        sink,
        clock);

    private static InboundEvent text(String messageId, String text) {
        return new InboundEvent(messageId, "oc_chat", "ou_user", "text",
            "{\"text\":\"" + text + "\"}", "1700000000000");
    }

    @Test
    void redeliveredEventReachesHandlerOnce() {
        List<ChannelMessage> received = new ArrayList<>();
        dispatcher.setHandler(received::add);

        dispatcher.onInboundEvent(text("om_1", "hello"));
        dispatcher.onInboundEvent(text("om_1", "hello"));
        dispatcher.onInboundEvent(text("om_2", "again"));

        assertEquals(2, received.size());
        assertEquals("hello", received.get(0).content());
        assertEquals("again", received.get(1).content());
        assertEquals(1, sink.dropped(DroppedEventNotice.Reason.DUPLICATE).size());
    }

    @Test
    void handlerFailureIsContainedAndReported() {
        List<String> received = new ArrayList<>();
        dispatcher.setHandler(message -> {
            if (message.content().equals("boom")) {
                throw new IllegalStateException("handler failed");
            }
            received.add(message.content());
        });

        assertDoesNotThrow(() -> dispatcher.onInboundEvent(text("om_1", "boom")));
        dispatcher.onInboundEvent(text("om_2", "fine"));

        assertEquals(List.of("fine"), received);
        assertEquals(1, sink.errors().size());
        assertTrue(sink.errors().get(0).message().contains("om_1"));
        assertInstanceOf(IllegalStateException.class, sink.errors().get(0).cause());
    }

    @Test
    void errorThrownByHandlerIsContained() {
        List<String> received = new ArrayList<>();
        dispatcher.setHandler(message -> {
            if (message.content().equals("boom")) {
                throw new AssertionError("host bug");
            }
            received.add(message.content());
        });

        assertDoesNotThrow(() -> dispatcher.onInboundEvent(text("om_1", "boom")));
        dispatcher.onInboundEvent(text("om_2", "fine"));

        assertEquals(List.of("fine"), received);
        assertEquals(1, sink.errors().size());
        assertInstanceOf(AssertionError.class, sink.errors().get(0).cause());
    }

    @Test
    void eventWithoutConsumerIsDroppedButRemembered() {
        dispatcher.onInboundEvent(text("om_1", "hello"));

        assertEquals(1, sink.dropped(DroppedEventNotice.Reason.NO_CONSUMER).size());
        assertTrue(window.contains("om_1"));
    }

    @Test
    void lastRegisteredHandlerWins() {
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();

        dispatcher.setHandler(m -> first.add(m.content()));
        dispatcher.onInboundEvent(text("om_1", "one"));
        dispatcher.setHandler(m -> second.add(m.content()));
        dispatcher.onInboundEvent(text("om_2", "two"));

        assertEquals(List.of("one"), first);
        assertEquals(List.of("two"), second);
    }

    @Test
    void eventWithoutMessageIdIsMalformedAndNotRemembered() {
        List<ChannelMessage> received = new ArrayList<>();
        dispatcher.setHandler(received::add);

        dispatcher.onInboundEvent(text(null, "hello"));
        dispatcher.onInboundEvent(null);

        assertTrue(received.isEmpty());
        assertEquals(0, window.size());
        assertEquals(2, sink.dropped(DroppedEventNotice.Reason.MALFORMED).size());
    }

    @Test
    void malformedContentStillConsumesDedupSlot() {
        List<ChannelMessage> received = new ArrayList<>();
        dispatcher.setHandler(received::add);

        dispatcher.onInboundEvent(new InboundEvent("om_1", "oc_chat", "ou_user", "text", "{", null));
        dispatcher.onInboundEvent(new InboundEvent("om_1", "oc_chat", "ou_user", "text", "{", null));

        assertTrue(received.isEmpty());
        assertEquals(1, sink.dropped(DroppedEventNotice.Reason.MALFORMED).size());
        assertEquals(1, sink.dropped(DroppedEventNotice.Reason.DUPLICATE).size());
    }
}

package com.tasknexus.channel.feishu.internal.normalize;

import com.tasknexus.channel.api.ChannelMessage;
import com.tasknexus.channel.feishu.codec.FeishuDecodeException;
import com.tasknexus.channel.feishu.codec.TextContentCodec;
import com.tasknexus.channel.feishu.internal.time.WallClock;
import com.tasknexus.channel.feishu.observability.ChannelObservabilitySink;
import com.tasknexus.channel.feishu.observability.DroppedEventNotice;
import com.tasknexus.channel.feishu.transport.InboundEvent;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FeishuEventNormalizer
 * =============================================================================
 * Converts an {@link InboundEvent} into the host's {@link ChannelMessage}.
 *
 * <p>Envelope fields (chat, sender, message id, type, create time) are projected
 * as-is. Only {@code text} content is decoded; every other message type yields
 * an empty {@code content} but still produces a message.</p>
 *
 * <p>Decode failures never propagate. They are reported to the observability
 * sink as {@link DroppedEventNotice.Reason#MALFORMED} and the event is dropped.</p>
 */
public final class FeishuEventNormalizer
{
    public static final String RAW_MESSAGE_ID = "message_id";
    public static final String RAW_MESSAGE_TYPE = "message_type";
    public static final String RAW_CREATE_TIME = "create_time";

    private final TextContentCodec codec;
    private final ChannelObservabilitySink observabilitySink;
    private final WallClock wallClock;

    public FeishuEventNormalizer(TextContentCodec codec,
                                 ChannelObservabilitySink observabilitySink,
                                 WallClock wallClock)
    {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * @return the normalized message, or empty if the event could not be decoded
     */
    public Optional<ChannelMessage> normalize(InboundEvent event, String channelId)
    {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(channelId, "channelId");

        try {
            return Optional.of(decode(event, channelId));
        } catch (FeishuDecodeException e) {
            observabilitySink.onEventDropped(new DroppedEventNotice(
                    wallClock.now(),
                    event.messageId(),
                    DroppedEventNotice.Reason.MALFORMED,
                    e));
            return Optional.empty();
        }
    }

    private ChannelMessage decode(InboundEvent event, String channelId)
    {
        String messageId = require(event.messageId(), "message_id");
        String chatId = require(event.chatId(), "chat_id");
        String senderId = require(event.senderId(), "sender open_id");

        String content = "";
        if (TextContentCodec.TEXT_MESSAGE_TYPE.equals(event.messageType())) {
            content = codec.decode(event.content());
        }

        // Map.copyOf in ChannelMessage rejects null values.
        Map<String, String> raw = new LinkedHashMap<>();
        raw.put(RAW_MESSAGE_ID, messageId);
        raw.put(RAW_MESSAGE_TYPE, Objects.requireNonNullElse(event.messageType(), ""));
        raw.put(RAW_CREATE_TIME, Objects.requireNonNullElse(event.createTime(), ""));

        // No user lookup: display name falls back to the open id.
        return new ChannelMessage(channelId, chatId, senderId, senderId, content, raw);
    }

    private static String require(String value, String field)
    {
        if (value == null || value.isEmpty()) {
            throw new FeishuDecodeException("missing " + field);
        }
        return value;
    }
}

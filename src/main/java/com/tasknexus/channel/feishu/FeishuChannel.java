package com.tasknexus.channel.feishu;

import com.tasknexus.channel.api.ChannelPlugin;
import com.tasknexus.channel.api.ChannelStartupException;
import com.tasknexus.channel.api.MessageHandler;
import com.tasknexus.channel.api.MessagePayload;
import com.tasknexus.channel.feishu.codec.TextContentCodec;
import com.tasknexus.channel.feishu.config.FeishuChannelConfig;
import com.tasknexus.channel.feishu.config.SupervisionPolicy;
import com.tasknexus.channel.feishu.internal.dedup.DedupWindow;
import com.tasknexus.channel.feishu.internal.exec.ConnectionState;
import com.tasknexus.channel.feishu.internal.exec.ConnectionSupervisor;
import com.tasknexus.channel.feishu.internal.exec.InboundEventDispatcher;
import com.tasknexus.channel.feishu.internal.normalize.FeishuEventNormalizer;
import com.tasknexus.channel.feishu.internal.time.SystemWallClock;
import com.tasknexus.channel.feishu.internal.time.WallClock;
import com.tasknexus.channel.feishu.observability.ChannelObservabilitySink;
import com.tasknexus.channel.feishu.observability.Slf4jChannelObservabilitySink;
import com.tasknexus.channel.feishu.transport.FeishuApiException;
import com.tasknexus.channel.feishu.transport.FeishuTransportFactory;
import com.tasknexus.channel.feishu.transport.MessageSender;
import com.tasknexus.channel.feishu.transport.lark.LarkTransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * FeishuChannel
 * =============================================================================
 * {@link ChannelPlugin} for the Feishu (Lark) messaging platform.
 *
 * <h2>Composition</h2>
 * <pre>
 *   FeishuChannel
 *     ├─ ConnectionSupervisor        long connection on its own thread
 *     │     └─ InboundEventDispatcher
 *     │           ├─ DedupWindow     shared across restarts
 *     │           └─ FeishuEventNormalizer
 *     └─ MessageSender               outbound, created on the start() caller's thread
 * </pre>
 *
 * <h2>Threading</h2>
 * The handler registered with {@link #onMessage(MessageHandler)} runs on the
 * connection thread. {@link #send(MessagePayload)} may be called from any
 * thread once {@link #start} has returned.
 */
public final class FeishuChannel implements ChannelPlugin
{
    public static final String CHANNEL_ID = "feishu";
    public static final String LABEL = "飞书";

    private static final Logger log = LoggerFactory.getLogger(FeishuChannel.class);

    private final FeishuTransportFactory transport;
    private final SupervisionPolicy defaultSupervision;
    private final DedupWindow dedupWindow;
    private final InboundEventDispatcher dispatcher;
    private final ConnectionSupervisor supervisor;

    private volatile MessageSender sender;

    /**
     * Channel backed by the Lark SDK with default settings.
     */
    public FeishuChannel()
    {
        this(builder());
    }

    private FeishuChannel(Builder builder)
    {
        TextContentCodec codec = Objects.requireNonNull(builder.codec, "codec");
        this.transport = builder.transport != null ? builder.transport : new LarkTransportFactory(codec);
        this.defaultSupervision = Objects.requireNonNull(builder.supervision, "supervision");
        ChannelObservabilitySink sink = Objects.requireNonNull(builder.observabilitySink, "observabilitySink");
        WallClock wallClock = Objects.requireNonNull(builder.wallClock, "wallClock");

        this.dedupWindow = new DedupWindow(builder.dedupCapacity);
        FeishuEventNormalizer normalizer = new FeishuEventNormalizer(codec, sink, wallClock);
        this.dispatcher = new InboundEventDispatcher(CHANNEL_ID, dedupWindow, normalizer, sink, wallClock);
        this.supervisor = new ConnectionSupervisor(transport, sink, wallClock);
    }

    @Override
    public String id()
    {
        return CHANNEL_ID;
    }

    @Override
    public String label()
    {
        return LABEL;
    }

    /**
     * Start from the host's configuration map ({@code app_id}, {@code app_secret}
     * and optional supervision overrides).
     *
     * @see FeishuChannelConfig#fromMap(Map, SupervisionPolicy)
     */
    @Override
    public void start(Map<String, String> config)
    {
        start(FeishuChannelConfig.fromMap(config, defaultSupervision));
    }

    /**
     * Create the outbound sender, then launch the long connection and wait for
     * it to report readiness (bounded by the supervision policy).
     *
     * @throws IllegalStateException   if the channel is already starting or running
     * @throws ChannelStartupException if the client or the connection failed to start
     */
    public void start(FeishuChannelConfig config)
    {
        Objects.requireNonNull(config, "config");
        ConnectionState current = supervisor.state();
        if (current.isActive()) {
            throw new IllegalStateException("Feishu connection is already " + current);
        }
        log.info("Starting Feishu long connection for app {}", config.credentials().appId());

        final MessageSender newSender;
        try {
            newSender = transport.createSender(config.credentials());
        } catch (RuntimeException e) {
            throw new ChannelStartupException("Failed to create Feishu client", e);
        }
        supervisor.start(config, dispatcher);
        this.sender = newSender;

        if (supervisor.state() == ConnectionState.RUNNING) {
            log.info("Feishu long connection started");
        }
    }

    @Override
    public boolean awaitTermination() throws InterruptedException
    {
        return supervisor.awaitTermination() == ConnectionState.STOPPED;
    }

    @Override
    public void stop()
    {
        supervisor.stop();
        log.info("Feishu channel stopped");
    }

    @Override
    public boolean send(MessagePayload payload)
    {
        Objects.requireNonNull(payload, "payload");

        MessageSender current = sender;
        if (current == null) {
            log.error("Feishu client not initialized; dropping message to {}", payload.chatId());
            return false;
        }

        try {
            current.sendText(payload.chatId(), payload.content());
        } catch (FeishuApiException e) {
            log.error("Failed to send Feishu message to {}: {}", payload.chatId(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.error("Error sending Feishu message to {}", payload.chatId(), e);
            return false;
        }

        log.info("Sent Feishu message to {}", payload.chatId());
        return true;
    }

    @Override
    public void onMessage(MessageHandler handler)
    {
        dispatcher.setHandler(handler);
    }

    public ConnectionState state()
    {
        return supervisor.state();
    }

    /**
     * Identifiers currently held by the deduplication window.
     */
    public int dedupWindowSize()
    {
        return dedupWindow.size();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public static final class Builder
    {
        private FeishuTransportFactory transport; // null selects the Lark SDK
        private SupervisionPolicy supervision = SupervisionPolicy.defaults();
        private ChannelObservabilitySink observabilitySink = new Slf4jChannelObservabilitySink();
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private TextContentCodec codec = new TextContentCodec();
        private int dedupCapacity = DedupWindow.DEFAULT_CAPACITY;

        public Builder withTransport(FeishuTransportFactory transport)
        {
            this.transport = transport;
            return this;
        }

        /**
         * Supervision timings used when the configuration map does not override them.
         */
        public Builder withSupervision(SupervisionPolicy supervision)
        {
            this.supervision = supervision;
            return this;
        }

        public Builder withObservabilitySink(ChannelObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withCodec(TextContentCodec codec)
        {
            this.codec = codec;
            return this;
        }

        public Builder withDedupCapacity(int capacity)
        {
            this.dedupCapacity = capacity;
            return this;
        }

        public FeishuChannel build()
        {
            return new FeishuChannel(this);
        }
    }
}

package com.tasknexus.channel.feishu.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ChannelObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jChannelObservabilitySink implements ChannelObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger("com.tasknexus.channel.feishu");

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {
        log.info("Feishu connection #{}: {} -> {}",
            event.attempt(),
            event.oldState(),
            event.newState());
    }

    @Override
    public void onEventDropped(DroppedEventNotice event) {
        switch (event.reason()) {
            case DUPLICATE -> log.debug("Skipping duplicate message: {}", event.messageId());
            case MALFORMED -> log.warn("Dropping malformed Feishu message {}: {}",
                event.messageId(),
                event.cause() != null ? event.cause().getMessage() : "unknown");
            case STALE_CONNECTION -> log.debug("Ignoring message {} from a superseded connection", event.messageId());
            case NO_CONSUMER -> log.debug("No consumer registered; message {} discarded", event.messageId());
        }
    }

    @Override
    public void onWarning(ChannelErrorEvent event) {
        if (event.cause() != null) {
            log.warn("Feishu channel: {}", event.message(), event.cause());
        } else {
            log.warn("Feishu channel: {}", event.message());
        }
    }

    @Override
    public void onError(ChannelErrorEvent event) {
        log.error("Feishu channel error: {}", event.message(), event.cause());
    }
}

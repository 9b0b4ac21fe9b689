package com.tasknexus.channel.feishu.observability;

/**
 * No-op implementation of ChannelObservabilitySink.
 */
public final class NullObservabilitySink implements ChannelObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(ConnectionStateTransitionEvent event) {}

    @Override
    public void onEventDropped(DroppedEventNotice event) {}

    @Override
    public void onWarning(ChannelErrorEvent event) {}

    @Override
    public void onError(ChannelErrorEvent event) {}
}

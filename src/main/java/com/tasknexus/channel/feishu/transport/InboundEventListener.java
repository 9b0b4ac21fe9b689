package com.tasknexus.channel.feishu.transport;

/**
 * InboundEventListener
 * -----------------------------------------------------------------------------
 * Callback sink for a {@link LongConnection}.
 *
 * <p>Invoked on the connection's own thread, once per event received. The
 * listener must not let exceptions escape into the connection's dispatch
 * loop.</p>
 */
@FunctionalInterface
public interface InboundEventListener
{
    void onInboundEvent(InboundEvent event);
}

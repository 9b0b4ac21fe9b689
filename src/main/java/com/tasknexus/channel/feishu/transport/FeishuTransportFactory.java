package com.tasknexus.channel.feishu.transport;

import com.tasknexus.channel.feishu.config.FeishuCredentials;

/**
 * Creates the platform clients used by a Feishu channel.
 *
 * <p>Production code uses {@code LarkTransportFactory}; tests substitute fakes.</p>
 */
public interface FeishuTransportFactory
{
    /**
     * Build a long connection delivering events to {@code listener}.
     *
     * <p>Called on the supervisor's connection thread. Failures are startup
     * errors and are reported back to the {@code start} caller.</p>
     */
    LongConnection openConnection(FeishuCredentials credentials, InboundEventListener listener) throws Exception;

    /**
     * Build an outbound sender. Called on the thread invoking {@code start}.
     */
    MessageSender createSender(FeishuCredentials credentials);
}

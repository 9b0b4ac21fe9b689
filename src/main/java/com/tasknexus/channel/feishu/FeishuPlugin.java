package com.tasknexus.channel.feishu;

import com.tasknexus.channel.api.ChannelRegistry;

import java.util.Objects;

/**
 * Plugin entry point called by the host's plugin manager during discovery.
 */
public final class FeishuPlugin
{
    private FeishuPlugin() {}

    /**
     * Register a new {@link FeishuChannel} with the host.
     */
    public static void register(ChannelRegistry registry)
    {
        Objects.requireNonNull(registry, "registry").registerChannel(new FeishuChannel());
    }
}

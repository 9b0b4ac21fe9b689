package com.tasknexus.channel.api;

/**
 * Host-side registry that channel plugins add themselves to during plugin
 * discovery.
 */
public interface ChannelRegistry {

    void registerChannel(ChannelPlugin channel);
}

package com.tasknexus.channel.feishu;

import com.tasknexus.channel.api.ChannelPlugin;
import com.tasknexus.channel.api.MessagePayload;
import com.tasknexus.channel.feishu.internal.exec.ConnectionState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeishuPluginTest {

    @Test
    void registersFeishuChannel() {
        List<ChannelPlugin> registered = new ArrayList<>();

        FeishuPlugin.register(registered::add);

        assertEquals(1, registered.size());
        assertInstanceOf(FeishuChannel.class, registered.get(0));
        assertEquals("feishu", registered.get(0).id());
    }

    @Test
    void defaultChannelIsIdleAndCannotSend() {
        FeishuChannel channel = new FeishuChannel();

        assertEquals(ConnectionState.IDLE, channel.state());
        assertEquals(0, channel.dedupWindowSize());
        assertFalse(channel.send(new MessagePayload("oc_chat", "hello")));
    }
}

package com.tasknexus.channel.feishu.config;

import com.tasknexus.channel.api.ChannelConfigurationException;

/**
 * Application credentials issued by the Feishu open platform.
 *
 * <p>Both values are required and must be non-blank. The secret is masked in
 * {@link #toString()} so credentials can appear in log statements.</p>
 */
public record FeishuCredentials(String appId, String appSecret) {

    public FeishuCredentials {
        if (appId == null || appId.isBlank() || appSecret == null || appSecret.isBlank()) {
            throw new ChannelConfigurationException("Feishu app_id and app_secret are required");
        }
    }

    @Override
    public String toString() {
        return "FeishuCredentials[appId=" + appId + ", appSecret=****]";
    }
}

package com.tasknexus.channel.feishu.config;

import com.tasknexus.channel.api.ChannelConfigurationException;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for one start of a Feishu channel.
 */
public record FeishuChannelConfig(
    FeishuCredentials credentials,
    SupervisionPolicy supervision
) {
    public static final String APP_ID = "app_id";
    public static final String APP_SECRET = "app_secret";
    public static final String READINESS_TIMEOUT_MS = "readiness_timeout_ms";
    public static final String LIVENESS_INTERVAL_MS = "liveness_interval_ms";

    public FeishuChannelConfig {
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(supervision, "supervision");
    }

    /**
     * Parses the host's configuration map.
     *
     * <p>{@code app_id} and {@code app_secret} are required. The optional
     * {@code readiness_timeout_ms} and {@code liveness_interval_ms} keys override
     * the corresponding values of {@code defaults}.</p>
     *
     * @throws ChannelConfigurationException if a required key is missing or a
     *         value cannot be parsed
     */
    public static FeishuChannelConfig fromMap(Map<String, String> config, SupervisionPolicy defaults) {
        Objects.requireNonNull(defaults, "defaults");
        if (config == null) {
            throw new ChannelConfigurationException("Feishu app_id and app_secret are required");
        }

        FeishuCredentials credentials = new FeishuCredentials(config.get(APP_ID), config.get(APP_SECRET));

        SupervisionPolicy supervision = defaults;
        try {
            String readiness = config.get(READINESS_TIMEOUT_MS);
            if (readiness != null && !readiness.isBlank()) {
                supervision = supervision.withReadinessTimeout(Duration.ofMillis(Long.parseLong(readiness.trim())));
            }
            String liveness = config.get(LIVENESS_INTERVAL_MS);
            if (liveness != null && !liveness.isBlank()) {
                supervision = supervision.withLivenessInterval(Duration.ofMillis(Long.parseLong(liveness.trim())));
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException
            throw new ChannelConfigurationException("Invalid Feishu supervision setting: " + e.getMessage(), e);
        }

        return new FeishuChannelConfig(credentials, supervision);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String appId;
        private String appSecret;
        private SupervisionPolicy supervision = SupervisionPolicy.defaults();

        public Builder withAppId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder withAppSecret(String appSecret) {
            this.appSecret = appSecret;
            return this;
        }

        public Builder withSupervision(SupervisionPolicy supervision) {
            this.supervision = supervision;
            return this;
        }

        public FeishuChannelConfig build() {
            return new FeishuChannelConfig(new FeishuCredentials(appId, appSecret), supervision);
        }
    }
}

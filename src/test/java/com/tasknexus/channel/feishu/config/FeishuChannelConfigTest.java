package com.tasknexus.channel.feishu.config;

import com.tasknexus.channel.api.ChannelConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeishuChannelConfigTest {

    @Test
    void parsesCredentialsAndKeepsDefaults() {
        FeishuChannelConfig config = FeishuChannelConfig.fromMap(
            Map.of("app_id", "cli_a", "app_secret", "s3cret"),
            SupervisionPolicy.defaults());

        assertEquals("cli_a", config.credentials().appId());
        assertEquals("s3cret", config.credentials().appSecret());
        assertEquals(SupervisionPolicy.defaults(), config.supervision());
    }

    @Test
    void supervisionOverridesAreApplied() {
        FeishuChannelConfig config = FeishuChannelConfig.fromMap(
            Map.of("app_id", "cli_a", "app_secret", "s3cret",
                "readiness_timeout_ms", "250",
                "liveness_interval_ms", " 50 "),
            SupervisionPolicy.defaults());

        assertEquals(Duration.ofMillis(250), config.supervision().readinessTimeout());
        assertEquals(Duration.ofMillis(50), config.supervision().livenessInterval());
    }

    @Test
    void missingOrBlankCredentialsAreRejected() {
        assertThrows(ChannelConfigurationException.class,
            () -> FeishuChannelConfig.fromMap(Map.of("app_id", "cli_a"), SupervisionPolicy.defaults()));
        assertThrows(ChannelConfigurationException.class,
            () -> FeishuChannelConfig.fromMap(Map.of("app_secret", "s"), SupervisionPolicy.defaults()));

        Map<String, String> blank = new HashMap<>();
        blank.put("app_id", "cli_a");
        blank.put("app_secret", "  ");
        assertThrows(ChannelConfigurationException.class,
            () -> FeishuChannelConfig.fromMap(blank, SupervisionPolicy.defaults()));
    }

    @Test
    void invalidSupervisionValuesAreConfigurationErrors() {
        assertThrows(ChannelConfigurationException.class, () -> FeishuChannelConfig.fromMap(
            Map.of("app_id", "cli_a", "app_secret", "s", "readiness_timeout_ms", "soon"),
            SupervisionPolicy.defaults()));
        assertThrows(ChannelConfigurationException.class, () -> FeishuChannelConfig.fromMap(
            Map.of("app_id", "cli_a", "app_secret", "s", "liveness_interval_ms", "0"),
            SupervisionPolicy.defaults()));
    }

    @Test
    void credentialsToStringMasksSecret() {
        FeishuCredentials credentials = new FeishuCredentials("cli_a", "s3cret");

        assertFalse(credentials.toString().contains("s3cret"));
        assertTrue(credentials.toString().contains("cli_a"));
    }

    @Test
    void supervisionPolicyRejectsNonPositiveDurations() {
        assertThrows(IllegalArgumentException.class,
            () -> new SupervisionPolicy(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new SupervisionPolicy(Duration.ofSeconds(1), Duration.ofMillis(-1)));
    }

    @Test
    void livenessIntervalBelowOneMillisecondIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new SupervisionPolicy(Duration.ofSeconds(1), Duration.ofNanos(500_000)));

        SupervisionPolicy policy = new SupervisionPolicy(Duration.ofNanos(500_000), Duration.ofMillis(1));
        assertEquals(Duration.ofMillis(1), policy.livenessInterval());
    }

    @Test
    void builderProducesConfig() {
        FeishuChannelConfig config = FeishuChannelConfig.builder()
            .withAppId("cli_a")
            .withAppSecret("s3cret")
            .build();

        assertEquals("cli_a", config.credentials().appId());
        assertEquals(SupervisionPolicy.defaults(), config.supervision());
    }
}

package alertcore.config;

import alertcore.correlate.CorrelationPattern;
import alertcore.model.AlertLevel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AlertingConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsProvideCompleteSettings() {
        AlertingSettings settings = AlertingSettingsBinder.bind(AlertingConfig.defaults());

        assertEquals("development", settings.getThresholds().getCurrentEnvironment());
        assertEquals(90.0, settings.getThresholds().environmentThresholds("development").get("disk_usage_percent"));
        assertEquals(10, settings.getThrottling().getMaxAlertsPerHour());
        assertEquals(5, settings.getThrottling().getCooldownMinutes());
        assertEquals(List.of("email", "slack"), settings.getRouting().channelsFor(AlertLevel.CRITICAL));
        assertEquals(List.of("slack"), settings.getRouting().channelsFor(AlertLevel.LOW));
        assertTrue(settings.getRouting().getEscalationChannels().isEmpty());
        assertThat(settings.getCorrelation().getPatterns()).extracting(CorrelationPattern::getName)
                .containsExactly("disk_issues", "memory_issues", "network_issues", "tool_failures");
        assertEquals(AlertLevel.CRITICAL, settings.getEscalation().getPersistence().getEscalateTo());
        assertEquals(AlertLevel.HIGH, settings.getEscalation().getFrequency().getThresholds().get(3));
        assertEquals(Duration.ofHours(24), settings.historyRetention());
    }

    @Test
    void missingUserFileFallsBackToDefaults() {
        AlertingConfig config = AlertingConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(10, config.getInt("throttling.max_alerts_per_hour", 0));
        assertEquals("#alerts", config.getString("notifications.slack.channel"));
    }

    @Test
    void userDocumentIsMergedKeyByKey() throws IOException {
        Path file = write("alert_config.yml",
                "throttling:\n" +
                "  max_alerts_per_hour: 3\n" +
                "thresholds:\n" +
                "  environments:\n" +
                "    production:\n" +
                "      disk_usage_percent: 60\n" +
                "escalation:\n" +
                "  force_channels: [dingding]\n" +
                "  policies:\n" +
                "    duration_escalation:\n" +
                "      thresholds:\n" +
                "        1800: CRITICAL\n");

        AlertingSettings settings = AlertingSettingsBinder.bind(AlertingConfig.load(file));

        assertEquals(3, settings.getThrottling().getMaxAlertsPerHour());
        assertEquals(5, settings.getThrottling().getCooldownMinutes());
        assertEquals(60.0, settings.getThresholds().environmentThresholds("production").get("disk_usage_percent"));
        assertEquals(75.0, settings.getThresholds().environmentThresholds("production").get("memory_usage_percent"));
        assertEquals(List.of("dingding"), settings.getRouting().getEscalationChannels());
        assertEquals(List.of("email", "slack", "dingding"), settings.getRouting().escalatedChannelsFor(AlertLevel.HIGH));
        assertEquals(Duration.ofHours(30), settings.historyRetention());
    }

    @Test
    void jsonDocumentsAreAccepted() throws IOException {
        Path file = write("alert_config.json", "{\"throttling\": {\"cooldown_minutes\": 1}}");

        AlertingSettings settings = AlertingSettingsBinder.bind(AlertingConfig.load(file));

        assertEquals(1, settings.getThrottling().getCooldownMinutes());
        assertEquals(10, settings.getThrottling().getMaxAlertsPerHour());
    }

    @Test
    void unknownLevelIsConfigurationError() throws IOException {
        Path file = write("alert_config.yml", "alert_levels:\n  URGENT: [slack]\n");

        AlertingConfig config = AlertingConfig.load(file);

        assertThrows(ConfigurationException.class, () -> AlertingSettingsBinder.bind(config));
    }

    @Test
    void nonNumericThresholdIsConfigurationError() throws IOException {
        Path file = write("alert_config.yml",
                "thresholds:\n  environments:\n    development:\n      disk_usage_percent: lots\n");

        AlertingConfig config = AlertingConfig.load(file);

        assertThrows(ConfigurationException.class, () -> AlertingSettingsBinder.bind(config));
    }

    @Test
    void retentionCoversLongCooldown() throws IOException {
        Path file = write("alert_config.yml", "throttling:\n  cooldown_minutes: 1800\n");

        AlertingSettings settings = AlertingSettingsBinder.bind(AlertingConfig.load(file));

        assertEquals(Duration.ofHours(30), settings.historyRetention());
    }

    @Test
    void emptyDocumentFallsBackToDefaults() throws IOException {
        Path file = write("alert_config.yml", "");
        Path blank = write("alert_config_blank.yml", "  \n\n");

        AlertingSettings settings = AlertingSettingsBinder.bind(AlertingConfig.load(file));

        assertEquals(10, settings.getThrottling().getMaxAlertsPerHour());
        assertEquals("development", AlertingConfig.load(blank).getString("thresholds.current_environment"));
    }

    @Test
    void malformedDocumentIsConfigurationError() throws IOException {
        Path file = write("alert_config.yml", "throttling: [unclosed\n");

        assertThrows(ConfigurationException.class, () -> AlertingConfig.load(file));
    }

    @Test
    void persistedValueSurvivesReload() throws IOException {
        Path file = write("alert_config.yml", "throttling:\n  max_alerts_per_hour: 4\n");
        AlertingConfig config = AlertingConfig.load(file);

        config.persistValue("thresholds.current_environment", "production");

        assertEquals("production", config.getString("thresholds.current_environment"));
        AlertingSettings reloaded = AlertingSettingsBinder.bind(AlertingConfig.load(file));
        assertEquals("production", reloaded.getThresholds().getCurrentEnvironment());
        assertEquals(4, reloaded.getThrottling().getMaxAlertsPerHour());
    }

    @Test
    void persistCreatesMissingUserFile() {
        Path file = tempDir.resolve("nested/alert_config.yml");
        AlertingConfig config = AlertingConfig.load(file);

        config.persistValue("thresholds.current_environment", "staging");

        assertTrue(Files.exists(file));
        assertEquals("staging", AlertingConfig.load(file).getString("thresholds.current_environment"));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}

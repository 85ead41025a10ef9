package alertcore.correlate;

import alertcore.config.AlertingConfig;
import alertcore.config.AlertingSettingsBinder;
import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.CorrelationGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AlertCorrelatorTest {
    private static final Instant NOW = Instant.parse("2026-10-19T10:05:00Z");

    private AlertCorrelator correlator;

    @BeforeEach
    void setUp() {
        CorrelationSettings settings = AlertingSettingsBinder.bind(AlertingConfig.defaults()).getCorrelation();
        correlator = new AlertCorrelator(settings, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Alert alert(String title, String source, AlertLevel level, String at) {
        return Alert.builder()
                .title(title)
                .message(title + " detected")
                .source(source)
                .level(level)
                .timestamp(Instant.parse(at))
                .build();
    }

    @Test
    void storageAlertsCollapseIntoOneComposite() {
        List<Alert> input = List.of(
                alert("Disk Space Warning", "system_monitor", AlertLevel.MEDIUM, "2026-10-19T10:00:00Z"),
                alert("Storage Full", "system_monitor", AlertLevel.MEDIUM, "2026-10-19T10:02:00Z"),
                alert("Disk I/O High", "system_monitor", AlertLevel.LOW, "2026-10-19T10:04:00Z"));

        List<Alert> result = correlator.correlate(input);

        assertEquals(1, result.size());
        Alert composite = result.get(0);
        CorrelationGroup group = composite.getCorrelationGroup();
        assertEquals(3, group.getAlertCount());
        assertEquals("disk_issues", group.getPattern());
        assertEquals(List.of("system_monitor"), group.getSources());
        assertEquals(10, group.getTimeWindowMinutes());
        assertThat(group.getAlerts()).extracting(CorrelationGroup.Member::getTitle)
                .containsExactly("Disk Space Warning", "Storage Full", "Disk I/O High");
        assertEquals("Storage System Issues", composite.getTitle());
        assertEquals(AlertLevel.HIGH, composite.getLevel());
        assertEquals(AlertCorrelator.SOURCE, composite.getSource());
        assertEquals("Correlated 3 related alerts from 1 sources", composite.getMessage());
    }

    @Test
    void groupLevelNeverDowngradesMembers() {
        List<Alert> input = List.of(
                alert("Disk full", "system_monitor", AlertLevel.CRITICAL, "2026-10-19T10:00:00Z"),
                alert("Storage slow", "tool_monitor", AlertLevel.HIGH, "2026-10-19T10:01:00Z"));

        Alert composite = correlator.correlate(input).get(0);

        assertEquals(AlertLevel.CRITICAL, composite.getLevel());
        assertEquals(List.of("system_monitor", "tool_monitor"), composite.getCorrelationGroup().getSources());
    }

    @Test
    void singleMatchPerPatternPassesThrough() {
        List<Alert> input = List.of(
                alert("Disk full", "system_monitor", AlertLevel.HIGH, "2026-10-19T10:00:00Z"),
                alert("Memory pressure", "system_monitor", AlertLevel.HIGH, "2026-10-19T10:01:00Z"));

        List<Alert> result = correlator.correlate(input);

        assertEquals(input, result);
        assertTrue(result.stream().noneMatch(Alert::isCorrelated));
    }

    @Test
    void alertsInDifferentBucketsAreNotMerged() {
        List<Alert> input = List.of(
                alert("Disk full", "system_monitor", AlertLevel.HIGH, "2026-10-19T10:08:00Z"),
                alert("Storage slow", "system_monitor", AlertLevel.HIGH, "2026-10-19T10:11:00Z"));

        assertEquals(2, correlator.correlate(input).size());
    }

    @Test
    void sourcesOutsideEveryPatternAreNeverMerged() {
        List<Alert> input = List.of(
                alert("Disk Usage Alert (System)", "custom_threshold_monitor", AlertLevel.HIGH, "2026-10-19T10:00:00Z"),
                alert("Disk Usage Alert (PlannerApp)", "custom_threshold_monitor", AlertLevel.HIGH, "2026-10-19T10:01:00Z"));

        assertEquals(2, correlator.correlate(input).size());
    }

    @Test
    void earlierPatternClaimsOverlappingAlerts() {
        List<Alert> input = List.of(
                alert("Disk swap pressure", "system_monitor", AlertLevel.MEDIUM, "2026-10-19T10:00:00Z"),
                alert("Disk full", "system_monitor", AlertLevel.MEDIUM, "2026-10-19T10:01:00Z"),
                alert("Memory low", "system_monitor", AlertLevel.MEDIUM, "2026-10-19T10:02:00Z"),
                alert("RAM exhausted", "system_monitor", AlertLevel.MEDIUM, "2026-10-19T10:03:00Z"));

        List<Alert> result = correlator.correlate(input);

        assertThat(result).extracting(a -> a.getCorrelationGroup().getPattern())
                .containsExactly("disk_issues", "memory_issues");
        assertEquals(2, result.get(0).getCorrelationGroup().getAlertCount());
        assertEquals(2, result.get(1).getCorrelationGroup().getAlertCount());
    }

    @Test
    void outputNeverExceedsInput() {
        String[] titles = {"Disk full", "Tool A Unhealthy", "Network timeout", "Memory low", "DNS failure",
                "Tool B crash", "Storage slow", "Unrelated"};
        String[] sources = {"system_monitor", "tool_monitor", "predictive_monitor", "alert_system"};
        List<Alert> input = new ArrayList<>();
        for (int i = 0; i < 24; i++) {
            input.add(alert(titles[i % titles.length], sources[i % sources.length], AlertLevel.values()[i % 4],
                    Instant.parse("2026-10-19T09:00:00Z").plusSeconds(i * 170L).toString()));
            List<Alert> result = correlator.correlate(input);
            assertThat(result.size()).isLessThanOrEqualTo(input.size());
        }
    }

    @Test
    void disabledCorrelationReturnsInputUnchanged() {
        AlertCorrelator disabled = new AlertCorrelator(CorrelationSettings.builder().enabled(false).build(),
                Clock.fixed(NOW, ZoneOffset.UTC));
        List<Alert> input = List.of(
                alert("Disk full", "system_monitor", AlertLevel.HIGH, "2026-10-19T10:00:00Z"),
                alert("Storage slow", "system_monitor", AlertLevel.HIGH, "2026-10-19T10:01:00Z"));

        assertEquals(input, disabled.correlate(input));
    }
}

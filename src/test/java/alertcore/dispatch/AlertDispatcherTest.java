package alertcore.dispatch;

import alertcore.history.InMemoryAlertHistory;
import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.AlertRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AlertDispatcherTest {
    private static final Instant NOW = Instant.parse("2026-10-19T10:05:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private final FakeChannel email = new FakeChannel("email", true);
    private final FakeChannel slack = new FakeChannel("slack", true);
    private final FakeChannel dingding = new FakeChannel("dingding", true);
    private final InMemoryAlertHistory history = new InMemoryAlertHistory(CLOCK, Duration.ofHours(24));
    private AlertDispatcher dispatcher;

    private AlertDispatcher dispatcher(RoutingSettings routing, Duration timeout) {
        ChannelRegistry registry = new ChannelRegistry().register(email).register(slack).register(dingding);
        dispatcher = new AlertDispatcher(registry, routing, CLOCK, timeout);
        return dispatcher;
    }

    private static RoutingSettings defaultRouting() {
        return RoutingSettings.builder()
                .levelRoute(AlertLevel.CRITICAL, List.of("email", "slack"))
                .levelRoute(AlertLevel.HIGH, List.of("email", "slack"))
                .levelRoute(AlertLevel.MEDIUM, List.of("slack"))
                .levelRoute(AlertLevel.LOW, List.of("slack"))
                .escalationChannel("dingding")
                .build();
    }

    private static Alert alert(AlertLevel level) {
        return Alert.builder().level(level).title("Tool X Unhealthy").message("down")
                .source("tool_monitor").timestamp(NOW).build();
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    void routesByLevelAndRecordsAttempt() {
        assertTrue(dispatcher(defaultRouting(), Duration.ofSeconds(5)).send(alert(AlertLevel.HIGH), history));

        assertEquals(1, email.getDelivered().size());
        assertEquals(1, slack.getDelivered().size());
        assertTrue(dingding.getDelivered().isEmpty());

        AlertRecord record = history.snapshot().get(0);
        assertEquals(List.of("email", "slack"), record.getChannels());
        assertEquals(NOW, record.getTimestamp());
        assertEquals(AlertLevel.HIGH, record.getLevel());
        assertEquals("tool_monitor", record.getSource());
        assertTrue(record.isSuccess());
        assertFalse(record.isEscalated());
        assertEquals(32, record.getId().length());
    }

    @Test
    void lowLevelGoesToSlackOnly() {
        dispatcher(defaultRouting(), Duration.ofSeconds(5)).send(alert(AlertLevel.LOW), history);

        assertTrue(email.getDelivered().isEmpty());
        assertEquals(1, slack.getDelivered().size());
    }

    @Test
    void disabledChannelsAreSkipped() {
        FakeChannel disabledSlack = new FakeChannel("slack", false);
        ChannelRegistry registry = new ChannelRegistry().register(email).register(disabledSlack);
        dispatcher = new AlertDispatcher(registry, defaultRouting(), CLOCK, Duration.ofSeconds(5));

        assertTrue(dispatcher.send(alert(AlertLevel.CRITICAL), history));
        assertTrue(disabledSlack.getDelivered().isEmpty());
        assertEquals(1, email.getDelivered().size());
    }

    @Test
    void escalatedAlertsAddEscalationChannelsAndKeepHistoryTitle() {
        Alert alert = alert(AlertLevel.MEDIUM);
        alert.escalateTo(AlertLevel.HIGH, "Frequency escalation: 3 occurrences in 60 minutes");

        assertTrue(dispatcher(defaultRouting(), Duration.ofSeconds(5)).sendEscalated(alert, history));

        assertEquals(1, email.getDelivered().size());
        assertEquals(1, slack.getDelivered().size());
        assertEquals(1, dingding.getDelivered().size());
        assertEquals("ESCALATED: Tool X Unhealthy", slack.getDelivered().get(0).getTitle());

        AlertRecord record = history.snapshot().get(0);
        assertEquals("Tool X Unhealthy", record.getTitle());
        assertTrue(record.isEscalated());
        assertEquals("Frequency escalation: 3 occurrences in 60 minutes", record.getEscalationReason());
        assertEquals(List.of("email", "slack", "dingding"), record.getChannels());
    }

    @Test
    void oneSuccessfulChannelIsEnough() {
        email.failing();

        assertTrue(dispatcher(defaultRouting(), Duration.ofSeconds(5)).send(alert(AlertLevel.HIGH), history));
        assertEquals(1, slack.getDelivered().size());
    }

    @Test
    void failedDeliveryIsStillRecorded() {
        email.failing();
        slack.failing();

        assertFalse(dispatcher(defaultRouting(), Duration.ofSeconds(5)).send(alert(AlertLevel.HIGH), history));

        assertEquals(1, history.snapshot().size());
        assertFalse(history.snapshot().get(0).isSuccess());
    }

    @Test
    void slowChannelTimesOutAsFailedAttempt() {
        email.delayedBy(Duration.ofSeconds(3));

        assertTrue(dispatcher(defaultRouting(), Duration.ofMillis(300)).send(alert(AlertLevel.HIGH), history));

        assertTrue(email.getDelivered().isEmpty());
        assertEquals(1, slack.getDelivered().size());
    }

    @Test
    void directDeliveryBypassesHistory() {
        Map<String, Boolean> results = dispatcher(defaultRouting(), Duration.ofSeconds(5))
                .deliverDirect(alert(AlertLevel.LOW), List.of("email", "dingding"));

        assertThat(results).containsEntry("email", true).containsEntry("dingding", true).hasSize(2);
        assertTrue(history.snapshot().isEmpty());
    }
}

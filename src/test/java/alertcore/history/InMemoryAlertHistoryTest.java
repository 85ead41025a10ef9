package alertcore.history;

import alertcore.MutableClock;
import alertcore.model.AlertLevel;
import alertcore.model.AlertRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryAlertHistoryTest {

    private final MutableClock clock = MutableClock.at("2026-10-19T10:00:00Z");

    private static AlertRecord record(String title, Instant at) {
        return AlertRecord.builder()
                .title(title)
                .source("tool_monitor")
                .level(AlertLevel.HIGH)
                .timestamp(at)
                .success(true)
                .build();
    }

    @Test
    void recentReturnsRecordsInsideWindowInAscendingOrder() {
        Instant now = clock.instant();
        InMemoryAlertHistory history = new InMemoryAlertHistory(clock, Duration.ofHours(24), List.of(
                record("c", now.minusSeconds(60)),
                record("a", now.minusSeconds(7200)),
                record("b", now.minusSeconds(1800))));

        List<AlertRecord> recent = history.recent(Duration.ofHours(1));

        assertThat(recent).extracting(AlertRecord::getTitle).containsExactly("b", "c");
        assertEquals(3, history.snapshot().size());
    }

    @Test
    void recentPrunesPastRetention() {
        Instant now = clock.instant();
        InMemoryAlertHistory history = new InMemoryAlertHistory(clock, Duration.ofHours(24), List.of(
                record("old", now.minus(Duration.ofHours(25))),
                record("new", now.minus(Duration.ofHours(1)))));

        history.recent(Duration.ofHours(48));

        assertThat(history.snapshot()).extracting(AlertRecord::getTitle).containsExactly("new");
    }

    @Test
    void appendKeepsTimestampOrderAndFillsMissingTimestamp() {
        InMemoryAlertHistory history = new InMemoryAlertHistory(clock, Duration.ofHours(24));
        history.append(record("first", clock.instant().minusSeconds(30)));
        history.append(record("second", clock.instant().minusSeconds(10)));
        history.append(record("late", clock.instant().minusSeconds(20)));
        history.append(record("now", null));

        assertThat(history.snapshot()).extracting(AlertRecord::getTitle)
                .containsExactly("first", "late", "second", "now");
        assertEquals(clock.instant(), history.snapshot().get(3).getTimestamp());
    }

    @Test
    void snapshotIsImmutable() {
        InMemoryAlertHistory history = new InMemoryAlertHistory(clock, Duration.ofHours(24));
        history.append(record("a", clock.instant()));

        List<AlertRecord> snapshot = history.snapshot();
        history.append(record("b", clock.instant()));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(record("c", clock.instant())));
    }

    @Test
    void pruneRemovesRecordsAtOrBeforeCutoff() {
        Instant now = clock.instant();
        InMemoryAlertHistory history = new InMemoryAlertHistory(clock, Duration.ofHours(24), List.of(
                record("a", now.minusSeconds(120)),
                record("b", now.minusSeconds(60)),
                record("c", now)));

        history.prune(now.minusSeconds(60));

        assertThat(history.snapshot()).extracting(AlertRecord::getTitle).containsExactly("c");
    }
}

package alertcore.escalate;

import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.AlertRecord;
import com.google.common.collect.ImmutableSortedMap;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * 持续时间升级 - 距同类告警首次出现的时长达到阈值
 */
@Getter
public class DurationEscalationPolicy implements EscalationPolicy {
    private final boolean enabled;
    private final NavigableMap<Integer, AlertLevel> thresholds;

    @Builder
    public DurationEscalationPolicy(boolean enabled, Map<Integer, AlertLevel> thresholds) {
        this.enabled = enabled;
        this.thresholds = thresholds != null ? ImmutableSortedMap.copyOf(thresholds) : ImmutableSortedMap.of();
    }

    @Override
    public String name() {
        return "duration";
    }

    @Override
    public Optional<Escalation> evaluate(Alert alert, List<AlertRecord> history, Instant now) {
        Optional<Instant> firstOccurrence = history.stream()
                .filter(r -> r.matches(alert))
                .map(AlertRecord::getTimestamp)
                .min(Instant::compareTo);
        if (firstOccurrence.isEmpty()) {
            return Optional.empty();
        }

        double minutes = Duration.between(firstOccurrence.get(), now).toMillis() / 60000.0;
        for (Map.Entry<Integer, AlertLevel> entry : thresholds.descendingMap().entrySet()) {
            if (minutes >= entry.getKey()) {
                if (entry.getValue().isHigherThan(alert.getLevel())) {
                    return Optional.of(new Escalation(entry.getValue(), String.format(Locale.ROOT,
                            "Duration escalation: %.1f minutes since first occurrence", minutes)));
                }
                break;
            }
        }
        return Optional.empty();
    }
}

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
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * 频率升级 - 时间窗口内同类告警出现次数达到阈值
 */
@Getter
public class FrequencyEscalationPolicy implements EscalationPolicy {
    private final boolean enabled;
    private final int timeWindowMinutes;
    private final NavigableMap<Integer, AlertLevel> thresholds;

    @Builder
    public FrequencyEscalationPolicy(boolean enabled, int timeWindowMinutes, Map<Integer, AlertLevel> thresholds) {
        this.enabled = enabled;
        this.timeWindowMinutes = timeWindowMinutes;
        this.thresholds = thresholds != null ? ImmutableSortedMap.copyOf(thresholds) : ImmutableSortedMap.of();
    }

    @Override
    public String name() {
        return "frequency";
    }

    @Override
    public Optional<Escalation> evaluate(Alert alert, List<AlertRecord> history, Instant now) {
        Instant cutoff = now.minus(Duration.ofMinutes(timeWindowMinutes));
        long occurrences = history.stream()
                .filter(r -> r.getTimestamp().isAfter(cutoff))
                .filter(r -> r.matches(alert))
                .count();

        // 从最高次数开始，命中的第一个阈值即结论
        for (Map.Entry<Integer, AlertLevel> entry : thresholds.descendingMap().entrySet()) {
            if (occurrences >= entry.getKey()) {
                if (entry.getValue().isHigherThan(alert.getLevel())) {
                    return Optional.of(new Escalation(entry.getValue(), String.format(
                            "Frequency escalation: %d occurrences in %d minutes", occurrences, timeWindowMinutes)));
                }
                break;
            }
        }
        return Optional.empty();
    }
}

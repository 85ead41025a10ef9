package alertcore.escalate;

import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.AlertRecord;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 持久性升级 - 回看 checkInterval * maxChecks 分钟，同类告警覆盖的检查区间数达到 maxChecks
 */
@Getter
@Builder
public class PersistenceEscalationPolicy implements EscalationPolicy {
    private final boolean enabled;
    private final int checkIntervalMinutes;
    private final int maxChecks;
    private final AlertLevel escalateTo;

    @Override
    public String name() {
        return "persistence";
    }

    public Duration lookback() {
        return Duration.ofMinutes((long) checkIntervalMinutes * maxChecks);
    }

    @Override
    public Optional<Escalation> evaluate(Alert alert, List<AlertRecord> history, Instant now) {
        if (checkIntervalMinutes <= 0 || maxChecks <= 0 || !escalateTo.isHigherThan(alert.getLevel())) {
            return Optional.empty();
        }
        Instant cutoff = now.minus(lookback());
        long intervalMillis = Duration.ofMinutes(checkIntervalMinutes).toMillis();

        Set<Long> intervals = new HashSet<>();
        for (AlertRecord record : history) {
            if (record.getTimestamp().isAfter(cutoff) && record.matches(alert)) {
                long elapsed = Duration.between(record.getTimestamp(), now).toMillis();
                intervals.add(Math.floorDiv(elapsed, intervalMillis));
            }
        }

        if (intervals.size() >= maxChecks) {
            return Optional.of(new Escalation(escalateTo, String.format(
                    "Persistent escalation: issue present in %d consecutive %d-min intervals",
                    intervals.size(), checkIntervalMinutes)));
        }
        return Optional.empty();
    }
}

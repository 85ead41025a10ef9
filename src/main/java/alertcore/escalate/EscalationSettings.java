package alertcore.escalate;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 升级配置
 */
@Value
@Builder
public class EscalationSettings {
    @Builder.Default
    boolean enabled = true;
    FrequencyEscalationPolicy frequency;
    DurationEscalationPolicy duration;
    PersistenceEscalationPolicy persistence;

    /**
     * 按固定顺序：频率 -> 持续时间 -> 持久性
     */
    public List<EscalationPolicy> orderedPolicies() {
        return Stream.<EscalationPolicy>of(frequency, duration, persistence)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    /**
     * 升级判断需要回看的最长时间
     */
    public Duration maxLookback() {
        Duration max = Duration.ZERO;
        if (frequency != null && frequency.isEnabled()) {
            max = longer(max, Duration.ofMinutes(frequency.getTimeWindowMinutes()));
        }
        if (duration != null && duration.isEnabled() && !duration.getThresholds().isEmpty()) {
            max = longer(max, Duration.ofMinutes(duration.getThresholds().lastKey()));
        }
        if (persistence != null && persistence.isEnabled()) {
            max = longer(max, persistence.lookback());
        }
        return max;
    }

    private static Duration longer(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}

package alertcore.throttle;

import alertcore.model.Alert;
import alertcore.model.AlertRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 限流闸门 - 全局每小时上限与全局冷却期，只作用于未升级的发送路径
 */
@Slf4j
public class ThrottleGate {
    private static final Duration RATE_WINDOW = Duration.ofHours(1);

    private final ThrottleSettings settings;
    private final Clock clock;

    public ThrottleGate(ThrottleSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public boolean allow(Alert alert, List<AlertRecord> history) {
        ThrottleState state = state(history);
        if (state.isRateLimited()) {
            log.warn("告警被限流，最近一小时已发送 {} 条: {}", state.getSentLastHour(), alert.getTitle());
            return false;
        }
        if (state.isCoolingDown()) {
            log.warn("告警被限流，冷却期剩余 {} 秒: {}", state.getCooldownRemaining().toSeconds(), alert.getTitle());
            return false;
        }
        return true;
    }

    public ThrottleState state(List<AlertRecord> history) {
        Instant now = clock.instant();
        Instant hourAgo = now.minus(RATE_WINDOW);
        int sentLastHour = 0;
        Instant lastSent = null;
        // 冷却期可能长于一小时，lastSent 取全部记录
        for (AlertRecord record : history) {
            Instant ts = record.getTimestamp();
            if (ts == null) {
                continue;
            }
            if (ts.isAfter(hourAgo)) {
                sentLastHour++;
            }
            if (lastSent == null || ts.isAfter(lastSent)) {
                lastSent = ts;
            }
        }

        Duration remaining = Duration.ZERO;
        if (lastSent != null) {
            Duration sinceLast = Duration.between(lastSent, now);
            Duration cooldown = Duration.ofMinutes(settings.getCooldownMinutes());
            if (sinceLast.compareTo(cooldown) < 0) {
                remaining = cooldown.minus(sinceLast);
            }
        }
        return new ThrottleState(sentLastHour, settings.getMaxAlertsPerHour(), lastSent, remaining);
    }
}

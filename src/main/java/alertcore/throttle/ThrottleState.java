package alertcore.throttle;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 当前限流状态，供 status 命令展示
 */
@Value
public class ThrottleState {
    int sentLastHour;
    int maxAlertsPerHour;
    Instant lastSentAt;
    Duration cooldownRemaining;

    public boolean isRateLimited() {
        return sentLastHour >= maxAlertsPerHour;
    }

    public boolean isCoolingDown() {
        return !cooldownRemaining.isZero() && !cooldownRemaining.isNegative();
    }
}

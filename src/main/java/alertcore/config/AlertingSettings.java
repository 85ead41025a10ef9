package alertcore.config;

import alertcore.correlate.CorrelationSettings;
import alertcore.dispatch.RoutingSettings;
import alertcore.escalate.EscalationSettings;
import alertcore.evaluate.ThresholdSettings;
import alertcore.throttle.ThrottleSettings;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * 合并后配置的不可变视图，每次批处理都显式传入
 */
@Value
@Builder
public class AlertingSettings {
    private static final Duration MIN_RETENTION = Duration.ofHours(24);

    ThresholdSettings thresholds;
    CorrelationSettings correlation;
    EscalationSettings escalation;
    ThrottleSettings throttling;
    RoutingSettings routing;
    /** 通道原始配置，按类型分组 */
    Map<String, Object> notifications;

    /**
     * 历史保留窗口：至少 24 小时，且覆盖所有升级策略的回看时间和冷却期
     */
    public Duration historyRetention() {
        Duration retention = MIN_RETENTION;
        Duration lookback = escalation.maxLookback();
        if (lookback.compareTo(retention) > 0) {
            retention = lookback;
        }
        if (throttling != null) {
            Duration cooldown = Duration.ofMinutes(throttling.getCooldownMinutes());
            if (cooldown.compareTo(retention) > 0) {
                retention = cooldown;
            }
        }
        return retention;
    }
}

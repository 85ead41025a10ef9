package alertcore.throttle;

import lombok.Builder;
import lombok.Value;

/**
 * 限流配置
 */
@Value
@Builder
public class ThrottleSettings {
    @Builder.Default
    int maxAlertsPerHour = 10;
    @Builder.Default
    int cooldownMinutes = 5;
}

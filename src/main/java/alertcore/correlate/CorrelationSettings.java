package alertcore.correlate;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 关联配置，patterns 保持声明顺序
 */
@Value
@Builder
public class CorrelationSettings {
    @Builder.Default
    boolean enabled = true;
    @Builder.Default
    int timeWindowMinutes = 10;
    @Singular
    List<CorrelationPattern> patterns;
}

package alertcore.evaluate;

import alertcore.model.AlertLevel;
import lombok.Builder;
import lombok.Value;

/**
 * 指标判定规则 - 越限方向以及升为 CRITICAL 的幅度
 */
@Value
@Builder
public class MetricRule {

    public enum Direction {
        /** 值大于等于阈值时告警 */
        ABOVE,
        /** 值低于阈值时告警，如可用率 */
        BELOW
    }

    public enum MarginMode {
        ADD,
        MULTIPLY
    }

    String metric;
    String label;
    @Builder.Default
    String unit = "";
    @Builder.Default
    Direction direction = Direction.ABOVE;
    @Builder.Default
    MarginMode marginMode = MarginMode.MULTIPLY;
    @Builder.Default
    double margin = 2.0;

    public boolean isBreached(double value, double threshold) {
        return direction == Direction.ABOVE ? value >= threshold : value < threshold;
    }

    public AlertLevel severity(double value, double threshold) {
        double criticalAt = criticalBoundary(threshold);
        boolean critical = direction == Direction.ABOVE ? value >= criticalAt : value < criticalAt;
        return critical ? AlertLevel.CRITICAL : AlertLevel.HIGH;
    }

    double criticalBoundary(double threshold) {
        if (direction == Direction.ABOVE) {
            return marginMode == MarginMode.ADD ? threshold + margin : threshold * margin;
        }
        return marginMode == MarginMode.ADD ? threshold - margin : threshold / margin;
    }

    /**
     * 未配置规则的指标按 "超过阈值，两倍即严重" 处理
     */
    public static MetricRule fallback(String metric) {
        return MetricRule.builder()
                .metric(metric)
                .label(humanize(metric))
                .build();
    }

    static String humanize(String metric) {
        StringBuilder label = new StringBuilder();
        for (String part : metric.split("_")) {
            if (part.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return label.toString();
    }
}

package alertcore.evaluate;

import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 阈值评估器 - 将指标快照与解析后的阈值比较，每个越限指标产生一条告警
 */
@Slf4j
public class ThresholdEvaluator {
    public static final String SOURCE = "custom_threshold_monitor";

    private final ThresholdSettings settings;
    private final Clock clock;

    public ThresholdEvaluator(ThresholdSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public ThresholdEvaluation evaluate(Map<String, ?> metrics, String tool, String environment) {
        List<Alert> alerts = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        if (!settings.isEnabled() || metrics == null || metrics.isEmpty()) {
            return new ThresholdEvaluation(alerts, skipped);
        }

        Map<String, Double> thresholds = settings.resolve(environment, tool);
        Instant now = clock.instant();

        for (Map.Entry<String, ?> entry : metrics.entrySet()) {
            String metric = entry.getKey();
            Double threshold = thresholds.get(metric);
            if (threshold == null) {
                continue;
            }
            Double value = toDouble(entry.getValue());
            if (value == null) {
                log.debug("指标值非法，已跳过: tool={} metric={} value={}", tool, metric, entry.getValue());
                skipped.add(tool != null ? tool + "." + metric : metric);
                continue;
            }

            MetricRule rule = settings.ruleFor(metric);
            if (!rule.isBreached(value, threshold)) {
                log.debug("指标未越限: tool={} metric={} value={} threshold={}", tool, metric, value, threshold);
                continue;
            }

            AlertLevel level = rule.severity(value, threshold);
            alerts.add(buildAlert(rule, tool, value, threshold, level, now));
        }
        return new ThresholdEvaluation(alerts, skipped);
    }

    private Alert buildAlert(MetricRule rule, String tool, double value, double threshold,
                             AlertLevel level, Instant now) {
        String subject = tool != null ? tool : "System";
        String label = rule.getLabel();
        return Alert.builder()
                .level(level)
                .title(String.format("%s Alert (%s)", label, subject))
                .message(String.format("%s is %s%s (threshold: %s%s)",
                        sentenceCase(label), format(value), rule.getUnit(), format(threshold), rule.getUnit()))
                .source(SOURCE)
                .tool(tool)
                .metric(rule.getMetric())
                .value(value)
                .threshold(threshold)
                .timestamp(now)
                .build();
    }

    /**
     * "Response Time" -> "Response time"，全大写缩写保持不变
     */
    static String sentenceCase(String label) {
        String[] words = label.split(" ");
        StringBuilder sb = new StringBuilder(words[0]);
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            sb.append(' ').append(StringUtils.isAllUpperCase(word) ? word : word.toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    static String format(double number) {
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }

    private static Double toDouble(Object v) {
        Double result = null;
        if (v instanceof Number) {
            result = ((Number) v).doubleValue();
        } else if (v instanceof CharSequence) {
            String s = v.toString().trim();
            if (!s.isEmpty()) {
                try {
                    result = Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        if (result == null || result.isNaN() || result.isInfinite()) {
            return null;
        }
        return result;
    }
}

package alertcore.config;

import alertcore.correlate.CorrelationPattern;
import alertcore.correlate.CorrelationSettings;
import alertcore.dispatch.RoutingSettings;
import alertcore.escalate.DurationEscalationPolicy;
import alertcore.escalate.EscalationSettings;
import alertcore.escalate.FrequencyEscalationPolicy;
import alertcore.escalate.PersistenceEscalationPolicy;
import alertcore.evaluate.MetricRule;
import alertcore.evaluate.ThresholdSettings;
import alertcore.model.AlertLevel;
import alertcore.throttle.ThrottleSettings;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 将配置文档转换为类型化的 AlertingSettings，并校验级别与数值
 */
@Slf4j
public final class AlertingSettingsBinder {

    private AlertingSettingsBinder() {
    }

    public static AlertingSettings bind(AlertingConfig config) {
        AlertingSettings settings = AlertingSettings.builder()
                .thresholds(bindThresholds(config))
                .correlation(bindCorrelation(config))
                .escalation(bindEscalation(config))
                .throttling(ThrottleSettings.builder()
                        .maxAlertsPerHour(config.getInt("throttling.max_alerts_per_hour", 10))
                        .cooldownMinutes(config.getInt("throttling.cooldown_minutes", 5))
                        .build())
                .routing(bindRouting(config))
                .notifications(Collections.unmodifiableMap(new LinkedHashMap<>(config.getSubConfig("notifications"))))
                .build();
        log.info("告警配置已解析: 当前环境={}, 关联模式={}个",
                settings.getThresholds().getCurrentEnvironment(), settings.getCorrelation().getPatterns().size());
        return settings;
    }

    static ThresholdSettings bindThresholds(AlertingConfig config) {
        ThresholdSettings.ThresholdSettingsBuilder builder = ThresholdSettings.builder()
                .enabled(config.getBoolean("thresholds.enabled", true))
                .currentEnvironment(config.getString("thresholds.current_environment", ThresholdSettings.FALLBACK_ENVIRONMENT));
        config.getSubConfig("thresholds.environments")
                .forEach((env, values) -> builder.environment(env, numberMap("thresholds.environments." + env, values)));
        config.getSubConfig("thresholds.tools")
                .forEach((tool, values) -> builder.tool(tool, numberMap("thresholds.tools." + tool, values)));
        config.getSubConfig("thresholds.metric_rules")
                .forEach((metric, rule) -> builder.metricRule(metric, bindMetricRule(metric, asMap("thresholds.metric_rules." + metric, rule))));
        return builder.build();
    }

    private static MetricRule bindMetricRule(String metric, Map<String, Object> rule) {
        String key = "thresholds.metric_rules." + metric;
        MetricRule.MetricRuleBuilder builder = MetricRule.builder()
                .metric(metric)
                .label(rule.get("label") != null ? rule.get("label").toString() : MetricRule.fallback(metric).getLabel());
        if (rule.get("unit") != null) {
            builder.unit(rule.get("unit").toString());
        }
        if (rule.get("direction") != null) {
            builder.direction(parseEnum(MetricRule.Direction.class, key + ".direction", rule.get("direction")));
        }
        if (rule.get("margin_mode") != null) {
            builder.marginMode(parseEnum(MetricRule.MarginMode.class, key + ".margin_mode", rule.get("margin_mode")));
        }
        if (rule.get("margin") != null) {
            builder.margin(toDouble(key + ".margin", rule.get("margin")));
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    static CorrelationSettings bindCorrelation(AlertingConfig config) {
        CorrelationSettings.CorrelationSettingsBuilder builder = CorrelationSettings.builder()
                .enabled(config.getBoolean("correlation.enabled", true))
                .timeWindowMinutes(positive("correlation.time_window_minutes", config.getInt("correlation.time_window_minutes", 10)));
        // 声明顺序即匹配优先级
        config.getSubConfig("correlation.patterns").forEach((name, raw) -> {
            String key = "correlation.patterns." + name;
            Map<String, Object> pattern = asMap(key, raw);
            CorrelationPattern.CorrelationPatternBuilder pb = CorrelationPattern.builder()
                    .name(name)
                    .groupTitle(pattern.get("group_title") != null ? pattern.get("group_title").toString() : null)
                    .groupLevel(pattern.get("group_level") != null ? parseLevel(key + ".group_level", pattern.get("group_level")) : null);
            if (pattern.get("keywords") instanceof List) {
                ((List<Object>) pattern.get("keywords")).forEach(k -> pb.keyword(String.valueOf(k)));
            }
            if (pattern.get("sources") instanceof List) {
                ((List<Object>) pattern.get("sources")).forEach(s -> pb.source(String.valueOf(s)));
            }
            builder.pattern(pb.build());
        });
        return builder.build();
    }

    static EscalationSettings bindEscalation(AlertingConfig config) {
        String freq = "escalation.policies.frequency_escalation";
        String dur = "escalation.policies.duration_escalation";
        String per = "escalation.policies.persistent_escalation";
        return EscalationSettings.builder()
                .enabled(config.getBoolean("escalation.enabled", true))
                .frequency(FrequencyEscalationPolicy.builder()
                        .enabled(config.getBoolean(freq + ".enabled", true))
                        .timeWindowMinutes(positive(freq + ".time_window_minutes", config.getInt(freq + ".time_window_minutes", 60)))
                        .thresholds(levelThresholds(freq + ".thresholds", config.getSubConfig(freq + ".thresholds")))
                        .build())
                .duration(DurationEscalationPolicy.builder()
                        .enabled(config.getBoolean(dur + ".enabled", true))
                        .thresholds(levelThresholds(dur + ".thresholds", config.getSubConfig(dur + ".thresholds")))
                        .build())
                .persistence(PersistenceEscalationPolicy.builder()
                        .enabled(config.getBoolean(per + ".enabled", true))
                        .checkIntervalMinutes(positive(per + ".check_interval_minutes", config.getInt(per + ".check_interval_minutes", 15)))
                        .maxChecks(positive(per + ".max_checks", config.getInt(per + ".max_checks", 4)))
                        .escalateTo(parseLevel(per + ".escalate_to", config.getString(per + ".escalate_to", "CRITICAL")))
                        .build())
                .build();
    }

    @SuppressWarnings("unchecked")
    static RoutingSettings bindRouting(AlertingConfig config) {
        RoutingSettings.RoutingSettingsBuilder builder = RoutingSettings.builder();
        config.getSubConfig("alert_levels").forEach((level, channels) -> {
            AlertLevel parsed = parseLevel("alert_levels." + level, level);
            if (!(channels instanceof List)) {
                throw new ConfigurationException("配置项 alert_levels." + level + " 必须是通道列表");
            }
            builder.levelRoute(parsed, List.copyOf((List<String>) channels));
        });
        config.getStringList("escalation.force_channels").forEach(builder::escalationChannel);
        return builder.build();
    }

    private static Map<Integer, AlertLevel> levelThresholds(String key, Map<String, Object> raw) {
        Map<Integer, AlertLevel> thresholds = new LinkedHashMap<>();
        raw.forEach((count, level) -> {
            try {
                thresholds.put(Integer.parseInt(count.trim()), parseLevel(key + "." + count, level));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("配置项 " + key + " 的键必须是整数: " + count, e);
            }
        });
        return thresholds;
    }

    private static Map<String, Double> numberMap(String key, Object raw) {
        Map<String, Double> result = new LinkedHashMap<>();
        asMap(key, raw).forEach((metric, value) -> result.put(metric, toDouble(key + "." + metric, value)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String key, Object raw) {
        if (raw == null) {
            return Map.of();
        }
        if (!(raw instanceof Map)) {
            throw new ConfigurationException("配置项 " + key + " 必须是映射");
        }
        return (Map<String, Object>) raw;
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("配置项 " + key + " 不是数值: " + value, e);
        }
    }

    private static int positive(String key, int value) {
        if (value <= 0) {
            throw new ConfigurationException("配置项 " + key + " 必须大于 0: " + value);
        }
        return value;
    }

    static AlertLevel parseLevel(String key, Object value) {
        try {
            return AlertLevel.fromString(value != null ? value.toString() : null);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("配置项 " + key + " 级别非法: " + value, e);
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, Object value) {
        try {
            return Enum.valueOf(type, value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("配置项 " + key + " 取值非法: " + value, e);
        }
    }
}

package alertcore.evaluate;

import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 阈值配置 - 环境级默认阈值与工具级覆盖
 */
@Getter
@Builder
public class ThresholdSettings {
    public static final String FALLBACK_ENVIRONMENT = "development";
    public static final String DEFAULT_TOOL_PROFILE = "default";

    @Builder.Default
    private final boolean enabled = true;
    @Builder.Default
    private final String currentEnvironment = FALLBACK_ENVIRONMENT;
    @Singular
    private final Map<String, Map<String, Double>> environments;
    @Singular
    private final Map<String, Map<String, Double>> tools;
    @Singular
    private final Map<String, MetricRule> metricRules;

    public boolean hasEnvironment(String environment) {
        return environment != null && environments.containsKey(environment);
    }

    /**
     * 环境阈值，未知环境回退到 development
     */
    public Map<String, Double> environmentThresholds(String environment) {
        String name = environment != null ? environment : currentEnvironment;
        Map<String, Double> thresholds = environments.get(name);
        if (thresholds == null) {
            thresholds = environments.get(FALLBACK_ENVIRONMENT);
        }
        return thresholds != null ? thresholds : ImmutableMap.of();
    }

    /**
     * 工具阈值，未配置的工具使用 default 配置
     */
    public Map<String, Double> toolThresholds(String tool) {
        if (tool == null) {
            return ImmutableMap.of();
        }
        Map<String, Double> thresholds = tools.get(tool);
        if (thresholds == null) {
            thresholds = tools.get(DEFAULT_TOOL_PROFILE);
        }
        return thresholds != null ? thresholds : ImmutableMap.of();
    }

    /**
     * 合并后的阈值 - 工具阈值覆盖同名环境阈值
     */
    public Map<String, Double> resolve(String environment, String tool) {
        Map<String, Double> merged = new LinkedHashMap<>(environmentThresholds(environment));
        merged.putAll(toolThresholds(tool));
        return ImmutableMap.copyOf(merged);
    }

    public MetricRule ruleFor(String metric) {
        MetricRule rule = metricRules.get(metric);
        return rule != null ? rule : MetricRule.fallback(metric);
    }
}

package alertcore.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * 单个工具的一次采集结果
 */
@Value
@Builder
public class ToolReading {
    public static final String HEALTHY = "healthy";

    String name;
    String status;
    @Singular
    Map<String, Object> metrics;
    /** 原始采集内容，作为告警详情 */
    String rawDetails;

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}

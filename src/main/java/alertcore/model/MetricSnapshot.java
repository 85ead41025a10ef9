package alertcore.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * 一次批处理的指标快照 - 系统指标、各工具指标以及预测摘要
 */
@Value
@Builder
public class MetricSnapshot {
    @Singular
    Map<String, Object> systemMetrics;
    @Singular
    List<ToolReading> tools;
    @Builder.Default
    boolean dashboardAvailable = true;
    int criticalRisks;
    String predictionDetails;
    /** 读取快照时遇到的非致命问题 */
    @Singular
    List<String> warnings;

    public static MetricSnapshot ofSystemMetrics(Map<String, Object> metrics) {
        return MetricSnapshot.builder().systemMetrics(metrics).build();
    }
}

package alertcore.evaluate;

import alertcore.model.Alert;
import lombok.Value;

import java.util.List;

/**
 * 一次阈值评估的结果 - 产生的告警以及因输入非法被跳过的指标
 */
@Value
public class ThresholdEvaluation {
    List<Alert> alerts;
    List<String> skippedMetrics;
}

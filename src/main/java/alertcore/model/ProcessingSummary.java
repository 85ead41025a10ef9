package alertcore.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 批处理结果统计
 */
@Data
public class ProcessingSummary {
    private String environment;
    private int rawCount;
    private int correlatedCount;
    private int correlationGroups;
    private int escalatedCount;
    private int sentCount;
    private int throttledCount;
    private int droppedCount;
    private final List<String> warnings = new ArrayList<>();

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void incrementEscalated() {
        escalatedCount++;
    }

    public void incrementSent() {
        sentCount++;
    }

    public void incrementThrottled() {
        throttledCount++;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

package alertcore.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * 关联组信息 - 仅出现在由多条原始告警合并而成的复合告警上
 */
@Value
@Builder
public class CorrelationGroup {
    String pattern;
    int alertCount;
    List<String> sources;
    int timeWindowMinutes;
    List<Member> alerts;

    /**
     * 组成员摘要，用于审计
     */
    @Value
    @Builder
    public static class Member {
        String title;
        AlertLevel level;
        String source;
        Instant timestamp;
    }
}

package alertcore.correlate;

import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.CorrelationGroup;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 告警关联器 - 同一时间桶内命中同一模式的多条告警合并为一条复合告警
 */
@Slf4j
public class AlertCorrelator {
    public static final String SOURCE = "alert_correlator";

    private final CorrelationSettings settings;
    private final Clock clock;

    public AlertCorrelator(CorrelationSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * 输出条数不会多于输入
     */
    public List<Alert> correlate(List<Alert> alerts) {
        if (!settings.isEnabled() || alerts == null || alerts.size() < 2) {
            return alerts == null ? new ArrayList<>() : new ArrayList<>(alerts);
        }

        List<Alert> result = new ArrayList<>();
        for (List<Alert> bucket : bucketize(alerts).values()) {
            if (bucket.size() <= 1) {
                result.addAll(bucket);
                continue;
            }
            result.addAll(correlateBucket(bucket));
        }

        if (result.size() < alerts.size()) {
            log.info("告警关联完成: {} 条原始告警合并为 {} 条", alerts.size(), result.size());
        }
        return result;
    }

    /**
     * 按时间窗口分桶，桶起点为时间戳向下取整到窗口整数倍
     */
    Map<Long, List<Alert>> bucketize(List<Alert> alerts) {
        long windowSeconds = Math.max(1, settings.getTimeWindowMinutes()) * 60L;
        Instant now = clock.instant();
        Map<Long, List<Alert>> buckets = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            Instant ts = alert.getTimestamp() != null ? alert.getTimestamp() : now;
            long bucketStart = Math.floorDiv(ts.getEpochSecond(), windowSeconds) * windowSeconds;
            buckets.computeIfAbsent(bucketStart, k -> new ArrayList<>()).add(alert);
        }
        return buckets;
    }

    /**
     * 按声明顺序依次尝试模式，先匹配的模式先占有告警
     */
    private List<Alert> correlateBucket(List<Alert> bucket) {
        List<Alert> grouped = new ArrayList<>();
        List<Alert> pool = new ArrayList<>(bucket);

        for (CorrelationPattern pattern : settings.getPatterns()) {
            if (pool.isEmpty()) {
                break;
            }
            List<Alert> matching = new ArrayList<>();
            for (Alert alert : pool) {
                if (pattern.matches(alert)) {
                    matching.add(alert);
                }
            }
            if (matching.size() > 1) {
                pool.removeAll(matching);
                grouped.add(buildComposite(pattern, matching));
                log.debug("模式 {} 关联了 {} 条告警", pattern.getName(), matching.size());
            }
        }

        grouped.addAll(pool);
        return grouped;
    }

    private Alert buildComposite(CorrelationPattern pattern, List<Alert> members) {
        AlertLevel maxLevel = AlertLevel.LOW;
        TreeSet<String> sources = new TreeSet<>();
        List<CorrelationGroup.Member> summaries = new ArrayList<>();
        StringBuilder details = new StringBuilder();

        for (Alert alert : members) {
            maxLevel = AlertLevel.max(maxLevel, alert.getLevel());
            sources.add(alert.getSource() != null ? alert.getSource() : "unknown");
            summaries.add(CorrelationGroup.Member.builder()
                    .title(alert.getTitle())
                    .level(alert.getLevel())
                    .source(alert.getSource())
                    .timestamp(alert.getTimestamp())
                    .build());
            if (details.length() > 0) {
                details.append('\n');
            }
            details.append("• ").append(alert.getTitle()).append(": ")
                    .append(alert.getMessage() != null ? alert.getMessage() : "No details");
        }

        // 模式级别只能抬高，不能降低成员最高级别
        AlertLevel level = AlertLevel.max(maxLevel, pattern.getGroupLevel());
        String title = pattern.getGroupTitle() != null
                ? pattern.getGroupTitle()
                : "Multiple " + members.get(0).getTitle();

        return Alert.builder()
                .level(level)
                .title(title)
                .message(String.format("Correlated %d related alerts from %d sources", members.size(), sources.size()))
                .source(SOURCE)
                .timestamp(clock.instant())
                .details(details.toString())
                .correlationGroup(CorrelationGroup.builder()
                        .pattern(pattern.getName())
                        .alertCount(members.size())
                        .sources(new ArrayList<>(sources))
                        .timeWindowMinutes(settings.getTimeWindowMinutes())
                        .alerts(summaries)
                        .build())
                .build();
    }
}

package alertcore.pipeline;

import alertcore.model.ProcessingSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * 定时批处理，alerting.schedule.enabled=true 时启用
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "alerting.schedule", name = "enabled", havingValue = "true")
public class ScheduledAlertCheck {
    private final AlertProcessor processor;
    private final DashboardSnapshotReader snapshotReader;
    private final Clock clock;

    @Value("${alerting.schedule.interval-ms:300000}")
    private long intervalMs;

    public ScheduledAlertCheck(AlertProcessor processor, DashboardSnapshotReader snapshotReader, Clock clock) {
        this.processor = processor;
        this.snapshotReader = snapshotReader;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${alerting.schedule.interval-ms:300000}")
    public void run() {
        try {
            // 本轮必须在下一轮开始前结束
            ProcessingSummary summary = processor.processBatch(snapshotReader.read(), null,
                    clock.instant().plus(Duration.ofMillis(intervalMs)));
            if (summary.hasWarnings()) {
                log.warn("定时批处理完成，警告: {}", summary.getWarnings());
            }
        } catch (Exception e) {
            log.error("定时批处理失败: {}", e.getMessage(), e);
        }
    }
}

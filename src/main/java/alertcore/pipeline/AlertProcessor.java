package alertcore.pipeline;

import alertcore.config.AlertingSettings;
import alertcore.correlate.AlertCorrelator;
import alertcore.dispatch.AlertDispatcher;
import alertcore.escalate.AlertEscalator;
import alertcore.evaluate.ThresholdEvaluation;
import alertcore.evaluate.ThresholdEvaluator;
import alertcore.evaluate.ThresholdSettings;
import alertcore.history.AlertHistoryStore;
import alertcore.history.AlertStoreException;
import alertcore.history.HistoryRepository;
import alertcore.history.InMemoryAlertHistory;
import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.AlertRecord;
import alertcore.model.MetricSnapshot;
import alertcore.model.ProcessingSummary;
import alertcore.model.ToolReading;
import alertcore.throttle.ThrottleGate;
import alertcore.throttle.ThrottleState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 告警批处理入口：评估 -> 关联 -> 逐条 {升级 -> 限流 -> 分发} -> 写回历史
 */
@Slf4j
public class AlertProcessor {
    public static final String TOOL_MONITOR_SOURCE = "tool_monitor";
    public static final String ALERT_SYSTEM_SOURCE = "alert_system";
    public static final String PREDICTIVE_SOURCE = "predictive_monitor";

    @Getter
    private final AlertingSettings settings;
    private final HistoryRepository repository;
    private final AlertDispatcher dispatcher;
    private final Clock clock;

    private final ThresholdEvaluator evaluator;
    private final AlertCorrelator correlator;
    private final AlertEscalator escalator;
    private final ThrottleGate throttleGate;

    public AlertProcessor(AlertingSettings settings, HistoryRepository repository,
                          AlertDispatcher dispatcher, Clock clock) {
        this.settings = settings;
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.evaluator = new ThresholdEvaluator(settings.getThresholds(), clock);
        this.correlator = new AlertCorrelator(settings.getCorrelation(), clock);
        this.escalator = new AlertEscalator(settings.getEscalation(), clock);
        this.throttleGate = new ThrottleGate(settings.getThrottling(), clock);
    }

    public ProcessingSummary processBatch(MetricSnapshot snapshot, String environment) {
        return processBatch(snapshot, environment, null);
    }

    /**
     * 执行一次批处理，截止时间之后尚未分发的告警本轮丢弃，下一轮重新评估
     *
     * @param environment 为空时使用配置中的当前环境
     * @param deadline    可为空
     */
    public ProcessingSummary processBatch(MetricSnapshot snapshot, String environment, Instant deadline) {
        ProcessingSummary summary = new ProcessingSummary();
        summary.setEnvironment(resolveEnvironment(environment, summary));
        snapshot.getWarnings().forEach(summary::addWarning);

        AlertHistoryStore history = openHistory(summary);

        List<Alert> raw = collectAlerts(snapshot, summary.getEnvironment(), summary);
        summary.setRawCount(raw.size());

        List<Alert> correlated = correlator.correlate(raw);
        summary.setCorrelatedCount(correlated.size());
        summary.setCorrelationGroups((int) correlated.stream().filter(Alert::isCorrelated).count());
        log.info("批处理开始: 环境={} 原始告警={} 关联后={}", summary.getEnvironment(), raw.size(), correlated.size());

        for (int i = 0; i < correlated.size(); i++) {
            if (deadline != null && clock.instant().isAfter(deadline)) {
                int dropped = correlated.size() - i;
                summary.setDroppedCount(dropped);
                summary.addWarning("批处理超过截止时间，丢弃 " + dropped + " 条未发送告警");
                log.warn("批处理超过截止时间，丢弃 {} 条未发送告警", dropped);
                break;
            }
            processAlert(correlated.get(i), history, summary);
        }

        saveHistory(history, summary);
        log.info("批处理完成: 升级={} 发送={} 限流={} 警告={}", summary.getEscalatedCount(),
                summary.getSentCount(), summary.getThrottledCount(), summary.getWarnings().size());
        return summary;
    }

    private void processAlert(Alert alert, AlertHistoryStore history, ProcessingSummary summary) {
        try {
            List<AlertRecord> recent = history.recent(settings.historyRetention());
            boolean sent;
            if (escalator.maybeEscalate(alert, recent)) {
                summary.incrementEscalated();
                sent = dispatcher.sendEscalated(alert, history);
            } else if (throttleGate.allow(alert, recent)) {
                sent = dispatcher.send(alert, history);
            } else {
                summary.incrementThrottled();
                return;
            }
            if (sent) {
                summary.incrementSent();
            } else {
                summary.addWarning("告警发送失败: " + alert.getTitle());
            }
        } catch (RuntimeException e) {
            log.error("处理告警异常: {}", alert.getTitle(), e);
            summary.addWarning("处理告警异常: " + alert.getTitle() + " - " + e.getMessage());
        }
    }

    /**
     * 从快照生成原始告警：系统指标、工具状态与指标、面板缺失、预测风险
     */
    List<Alert> collectAlerts(MetricSnapshot snapshot, String environment, ProcessingSummary summary) {
        List<Alert> alerts = new ArrayList<>();
        Instant now = clock.instant();

        if (snapshot.isDashboardAvailable()) {
            addEvaluation(alerts, evaluator.evaluate(snapshot.getSystemMetrics(), null, environment), summary);
            for (ToolReading tool : snapshot.getTools()) {
                if (!tool.isHealthy()) {
                    alerts.add(Alert.builder()
                            .level(AlertLevel.HIGH)
                            .title("Tool " + tool.getName() + " Unhealthy")
                            .message("Tool " + tool.getName() + " is reporting unhealthy status")
                            .source(TOOL_MONITOR_SOURCE)
                            .tool(tool.getName())
                            .details(tool.getRawDetails())
                            .timestamp(now)
                            .build());
                }
                if (!tool.getMetrics().isEmpty()) {
                    addEvaluation(alerts, evaluator.evaluate(tool.getMetrics(), tool.getName(), environment), summary);
                }
            }
        } else {
            alerts.add(Alert.builder()
                    .level(AlertLevel.MEDIUM)
                    .title("Dashboard Data Missing")
                    .message("Could not read dashboard data for monitoring")
                    .source(ALERT_SYSTEM_SOURCE)
                    .timestamp(now)
                    .build());
        }

        if (snapshot.getCriticalRisks() > 0) {
            alerts.add(Alert.builder()
                    .level(AlertLevel.CRITICAL)
                    .title("Critical Tool Failure Risk")
                    .message(snapshot.getCriticalRisks() + " tools have critical failure risk")
                    .source(PREDICTIVE_SOURCE)
                    .details(snapshot.getPredictionDetails())
                    .timestamp(now)
                    .build());
        }
        return alerts;
    }

    private static void addEvaluation(List<Alert> alerts, ThresholdEvaluation evaluation, ProcessingSummary summary) {
        alerts.addAll(evaluation.getAlerts());
        for (String skipped : evaluation.getSkippedMetrics()) {
            summary.addWarning("指标值非法，已跳过: " + skipped);
        }
    }

    private String resolveEnvironment(String environment, ProcessingSummary summary) {
        ThresholdSettings thresholds = settings.getThresholds();
        String name = StringUtils.isNotBlank(environment) ? environment : thresholds.getCurrentEnvironment();
        if (!thresholds.hasEnvironment(name)) {
            summary.addWarning("未知环境 " + name + "，使用 " + ThresholdSettings.FALLBACK_ENVIRONMENT);
            log.warn("未知环境 {}，使用 {}", name, ThresholdSettings.FALLBACK_ENVIRONMENT);
            return ThresholdSettings.FALLBACK_ENVIRONMENT;
        }
        return name;
    }

    private AlertHistoryStore openHistory(ProcessingSummary summary) {
        List<AlertRecord> records;
        try {
            records = repository.load();
        } catch (AlertStoreException e) {
            log.warn("读取告警历史失败，本轮使用空历史", e);
            summary.addWarning("读取告警历史失败，本轮使用空历史: " + e.getMessage());
            records = Collections.emptyList();
        }
        return new InMemoryAlertHistory(clock, settings.historyRetention(), records);
    }

    private void saveHistory(AlertHistoryStore history, ProcessingSummary summary) {
        try {
            repository.save(history.snapshot());
        } catch (AlertStoreException e) {
            log.warn("保存告警历史失败", e);
            summary.addWarning("保存告警历史失败: " + e.getMessage());
        }
    }

    /**
     * 当前历史与限流状态，读取失败时按空历史计算
     */
    public List<AlertRecord> loadHistory() {
        try {
            return repository.load();
        } catch (AlertStoreException e) {
            log.warn("读取告警历史失败", e);
            return Collections.emptyList();
        }
    }

    public ThrottleState throttleState() {
        AlertHistoryStore history = new InMemoryAlertHistory(clock, settings.historyRetention(), loadHistory());
        return throttleGate.state(history.recent(settings.historyRetention()));
    }
}

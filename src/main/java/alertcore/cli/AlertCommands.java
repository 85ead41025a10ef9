package alertcore.cli;

import alertcore.config.AlertingConfig;
import alertcore.config.AlertingSettings;
import alertcore.config.ConfigurationException;
import alertcore.dispatch.AlertDispatcher;
import alertcore.dispatch.ChannelRegistry;
import alertcore.dispatch.NotificationChannel;
import alertcore.evaluate.ThresholdSettings;
import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.model.ProcessingSummary;
import alertcore.pipeline.AlertProcessor;
import alertcore.pipeline.DashboardSnapshotReader;
import alertcore.throttle.ThrottleState;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.PrintStream;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 运维命令：check、status、thresholds、set-environment、test
 */
@Slf4j
public class AlertCommands {
    static final String USAGE = "Usage: alert-processing-core [check [--env=<name>]|status|thresholds|set-environment <name>|test]";
    private static final String ENV_OPTION = "--env=";

    private final AlertingConfig config;
    private final AlertProcessor processor;
    private final DashboardSnapshotReader snapshotReader;
    private final ChannelRegistry channelRegistry;
    private final AlertDispatcher dispatcher;
    private final Clock clock;
    private final PrintStream out;

    public AlertCommands(AlertingConfig config, AlertProcessor processor, DashboardSnapshotReader snapshotReader,
                         ChannelRegistry channelRegistry, AlertDispatcher dispatcher, Clock clock, PrintStream out) {
        this.config = config;
        this.processor = processor;
        this.snapshotReader = snapshotReader;
        this.channelRegistry = channelRegistry;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.out = out;
    }

    /**
     * @return 进程退出码，0 表示成功
     */
    public int execute(String... args) {
        if (args == null || args.length == 0) {
            out.println(USAGE);
            return 0;
        }
        switch (args[0]) {
            case "check":
                return check(args);
            case "status":
                return status();
            case "thresholds":
                return thresholds();
            case "set-environment":
                if (args.length < 2) {
                    out.println("Usage: alert-processing-core set-environment <name>");
                    return 2;
                }
                return setEnvironment(args[1]);
            case "test":
                return test();
            default:
                out.println(USAGE);
                return 2;
        }
    }

    int check(String... args) {
        String environment = null;
        for (int i = 1; i < args.length; i++) {
            if (args[i].startsWith(ENV_OPTION)) {
                environment = args[i].substring(ENV_OPTION.length());
            }
        }
        ProcessingSummary summary = processor.processBatch(snapshotReader.read(), environment);
        out.println("Alert check (" + summary.getEnvironment() + ")");
        out.println("  raw alerts:         " + summary.getRawCount());
        out.println("  after correlation:  " + summary.getCorrelatedCount()
                + " (" + summary.getCorrelationGroups() + " groups)");
        out.println("  escalated:          " + summary.getEscalatedCount());
        out.println("  sent:               " + summary.getSentCount());
        out.println("  throttled:          " + summary.getThrottledCount());
        if (summary.getDroppedCount() > 0) {
            out.println("  dropped:            " + summary.getDroppedCount());
        }
        for (String warning : summary.getWarnings()) {
            out.println("  warning: " + warning);
        }
        return 0;
    }

    int status() {
        AlertingSettings settings = processor.getSettings();
        out.println("Alerting status");
        out.println("Current environment: " + settings.getThresholds().getCurrentEnvironment());
        out.println("Channels:");
        for (NotificationChannel channel : channelRegistry.all()) {
            out.println("  " + channel.getType() + ": " + (channel.isEnabled() ? "enabled" : "disabled")
                    + " (" + channel.describe() + ")");
        }
        out.println("Routing:");
        for (AlertLevel level : AlertLevel.values()) {
            out.println("  " + level + " -> " + settings.getRouting().channelsFor(level));
        }
        if (!settings.getRouting().getEscalationChannels().isEmpty()) {
            out.println("  escalated +> " + settings.getRouting().getEscalationChannels());
        }
        ThrottleState throttle = processor.throttleState();
        out.println("Throttling:");
        out.println("  sent in last hour: " + throttle.getSentLastHour() + "/" + throttle.getMaxAlertsPerHour());
        out.println("  cooldown remaining: " + throttle.getCooldownRemaining().toSeconds() + "s");
        out.println("History records: " + processor.loadHistory().size());
        return 0;
    }

    int thresholds() {
        ThresholdSettings thresholds = processor.getSettings().getThresholds();
        if (!thresholds.isEnabled()) {
            out.println("Custom thresholds are disabled");
            return 0;
        }
        String current = thresholds.getCurrentEnvironment();
        out.println("Current environment: " + current);
        out.println("Environment thresholds:");
        thresholds.getEnvironments().forEach((env, values) -> {
            out.println((env.equals(current) ? "-> " : "   ") + env + ":");
            printValues(values);
        });
        out.println("Tool thresholds:");
        thresholds.getTools().forEach((tool, values) -> {
            out.println("   " + tool + ":");
            printValues(values);
        });
        out.println("Resolved for " + current + ":");
        printValues(thresholds.resolve(current, null));
        return 0;
    }

    int setEnvironment(String environment) {
        ThresholdSettings thresholds = processor.getSettings().getThresholds();
        if (!thresholds.hasEnvironment(environment)) {
            out.println("Unknown environment: " + environment + ". Available: "
                    + String.join(", ", thresholds.getEnvironments().keySet()));
            return 1;
        }
        try {
            config.persistValue("thresholds.current_environment", environment);
        } catch (ConfigurationException e) {
            log.error("保存环境配置失败", e);
            out.println("Failed to save environment: " + e.getMessage());
            return 1;
        }
        out.println("Environment set to: " + environment);
        return 0;
    }

    int test() {
        List<String> enabled = channelRegistry.enabled().stream()
                .map(NotificationChannel::getType)
                .collect(Collectors.toList());
        if (enabled.isEmpty()) {
            out.println("No notification channels are enabled");
            return 1;
        }
        Alert alert = Alert.builder()
                .level(AlertLevel.LOW)
                .title("Test Alert")
                .message("This is a test alert to verify your notification setup.")
                .source("test")
                .timestamp(clock.instant())
                .build();
        Map<String, Boolean> results = dispatcher.deliverDirect(alert, enabled);
        results.forEach((channel, ok) -> out.println("  " + channel + ": " + (ok ? "OK" : "FAILED")));
        long succeeded = results.values().stream().filter(Boolean::booleanValue).count();
        out.println(succeeded + "/" + results.size() + " channels delivered the test alert");
        return succeeded > 0 ? 0 : 1;
    }

    private void printValues(Map<String, Double> values) {
        values.forEach((metric, value) -> out.println("    " + metric + ": " + format(value)));
    }

    private static String format(Double value) {
        if (value == null) {
            return StringUtils.EMPTY;
        }
        return value == Math.rint(value) && !Double.isInfinite(value)
                ? String.valueOf(value.longValue())
                : String.valueOf(value);
    }
}

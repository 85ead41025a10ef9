package alertcore.config;

import alertcore.cli.AlertCommands;
import alertcore.dispatch.AlertDispatcher;
import alertcore.dispatch.ChannelRegistry;
import alertcore.history.HistoryRepository;
import alertcore.history.JsonFileHistoryRepository;
import alertcore.pipeline.AlertProcessor;
import alertcore.pipeline.DashboardSnapshotReader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
public class AlertingConfiguration {

    private final AlertingPaths paths;

    public AlertingConfiguration(AlertingPaths paths) {
        this.paths = paths;
    }

    @Bean
    public Clock alertingClock() {
        return Clock.systemUTC();
    }

    @Bean
    public AlertingConfig alertingConfig() {
        return AlertingConfig.load(Paths.get(paths.configPath));
    }

    @Bean
    public AlertingSettings alertingSettings(AlertingConfig alertingConfig) {
        return AlertingSettingsBinder.bind(alertingConfig);
    }

    @Bean
    public ChannelRegistry channelRegistry(AlertingSettings alertingSettings, Clock alertingClock) {
        return new ChannelRegistry().configure(alertingSettings.getNotifications(), alertingClock);
    }

    @Bean(destroyMethod = "close")
    public AlertDispatcher alertDispatcher(ChannelRegistry channelRegistry, AlertingSettings alertingSettings,
                                           Clock alertingClock) {
        return new AlertDispatcher(channelRegistry, alertingSettings.getRouting(), alertingClock,
                Duration.ofSeconds(paths.channelTimeoutSeconds));
    }

    @Bean
    public HistoryRepository historyRepository() {
        log.info("告警历史文件: {}", paths.historyPath);
        return new JsonFileHistoryRepository(Paths.get(paths.historyPath));
    }

    @Bean
    public AlertProcessor alertProcessor(AlertingSettings alertingSettings, HistoryRepository historyRepository,
                                         AlertDispatcher alertDispatcher, Clock alertingClock) {
        return new AlertProcessor(alertingSettings, historyRepository, alertDispatcher, alertingClock);
    }

    @Bean
    public DashboardSnapshotReader dashboardSnapshotReader() {
        return new DashboardSnapshotReader(Paths.get(paths.dashboardPath), Paths.get(paths.logsPath));
    }

    @Bean
    public AlertCommands alertCommands(AlertingConfig alertingConfig, AlertProcessor alertProcessor,
                                       DashboardSnapshotReader dashboardSnapshotReader,
                                       ChannelRegistry channelRegistry, AlertDispatcher alertDispatcher,
                                       Clock alertingClock) {
        return new AlertCommands(alertingConfig, alertProcessor, dashboardSnapshotReader, channelRegistry,
                alertDispatcher, alertingClock, System.out);
    }
}

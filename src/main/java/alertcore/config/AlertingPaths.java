package alertcore.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class AlertingPaths {

    @Value("${alerting.config.path}")
    public String configPath;

    @Value("${alerting.history.path}")
    public String historyPath;

    @Value("${alerting.dashboard.path}")
    public String dashboardPath;

    @Value("${alerting.logs.path}")
    public String logsPath;

    @Value("${alerting.channel-timeout-seconds:10}")
    public int channelTimeoutSeconds;
}

package alertcore;

import alertcore.cli.AlertCommandRunner;
import alertcore.config.AlertingSettings;
import alertcore.dispatch.ChannelRegistry;
import alertcore.pipeline.AlertProcessor;
import alertcore.pipeline.ScheduledAlertCheck;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@TestPropertySource(properties = {
        "alerting.config.path=target/test-data/alert_config.yml",
        "alerting.history.path=target/test-data/logs/alert_history.json",
        "alerting.dashboard.path=target/test-data/dashboard_data.json",
        "alerting.logs.path=target/test-data/logs"
})
public class AlertCoreApplicationTest {

    @Autowired
    ApplicationContext context;
    @Autowired
    AlertingSettings settings;
    @Autowired
    AlertProcessor processor;
    @Autowired
    ChannelRegistry channelRegistry;

    @Test
    void contextWiresPipelineFromDefaults() {
        assertEquals("development", settings.getThresholds().getCurrentEnvironment());
        assertSame(settings, processor.getSettings());
        assertEquals(3, channelRegistry.all().size());
        assertTrue(channelRegistry.enabled().isEmpty());
        assertTrue(context.getBeansOfType(ScheduledAlertCheck.class).isEmpty());
        assertEquals(0, context.getBean(AlertCommandRunner.class).getExitCode());
    }
}

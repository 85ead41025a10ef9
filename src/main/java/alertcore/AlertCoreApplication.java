package alertcore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

@Slf4j
@EnableScheduling
@SpringBootApplication
public class AlertCoreApplication {
    static final String SCHEDULE_ENABLED = "alerting.schedule.enabled";

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(AlertCoreApplication.class, args);
        // 定时模式常驻，命令模式执行完即退出并带回命令的退出码
        if (!context.getEnvironment().getProperty(SCHEDULE_ENABLED, Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
        log.info("定时告警检查已启用，进程保持运行");
    }

}

package alertcore.cli;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * 启动时执行命令，退出码交给 SpringApplication.exit
 */
@Slf4j
@Component
public class AlertCommandRunner implements CommandLineRunner, ExitCodeGenerator {
    private final AlertCommands commands;
    private volatile int exitCode;

    public AlertCommandRunner(AlertCommands commands) {
        this.commands = commands;
    }

    @Override
    public void run(String... args) {
        exitCode = commands.execute(args);
        if (exitCode != 0) {
            log.error("命令执行失败: exit={}", exitCode);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

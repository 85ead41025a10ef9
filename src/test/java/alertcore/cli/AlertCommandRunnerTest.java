package alertcore.cli;

import alertcore.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AlertCommandRunnerTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private AlertCommandRunner runner() {
        // 用法错误路径不会触及其他依赖
        AlertCommands commands = new AlertCommands(null, null, null, null, null,
                MutableClock.at("2026-10-19T10:05:00Z"), new PrintStream(buffer, true, StandardCharsets.UTF_8));
        return new AlertCommandRunner(commands);
    }

    @Test
    void unknownVerbBecomesExitCodeTwo() {
        AlertCommandRunner runner = runner();

        runner.run("bogus");

        assertEquals(2, runner.getExitCode());
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    void missingEnvironmentNameBecomesExitCodeTwo() {
        AlertCommandRunner runner = runner();

        runner.run("set-environment");

        assertEquals(2, runner.getExitCode());
    }

    @Test
    void noVerbExitsCleanly() {
        AlertCommandRunner runner = runner();

        runner.run();

        assertEquals(0, runner.getExitCode());
    }
}

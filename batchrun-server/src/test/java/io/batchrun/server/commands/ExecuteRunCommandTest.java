package io.batchrun.server.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.batchrun.core.command.Job;
import io.batchrun.core.run.JobRun;
import io.batchrun.core.run.LogEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

@DisplayName("execute-run")
@DisabledOnOs(OS.WINDOWS)
class ExecuteRunCommandTest extends BaseCommandTest {

    private ExecuteRunCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new ExecuteRunCommand();
        injectField(command, "environment", env);
    }

    @Test
    @DisplayName("exits with the child's exit code and stores its output")
    void runsChild() {
        Job job = shellJob("Answer", "echo forty-two; exit 3");
        JobRun run = env.getRuns().create(job, NOW);

        int exitCode = run(command, String.valueOf(run.id()));

        assertThat(exitCode).isEqualTo(3);
        JobRun stored = env.getRuns().findById(run.id()).orElseThrow();
        assertThat(stored.exitCode()).isEqualTo(3);
        assertThat(stored.pid()).isNotNull();
        assertThat(env.getLogStore().findEntries(run.id()))
                .extracting(LogEntry::text)
                .containsExactly("forty-two\n");
    }

    @Test
    @DisplayName("returns 1 for an unknown run")
    void unknownRun() {
        assertThat(run(command, "77")).isEqualTo(1);
        assertThat(errContent.toString()).contains("Unknown run: 77");
    }
}

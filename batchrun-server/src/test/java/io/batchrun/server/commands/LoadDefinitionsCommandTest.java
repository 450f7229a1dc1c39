package io.batchrun.server.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.batchrun.core.command.Job;
import io.batchrun.serialization.BatchrunSerializer;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("load-definitions")
class LoadDefinitionsCommandTest extends BaseCommandTest {

    private static final String DEFINITIONS =
            """
            {
              "commands": [
                {"kind": "executable", "name": "sh",
                 "parameters": {"script": {"type": "string", "required": true}},
                 "parameterFormat": "-c {script}"}
              ],
              "retentionPolicies": [
                {"identifier": "brief", "compactDelay": "PT1H",
                 "deleteLogsDelay": "P1D", "deleteRunDelay": "P7D"}
              ],
              "jobs": [
                {"name": "Ping", "command": "sh", "arguments": {"script": "echo ping"},
                 "retentionPolicy": "brief"}
              ],
              "scheduledJobs": [
                {"job": "Ping", "timezone": "UTC", "minutes": "0"}
              ]
            }
            """;

    @TempDir Path tempDir;

    private LoadDefinitionsCommand command;

    @BeforeEach
    void setUp() throws Exception {
        command = new LoadDefinitionsCommand();
        injectField(command, "objectMapper", BatchrunSerializer.createMapper());
        injectField(command, "catalog", env.getCatalog());
        injectField(command, "runQueue", env.getRunQueue());
    }

    @Test
    @DisplayName("stores definitions and fills the run queue")
    void loads() throws Exception {
        Path file = Files.writeString(tempDir.resolve("defs.json"), DEFINITIONS);

        assertThat(run(command, file.toString())).isZero();

        assertThat(outContent.toString())
                .contains("Loaded 1 commands, 1 retention policies, 1 jobs, 1 scheduled jobs");
        Job ping = env.getCatalog().findJobByName("Ping").orElseThrow();
        assertThat(ping.retentionPolicy().identifier()).isEqualTo("brief");
        assertThat(env.getScheduledJobs().findByName("Ping")).isPresent();
        assertThat(env.getQueueItems().findAll()).hasSize(3);
    }

    @Test
    @DisplayName("loading twice keeps one copy of everything")
    void idempotent() throws Exception {
        Path file = Files.writeString(tempDir.resolve("defs.json"), DEFINITIONS);

        run(command, file.toString());
        assertThat(run(command, file.toString())).isZero();

        assertThat(env.getCatalog().findAllJobs()).hasSize(1);
        assertThat(env.getScheduledJobs().findAll()).hasSize(1);
        assertThat(env.getQueueItems().findAll()).hasSize(3);
    }

    @Test
    @DisplayName("reports a missing file")
    void missingFile() {
        assertThat(run(command, tempDir.resolve("absent.json").toString())).isEqualTo(1);
        assertThat(errContent.toString()).contains("Not a file");
    }

    @Test
    @DisplayName("reports a reference to an unknown job")
    void unknownJob() throws Exception {
        Path file =
                Files.writeString(
                        tempDir.resolve("bad.json"),
                        "{\"scheduledJobs\": [{\"job\": \"Nope\", \"timezone\": \"UTC\"}]}");

        assertThat(run(command, file.toString())).isEqualTo(1);
        assertThat(errContent.toString()).contains("Unknown job: Nope");
    }
}

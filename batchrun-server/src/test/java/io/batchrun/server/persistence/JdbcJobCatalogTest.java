package io.batchrun.server.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.batchrun.core.command.CommandKind;
import io.batchrun.core.command.Job;
import io.batchrun.core.command.JobCommand;
import io.batchrun.core.command.ParameterSpec;
import io.batchrun.core.command.ParameterType;
import io.batchrun.core.command.RetentionPolicy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// Integration tests for {@link JdbcJobCatalog} against a real PostgreSQL instance.
class JdbcJobCatalogTest extends JdbcRepositoryTestBase {

    private JdbcJobCatalog catalog;

    @BeforeEach
    void setUp() throws Exception {
        truncateAll();
        catalog = new JdbcJobCatalog(dataSource);
    }

    @Test
    void defaultPolicy_isCreatedByMigration() {
        assertThat(catalog.findRetentionPolicy("default")).contains(RetentionPolicy.DEFAULT);
    }

    @Test
    void saveCommand_upsertsByName() {
        JobCommand first =
                catalog.saveCommand(
                        new JobCommand(0, CommandKind.EXECUTABLE, "backup", Map.of(), ""));
        JobCommand second =
                catalog.saveCommand(
                        new JobCommand(
                                0,
                                CommandKind.EXECUTABLE,
                                "backup",
                                Map.of("target", ParameterSpec.required(ParameterType.STRING)),
                                "--to {target}"));

        assertThat(second.id()).isEqualTo(first.id());
        JobCommand found = catalog.findCommand("backup").orElseThrow();
        assertThat(found.parameterFormat()).isEqualTo("--to {target}");
        assertThat(found.parameters())
                .containsEntry("target", ParameterSpec.required(ParameterType.STRING));
    }

    @Test
    void saveRetentionPolicy_roundTripsDurations() {
        RetentionPolicy policy =
                new RetentionPolicy(
                        "short", Duration.ofHours(6), Duration.ofDays(3), Duration.ofDays(30));

        catalog.saveRetentionPolicy(policy);

        assertThat(catalog.findRetentionPolicy("short")).contains(policy);
    }

    @Test
    void saveJob_roundTripsArgumentsAndPolicy() {
        RetentionPolicy policy =
                new RetentionPolicy("weekly", Duration.ZERO, Duration.ofDays(7), Duration.ofDays(7));
        Job job = storeShellJob(catalog, "Greeter", "echo hello", policy);

        Job found = catalog.findJobByName("Greeter").orElseThrow();

        assertThat(found.id()).isEqualTo(job.id());
        assertThat(found.command().name()).isEqualTo("sh");
        assertThat(found.arguments()).containsExactlyEntriesOf(Map.of("script", "echo hello"));
        assertThat(found.retentionPolicy()).isEqualTo(policy);
        assertThat(catalog.findJob(job.id())).contains(found);
    }

    @Test
    void saveJob_failsForUnsavedCommand() {
        JobCommand unsaved = new JobCommand(0, CommandKind.EXECUTABLE, "missing", Map.of(), "");
        Job job = new Job(0, "Orphan", "", unsaved, new LinkedHashMap<>(), RetentionPolicy.DEFAULT);

        assertThatThrownBy(() -> catalog.saveJob(job)).isInstanceOf(PersistenceException.class);
    }

    @Test
    void findAllJobs_returnsInCreationOrder() {
        storeShellJob(catalog, "b-job", "true");
        storeShellJob(catalog, "a-job", "true");

        assertThat(catalog.findAllJobs()).extracting(Job::name).containsExactly("b-job", "a-job");
        assertThat(catalog.findJobByName("nonexistent")).isEmpty();
    }
}

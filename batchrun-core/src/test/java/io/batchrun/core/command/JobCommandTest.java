package io.batchrun.core.command;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JobCommand and Job")
class JobCommandTest {

    private static final JobCommand EXPORT =
            new JobCommand(
                    0,
                    CommandKind.MANAGED,
                    "export_invoices",
                    Map.of(
                            "since", ParameterSpec.required(ParameterType.DATE),
                            "limit", ParameterSpec.optional(ParameterType.INT),
                            "dry", ParameterSpec.optional(ParameterType.BOOL)),
                    "--since {since}");

    @Nested
    @DisplayName("commandLine")
    class CommandLine {

        @Test
        @DisplayName("prefixes managed commands with the self command")
        void shouldPrefixManagedCommands() {
            List<String> argv =
                    EXPORT.commandLine(Map.of("since", "2024-01-31"), List.of("/opt/app", "--"));

            assertThat(argv).containsExactly("/opt/app", "--", "export_invoices", "--since", "2024-01-31");
        }

        @Test
        @DisplayName("starts executable commands with the program name")
        void shouldStartWithProgramName() {
            JobCommand echo = new JobCommand(0, CommandKind.EXECUTABLE, "echo", Map.of(), "hello");

            assertThat(echo.commandLine(Map.of(), List.of("/opt/app"))).containsExactly("echo", "hello");
        }

        @Test
        @DisplayName("renders as kind, name and template")
        void shouldRenderDisplayString() {
            assertThat(EXPORT).hasToString("managed: export_invoices --since {since}");
        }
    }

    @Nested
    @DisplayName("validateArguments")
    class Validation {

        @Test
        @DisplayName("accepts arguments matching the schema")
        void shouldAcceptValidArguments() {
            Map<String, Object> args = new LinkedHashMap<>();
            args.put("since", "2024-01-31");
            args.put("limit", 100L);
            args.put("dry", true);

            assertThatCode(() -> EXPORT.validateArguments(args)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("reports a missing required argument")
        void shouldReportMissingRequired() {
            assertThatThrownBy(() -> EXPORT.validateArguments(Map.of()))
                    .isInstanceOf(BatchrunException.class)
                    .hasMessageContaining("missing required argument 'since'");
        }

        @Test
        @DisplayName("reports undeclared arguments")
        void shouldReportUnknownArgument() {
            assertThatThrownBy(
                            () -> EXPORT.validateArguments(Map.of("since", "2024-01-31", "color", "red")))
                    .hasMessageContaining("unknown argument 'color'");
        }

        @Test
        @DisplayName("reports values of the wrong type")
        void shouldReportWrongType() {
            assertThatThrownBy(() -> EXPORT.validateArguments(Map.of("since", "yesterday")))
                    .isInstanceOf(BatchrunException.class)
                    .extracting(e -> ((BatchrunException) e).getCode())
                    .isEqualTo(ErrorCode.INVALID_ARGUMENTS);
        }

        @Test
        @DisplayName("rejects a job whose arguments do not fit the command")
        void shouldRejectInvalidJob() {
            assertThatThrownBy(
                            () ->
                                    new Job(
                                            0,
                                            "broken",
                                            "",
                                            EXPORT,
                                            Map.of("limit", "ten"),
                                            RetentionPolicy.DEFAULT))
                    .isInstanceOf(BatchrunException.class);
        }

        @Test
        @DisplayName("rejects a template placeholder the arguments cannot fill")
        void shouldRejectUnfillableTemplate() {
            JobCommand command =
                    new JobCommand(
                            0,
                            CommandKind.EXECUTABLE,
                            "report",
                            Map.of("id", ParameterSpec.optional(ParameterType.INT)),
                            "--id {id}");

            assertThatThrownBy(() -> command.validateArguments(Map.of()))
                    .hasMessageContaining("{id}");
        }
    }

    @Nested
    @DisplayName("RetentionPolicy")
    class Retention {

        @Test
        @DisplayName("default policy keeps logs for two weeks before compacting")
        void shouldHaveDocumentedDefaults() {
            assertThat(RetentionPolicy.DEFAULT.identifier()).isEqualTo("default");
            assertThat(RetentionPolicy.DEFAULT.compactDelay()).isEqualTo(Duration.ofDays(14));
            assertThat(RetentionPolicy.DEFAULT.deleteLogsDelay()).isEqualTo(Duration.ofDays(1461));
            assertThat(RetentionPolicy.DEFAULT.deleteRunDelay()).isEqualTo(Duration.ofDays(3652));
        }

        @Test
        @DisplayName("accepts equal delays")
        void shouldAcceptEqualDelays() {
            Duration day = Duration.ofDays(1);

            assertThatCode(() -> new RetentionPolicy("flat", day, day, day)).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("rejects unordered delays")
        void shouldRejectUnorderedDelays() {
            assertThatThrownBy(
                            () ->
                                    new RetentionPolicy(
                                            "bad",
                                            Duration.ofDays(10),
                                            Duration.ofDays(5),
                                            Duration.ofDays(20)))
                    .isInstanceOf(BatchrunException.class)
                    .extracting(e -> ((BatchrunException) e).getCode())
                    .isEqualTo(ErrorCode.INVALID_POLICY);
        }
    }

    @Nested
    @DisplayName("InMemoryJobCatalog")
    class Catalog {

        @Test
        @DisplayName("upserts jobs by name keeping their id")
        void shouldUpsertByName() {
            InMemoryJobCatalog catalog = new InMemoryJobCatalog();
            JobCommand command = catalog.saveCommand(EXPORT);
            Job first =
                    catalog.saveJob(
                            new Job(0, "nightly", "", command, Map.of("since", "2024-01-01"), RetentionPolicy.DEFAULT));
            Job second =
                    catalog.saveJob(
                            new Job(0, "nightly", "changed", command, Map.of("since", "2024-02-01"), RetentionPolicy.DEFAULT));

            assertThat(second.id()).isEqualTo(first.id());
            assertThat(catalog.findAllJobs()).containsExactly(second);
            assertThat(catalog.findJob(first.id())).contains(second);
        }

        @Test
        @DisplayName("knows the default retention policy")
        void shouldSeedDefaultPolicy() {
            assertThat(new InMemoryJobCatalog().findRetentionPolicy("default"))
                    .contains(RetentionPolicy.DEFAULT);
        }
    }
}

package io.batchrun.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.batchrun.core.TestJobs;
import io.batchrun.core.command.InMemoryJobCatalog;
import io.batchrun.core.command.Job;
import io.batchrun.core.exception.BatchrunException;
import io.batchrun.core.exception.ErrorCode;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScheduledJob")
class ScheduledJobTest {

    private Job job;

    @BeforeEach
    void setUp() {
        job = TestJobs.shellJob(new InMemoryJobCatalog(), "Nightly export", "true");
    }

    @Test
    @DisplayName("renders the schedule in its display string")
    void shouldRenderDisplayString() {
        ScheduledJob scheduled =
                ScheduledJob.builder().job(job).hours("2").minutes("15,45").weekdays("1-5").build();

        assertThat(scheduled)
                .hasToString("Scheduled job \"Nightly export\" @ y=* m=* d=* w=1-5 H=2 M=15,45");
    }

    @Test
    @DisplayName("defaults blank fields to every value")
    void shouldDefaultBlankFieldsToStar() {
        ScheduledJob scheduled = ScheduledJob.builder().job(job).years("").months(null).build();

        assertThat(scheduled.years()).isEqualTo("*");
        assertThat(scheduled.months()).isEqualTo("*");
        assertThat(scheduled.name()).isEqualTo("Nightly export");
    }

    @Test
    @DisplayName("builds its recurrence rule in its time zone")
    void shouldBuildRecurrenceRule() {
        ScheduledJob scheduled =
                ScheduledJob.builder().job(job).timezone("Europe/Helsinki").hours("1").minutes("0").build();

        assertThat(scheduled.recurrenceRule().timezone()).isEqualTo(ZoneId.of("Europe/Helsinki"));
        assertThat(scheduled.recurrenceRule().nextEvents(Instant.parse("2024-01-01T00:00:00Z"), 1))
                .first()
                .satisfies(t -> assertThat(t.toInstant()).isEqualTo(Instant.parse("2024-01-01T23:00:00Z")));
    }

    @Test
    @DisplayName("rejects an unknown time zone")
    void shouldRejectUnknownTimezone() {
        assertThatThrownBy(() -> ScheduledJob.builder().job(job).timezone("Mars/Olympus").build())
                .isInstanceOf(BatchrunException.class)
                .extracting(e -> ((BatchrunException) e).getCode())
                .isEqualTo(ErrorCode.INVALID_TIMEZONE);
    }

    @Test
    @DisplayName("rejects a malformed specifier")
    void shouldRejectMalformedSpecifier() {
        assertThatThrownBy(() -> ScheduledJob.builder().job(job).hours("25").build())
                .isInstanceOf(BatchrunException.class)
                .extracting(e -> ((BatchrunException) e).getCode())
                .isEqualTo(ErrorCode.OUT_OF_RANGE);
    }

    @Test
    @DisplayName("rejects specifiers longer than the stored column")
    void shouldRejectLongSpecifier() {
        String tooLong = "1,".repeat(100) + "1";

        assertThatThrownBy(() -> ScheduledJob.builder().job(job).minutes(tooLong).build())
                .isInstanceOf(BatchrunException.class)
                .hasMessageContaining("longer than 200");
    }

    @Test
    @DisplayName("keeps the id when upserted by name")
    void shouldUpsertByName() {
        InMemoryScheduledJobRepository repository = new InMemoryScheduledJobRepository();
        ScheduledJob first = repository.save(ScheduledJob.builder().job(job).build());
        ScheduledJob second = repository.save(ScheduledJob.builder().job(job).enabled(false).build());

        assertThat(second.id()).isEqualTo(first.id());
        assertThat(repository.findAll()).containsExactly(second);
        assertThat(repository.delete(first.id())).isTrue();
        assertThat(repository.findByName(job.name())).isEmpty();
    }
}

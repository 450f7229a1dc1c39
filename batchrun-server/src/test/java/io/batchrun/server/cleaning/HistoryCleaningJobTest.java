package io.batchrun.server.cleaning;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.batchrun.core.cleaning.CleaningPlan;
import io.batchrun.core.cleaning.CleaningReport;
import io.batchrun.core.cleaning.HistoryCleaner;
import io.batchrun.core.run.DeletionCounts;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HistoryCleaningJobTest {

    private final HistoryCleaner cleaner = mock(HistoryCleaner.class);
    private final HistoryCleaningJob job = new HistoryCleaningJob(cleaner);

    @Test
    void tick_cleansForReal() {
        when(cleaner.clean(false))
                .thenReturn(
                        new CleaningReport(
                                new CleaningPlan(Instant.EPOCH, Map.of()),
                                false,
                                DeletionCounts.NONE));

        job.tick();

        verify(cleaner).clean(false);
    }

    @Test
    void tick_survivesStorageFailure() {
        when(cleaner.clean(anyBoolean())).thenThrow(new IllegalStateException("database down"));

        assertThatCode(job::tick).doesNotThrowAnyException();
    }
}

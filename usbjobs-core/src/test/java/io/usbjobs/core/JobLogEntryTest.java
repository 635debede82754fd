package io.usbjobs.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class JobLogEntryTest {

    @Test
    void builderShouldSkipNullDetails() {
        JobLogEntry entry = JobLogEntry.builder(3L, LogLevel.ERROR, LogCategory.COPY, "Failed to copy a.mp3")
                .detail("source", "/music/a.mp3")
                .detail("destination", null)
                .file("/music/a.mp3", 0L)
                .errorCode("COPY_FAILED")
                .build();

        assertThat(entry.details()).containsOnlyKeys("source");
        assertThat(entry.errorCode()).isEqualTo("COPY_FAILED");
        assertThat(entry.createdAt()).isNull();
    }

    @Test
    void emptyDetailsShouldBeStoredAsNull() {
        assertThat(JobLogEntry.info(3L, LogCategory.SYSTEM, "hello").details()).isNull();
    }

    @Test
    void writerShouldSwallowSinkFailures() {
        JobLogSink sink = mock(JobLogSink.class);
        JobLogEntry entry = JobLogEntry.warning(9L, LogCategory.LEASE, "Lease lost");
        doThrow(new IllegalStateException("down")).when(sink).append(entry);

        JobLogWriter writer = new JobLogWriter(sink);

        assertThatCode(() -> writer.write(entry)).doesNotThrowAnyException();
        verify(sink).append(entry);
    }

    @Test
    void filterShouldCombineSelectors() {
        JobLogFilter filter = JobLogFilter.forJob(5L).withLevel(LogLevel.ERROR).withCategory(LogCategory.COPY);

        assertThat(filter.jobId()).isEqualTo(5L);
        assertThat(filter.level()).isEqualTo(LogLevel.ERROR);
        assertThat(filter.category()).isEqualTo(LogCategory.COPY);
        assertThat(filter.errorCode()).isNull();
        assertThat(filter.from()).isNull();
    }
}

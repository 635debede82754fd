package io.usbjobs.execution;

import io.usbjobs.JobExecutionContext;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobProcessingException;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.core.TestJobs;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class UsbWriteProcessorTest {

    @TempDir
    Path tmp;

    private RecordingLogSink sink;
    private JobExecutionContext context;
    private Path usb;

    @BeforeEach
    void setUp() throws IOException {
        sink = new RecordingLogSink();
        usb = Files.createDirectories(tmp.resolve("usb"));
        ProcessingJob job = TestJobs.leased(7L, "worker-a", Instant.now().plusSeconds(300), 1);

        context = mock(JobExecutionContext.class);
        when(context.job()).thenReturn(job);
        when(context.workerId()).thenReturn("worker-a");
        when(context.isLeaseLost()).thenReturn(false);
        when(context.advanceStatus(any())).thenReturn(true);
    }

    @Test
    void shouldWriteAndVerifyWholePlan() throws Exception {
        ContentPlan plan = plan(50);
        UsbWriteProcessor processor = processor(plan, 1L << 30, false);

        processor.process(context);

        InOrder order = inOrder(context);
        order.verify(context).advanceStatus(JobStatus.WRITING);
        order.verify(context).advanceStatus(JobStatus.VERIFYING);
        order.verify(context).reportProgress(eq(100), startsWith("USB write complete: 50 files"));
        for (FileTransfer t : plan.transfers()) {
            assertThat(t.destination()).exists();
        }
    }

    @Test
    void shouldFailBeforeWritingWhenSpaceIsShort() throws Exception {
        UsbWriteProcessor processor = processor(plan(5), 10L, false);

        assertThatThrownBy(() -> processor.process(context))
                .isInstanceOf(JobProcessingException.class)
                .extracting(e -> ((JobProcessingException) e).errorCode())
                .isEqualTo(FileErrorCode.INSUFFICIENT_SPACE.name());

        verify(context, never()).advanceStatus(JobStatus.WRITING);
        assertThat(Files.list(usb)).isEmpty();
    }

    @Test
    void shouldRejectPartialPlanByDefault() throws Exception {
        ContentPlan plan = planWithMissingFile();
        UsbWriteProcessor processor = processor(plan, 1L << 30, false);

        assertThatThrownBy(() -> processor.process(context))
                .isInstanceOf(JobProcessingException.class)
                .extracting(e -> ((JobProcessingException) e).errorCode())
                .isEqualTo(FileErrorCode.VALIDATION_FAILED.name());
        verify(context, never()).advanceStatus(JobStatus.WRITING);
    }

    @Test
    void shouldCopyValidFilesWhenPartialCopyIsAllowed() throws Exception {
        ContentPlan plan = planWithMissingFile();
        UsbWriteProcessor processor = processor(plan, 1L << 30, true);

        processor.process(context);

        verify(context).reportProgress(eq(100), startsWith("USB write complete: 2 files"));
        assertThat(plan.transfers().get(0).destination()).exists();
        assertThat(plan.transfers().get(1).destination()).doesNotExist();
        assertThat(plan.transfers().get(2).destination()).exists();
    }

    @Test
    void shouldAbortWhenLeaseIsLost() throws Exception {
        when(context.isLeaseLost()).thenReturn(true);
        UsbWriteProcessor processor = processor(plan(4), 1L << 30, false);

        assertThatThrownBy(() -> processor.process(context))
                .isInstanceOf(JobProcessingException.class)
                .extracting(e -> ((JobProcessingException) e).errorCode())
                .isEqualTo(FileErrorCode.LEASE_LOST.name());

        verify(context, never()).advanceStatus(JobStatus.VERIFYING);
        verify(context, never()).reportProgress(anyInt());
    }

    @Test
    void shouldRejectEmptyPlan() {
        UsbWriteProcessor processor = processor(new ContentPlan(usb, List.of()), 1L << 30, false);

        assertThatThrownBy(() -> processor.process(context))
                .isInstanceOf(JobProcessingException.class)
                .hasMessage("Content plan has no files");
    }

    private UsbWriteProcessor processor(ContentPlan plan, long freeBytes, boolean allowPartial) {
        ExecutionEngine engine = new ExecutionEngine(new JobLogWriter(sink), path -> freeBytes, new Random(11));
        return new UsbWriteProcessor(job -> plan, engine, VerificationConfig.defaults(), allowPartial);
    }

    private ContentPlan plan(int count) throws IOException {
        Path library = Files.createDirectories(tmp.resolve("library"));
        List<FileTransfer> transfers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Path source = library.resolve("song-" + i + ".mp3");
            Files.write(source, new byte[32]);
            transfers.add(new FileTransfer(source, usb.resolve("salsa").resolve("song-" + i + ".mp3")));
        }
        return new ContentPlan(usb, transfers);
    }

    private ContentPlan planWithMissingFile() throws IOException {
        List<FileTransfer> transfers = new ArrayList<>(plan(2).transfers());
        transfers.add(1, new FileTransfer(tmp.resolve("library/lost.mp3"), usb.resolve("salsa/lost.mp3")));
        return new ContentPlan(usb, transfers);
    }
}

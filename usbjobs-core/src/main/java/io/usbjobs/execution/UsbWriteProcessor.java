package io.usbjobs.execution;

import io.usbjobs.JobExecutionContext;
import io.usbjobs.JobProcessor;
import io.usbjobs.core.JobProcessingException;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.utils.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Default processor: resolve the content plan, then validate, check space, copy and verify.
 *
 * <p>Without {@code allowPartial} any per-file error fails the attempt. With it the job goes ahead with the
 * files that passed validation and succeeds if at least one file was copied and none failed verification.
 */
public class UsbWriteProcessor implements JobProcessor {
    private static final Logger log = LoggerFactory.getLogger(UsbWriteProcessor.class);

    private final ContentPlanResolver planResolver;
    private final ExecutionEngine engine;
    private final VerificationConfig verification;
    private final boolean allowPartial;

    public UsbWriteProcessor(ContentPlanResolver planResolver, ExecutionEngine engine,
                             VerificationConfig verification, boolean allowPartial) {
        this.planResolver = Objects.requireNonNull(planResolver, "planResolver must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.verification = Objects.requireNonNull(verification, "verification must not be null");
        this.allowPartial = allowPartial;
    }

    @Override
    public void process(JobExecutionContext context) throws Exception {
        ProcessingJob job = context.job();
        long jobId = job.id();

        ContentPlan plan = planResolver.resolve(job);
        if (plan == null || plan.transfers().isEmpty()) {
            throw new JobProcessingException(FileErrorCode.VALIDATION_FAILED.name(), "Content plan has no files");
        }
        context.reportProgress(0, "Content plan resolved: " + plan.transfers().size() + " files");

        List<Path> sources = plan.transfers().stream().map(FileTransfer::source).toList();
        FileValidationResult validation = engine.validateFiles(sources, jobId);
        if (validation.fileCount() == 0) {
            throw new JobProcessingException(FileErrorCode.VALIDATION_FAILED.name(),
                    "No valid files: " + validation.errors().size() + " errors");
        }
        if (!validation.valid() && !allowPartial) {
            throw new JobProcessingException(FileErrorCode.VALIDATION_FAILED.name(),
                    "Validation failed for " + validation.errors().size() + " of " + sources.size() + " files");
        }

        List<FileTransfer> transfers = validation.valid()
                ? plan.transfers()
                : onlyValid(plan.transfers(), validation.validFiles());

        if (!engine.checkSpace(plan.destinationRoot(), validation.totalSize(), jobId)) {
            throw new JobProcessingException(FileErrorCode.INSUFFICIENT_SPACE.name(),
                    "Not enough space on " + plan.destinationRoot() + " for " + ByteSizes.format(validation.totalSize()));
        }

        context.advanceStatus(JobStatus.WRITING);
        CopyResult copy = engine.copyFiles(transfers, jobId, context::reportProgress, () -> !context.isLeaseLost());
        if (context.isLeaseLost()) {
            throw new JobProcessingException(FileErrorCode.LEASE_LOST.name(),
                    "Lease lost after copying " + copy.filesProcessed() + " of " + transfers.size() + " files");
        }
        if (copy.filesProcessed() == 0 || (!copy.success() && !allowPartial)) {
            throw new JobProcessingException(FileErrorCode.COPY_FAILED.name(),
                    "Copy failed for " + copy.errors().size() + " of " + transfers.size() + " files");
        }

        context.advanceStatus(JobStatus.VERIFYING);
        VerificationResult verified = engine.verifyFiles(copy.copied(), jobId, verification);
        if (!verified.passed()) {
            throw new JobProcessingException(FileErrorCode.VERIFY_FAILED.name(),
                    "Verification failed for " + verified.failed() + " files");
        }

        context.reportProgress(100, "USB write complete: " + copy.filesProcessed() + " files, "
                + ByteSizes.format(copy.totalSize()));
        log.debug("usbjobs write finished jobId={} files={} verified={} skipped={}",
                jobId, copy.filesProcessed(), verified.verified(), verified.skipped());
    }

    private static List<FileTransfer> onlyValid(List<FileTransfer> transfers, List<Path> validSources) {
        Set<Path> valid = new HashSet<>(validSources);
        return transfers.stream().filter(t -> valid.contains(t.source())).toList();
    }
}

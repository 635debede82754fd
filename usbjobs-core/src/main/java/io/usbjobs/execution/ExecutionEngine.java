package io.usbjobs.execution;

import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.LogCategory;
import io.usbjobs.core.LogLevel;
import io.usbjobs.utils.ByteSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * Stateless four-stage pipeline run for a leased job: validate, check space, copy, verify.
 *
 * <p>Per-file problems never abort a stage; they are collected into the stage result and written to the
 * job log with an error code. Files are copied strictly one after another.
 */
public class ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    /**
     * A copy progress entry is written every this many successful files.
     */
    static final int COPY_LOG_EVERY = 10;

    private final JobLogWriter jobLog;
    private final DiskSpaceProbe spaceProbe;
    private final Random random;

    public ExecutionEngine(JobLogWriter jobLog) {
        this(jobLog, DiskSpaceProbe.fileStore(), new Random());
    }

    public ExecutionEngine(JobLogWriter jobLog, DiskSpaceProbe spaceProbe, Random random) {
        this.jobLog = Objects.requireNonNull(jobLog, "jobLog must not be null");
        this.spaceProbe = Objects.requireNonNull(spaceProbe, "spaceProbe must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Check that every file exists, is readable, is a regular file and is not empty.
     */
    public FileValidationResult validateFiles(List<Path> files, long jobId) {
        Objects.requireNonNull(files, "files must not be null");

        jobLog.write(JobLogEntry.info(jobId, LogCategory.VALIDATION,
                "Starting validation of " + files.size() + " files"));

        List<FileError> errors = new ArrayList<>();
        List<Path> validFiles = new ArrayList<>(files.size());
        long totalSize = 0;

        for (Path file : files) {
            FileError error;
            try {
                BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                if (!Files.isReadable(file)) {
                    error = new FileError(file.toString(), "File is not readable", FileErrorCode.NO_PERMISSION);
                } else if (!attrs.isRegularFile()) {
                    error = new FileError(file.toString(), "Not a file", FileErrorCode.NOT_FILE);
                } else if (attrs.size() == 0) {
                    error = new FileError(file.toString(), "File is empty", FileErrorCode.EMPTY_FILE);
                } else {
                    totalSize += attrs.size();
                    validFiles.add(file);
                    continue;
                }
            } catch (IOException e) {
                error = new FileError(file.toString(), describe(e), FileErrorCode.classify(e, FileErrorCode.UNKNOWN));
            }

            errors.add(error);
            jobLog.write(JobLogEntry.builder(jobId, LogLevel.ERROR, LogCategory.VALIDATION,
                            "File validation failed: " + fileName(file))
                    .file(file.toString(), null)
                    .errorCode(error.code().name())
                    .detail("error", error.message()));
        }

        jobLog.write(JobLogEntry.builder(jobId, errors.isEmpty() ? LogLevel.INFO : LogLevel.WARNING,
                        LogCategory.VALIDATION,
                        "Validation complete: " + validFiles.size() + "/" + files.size() + " files valid, "
                                + errors.size() + " errors")
                .detail("validCount", validFiles.size())
                .detail("totalCount", files.size())
                .detail("errors", errors.size()));

        log.debug("usbjobs validation jobId={} valid={} total={} bytes={}", jobId, validFiles.size(), files.size(), totalSize);
        return new FileValidationResult(errors.isEmpty(), errors, totalSize, validFiles.size(), validFiles);
    }

    /**
     * Compare the space available on the destination volume against {@code requiredBytes}.
     * A probe failure counts as not enough space.
     */
    public boolean checkSpace(Path destination, long requiredBytes, long jobId) {
        Objects.requireNonNull(destination, "destination must not be null");
        try {
            long available = spaceProbe.usableBytes(destination);
            boolean hasSpace = available >= requiredBytes;

            String message = hasSpace
                    ? "Space check passed: " + ByteSizes.format(available) + " available, " + ByteSizes.format(requiredBytes) + " required"
                    : "Insufficient space: " + ByteSizes.format(available) + " available, " + ByteSizes.format(requiredBytes) + " required";
            JobLogEntry.Builder entry = JobLogEntry.builder(jobId, hasSpace ? LogLevel.INFO : LogLevel.ERROR,
                            LogCategory.VALIDATION, message)
                    .detail("available", available)
                    .detail("required", requiredBytes)
                    .detail("hasSpace", hasSpace);
            if (!hasSpace) {
                entry.errorCode(FileErrorCode.INSUFFICIENT_SPACE.name());
            }
            jobLog.write(entry);
            return hasSpace;
        } catch (IOException e) {
            log.warn("usbjobs space check failed jobId={} destination={} msg={}", jobId, destination, e.getMessage());
            jobLog.write(JobLogEntry.builder(jobId, LogLevel.ERROR, LogCategory.VALIDATION,
                            "Failed to check space: " + describe(e))
                    .file(destination.toString(), null)
                    .errorCode(FileErrorCode.SPACE_CHECK_FAILED.name()));
            return false;
        }
    }

    /**
     * Copy files one by one, creating destination folders as needed and checking each copy's size.
     *
     * @param onProgress receives {@code round((i + 1) / total * 100)} after every file
     * @param leaseHeld  consulted before each file; once false the remaining files are skipped
     */
    public CopyResult copyFiles(List<FileTransfer> files, long jobId, IntConsumer onProgress, BooleanSupplier leaseHeld) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(onProgress, "onProgress must not be null");
        Objects.requireNonNull(leaseHeld, "leaseHeld must not be null");

        int total = files.size();
        int filesProcessed = 0;
        long totalSize = 0;
        List<String> errors = new ArrayList<>();
        List<FileTransfer> copied = new ArrayList<>(total);

        jobLog.write(JobLogEntry.info(jobId, LogCategory.COPY, "Starting file copy operation: " + total + " files"));

        for (int i = 0; i < total; i++) {
            if (!leaseHeld.getAsBoolean()) {
                int remaining = total - i;
                String msg = "Lease lost, skipped " + remaining + " remaining files";
                errors.add(msg);
                log.warn("usbjobs copy aborted jobId={} remaining={}", jobId, remaining);
                jobLog.write(JobLogEntry.builder(jobId, LogLevel.ERROR, LogCategory.COPY, msg)
                        .errorCode(FileErrorCode.LEASE_LOST.name())
                        .detail("remaining", remaining));
                break;
            }

            FileTransfer file = files.get(i);
            try {
                long size = copyOne(file);
                filesProcessed++;
                totalSize += size;
                copied.add(file);

                if (filesProcessed % COPY_LOG_EVERY == 0) {
                    jobLog.write(JobLogEntry.builder(jobId, LogLevel.INFO, LogCategory.COPY,
                                    "Copied " + filesProcessed + "/" + total + " files (" + ByteSizes.format(totalSize) + ")")
                            .detail("filesProcessed", filesProcessed)
                            .detail("totalSize", totalSize));
                }
            } catch (IOException e) {
                String msg = "Failed to copy " + fileName(file.source()) + ": " + describe(e);
                errors.add(msg);
                FileErrorCode code = e instanceof SizeMismatchException
                        ? FileErrorCode.SIZE_MISMATCH
                        : FileErrorCode.classify(e, FileErrorCode.COPY_FAILED);
                jobLog.write(JobLogEntry.builder(jobId, LogLevel.ERROR, LogCategory.COPY, msg)
                        .file(file.source().toString(), null)
                        .errorCode(code.name())
                        .detail("source", file.source().toString())
                        .detail("destination", file.destination().toString())
                        .detail("error", describe(e)));
            }

            onProgress.accept((int) Math.round((i + 1) * 100.0 / total));
        }

        jobLog.write(JobLogEntry.builder(jobId, errors.isEmpty() ? LogLevel.INFO : LogLevel.WARNING, LogCategory.COPY,
                        "Copy operation complete: " + filesProcessed + "/" + total + " files ("
                                + ByteSizes.format(totalSize) + "), " + errors.size() + " errors")
                .detail("filesProcessed", filesProcessed)
                .detail("totalFiles", total)
                .detail("totalSize", totalSize)
                .detail("errorCount", errors.size()));

        return new CopyResult(errors.isEmpty(), filesProcessed, totalSize, errors, copied);
    }

    private long copyOne(FileTransfer file) throws IOException {
        Path parent = file.destination().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        long sourceSize = Files.size(file.source());
        Files.copy(file.source(), file.destination(), StandardCopyOption.REPLACE_EXISTING);

        long destSize = Files.size(file.destination());
        if (destSize != sourceSize) {
            throw new SizeMismatchException(sourceSize, destSize);
        }
        return sourceSize;
    }

    /**
     * Compare source and destination sizes of the copied files, all of them or a random sample.
     */
    public VerificationResult verifyFiles(List<FileTransfer> files, long jobId, VerificationConfig config) {
        Objects.requireNonNull(files, "files must not be null");
        Objects.requireNonNull(config, "config must not be null");

        int total = files.size();
        List<FileTransfer> toVerify;
        if (config.strategy() == VerificationStrategy.SAMPLING) {
            toVerify = randomSample(files, config.sampleSize(total));
            jobLog.write(JobLogEntry.builder(jobId, LogLevel.INFO, LogCategory.VERIFY,
                            "Using sampling strategy: verifying " + toVerify.size() + " of " + total
                                    + " files (" + config.samplePercentage() + "%)")
                    .detail("strategy", "sampling")
                    .detail("sampleSize", toVerify.size())
                    .detail("totalFiles", total));
        } else {
            toVerify = files;
            jobLog.write(JobLogEntry.builder(jobId, LogLevel.INFO, LogCategory.VERIFY,
                            "Using full verification: checking all " + total + " files")
                    .detail("strategy", "full")
                    .detail("totalFiles", total));
        }

        int verified = 0;
        int failed = 0;
        int skipped = total - toVerify.size();

        for (FileTransfer file : toVerify) {
            try {
                long sourceSize = Files.size(file.source());
                long destSize = Files.size(file.destination());
                if (sourceSize == destSize) {
                    verified++;
                    continue;
                }
                failed++;
                jobLog.write(JobLogEntry.builder(jobId, LogLevel.ERROR, LogCategory.VERIFY,
                                "Size mismatch: " + fileName(file.destination()))
                        .file(file.destination().toString(), destSize)
                        .errorCode(FileErrorCode.SIZE_MISMATCH.name())
                        .detail("sourceSize", sourceSize)
                        .detail("destSize", destSize)
                        .detail("source", file.source().toString())
                        .detail("destination", file.destination().toString()));
            } catch (IOException e) {
                failed++;
                jobLog.write(JobLogEntry.builder(jobId, LogLevel.ERROR, LogCategory.VERIFY,
                                "Verification failed: " + fileName(file.destination()))
                        .file(file.destination().toString(), null)
                        .errorCode(FileErrorCode.classify(e, FileErrorCode.VERIFY_FAILED).name())
                        .detail("error", describe(e)));
            }
        }

        VerificationResult result = new VerificationResult(verified, failed, skipped);
        jobLog.write(JobLogEntry.builder(jobId, failed > 0 ? LogLevel.WARNING : LogLevel.INFO, LogCategory.VERIFY,
                        "Verification complete: " + verified + " verified, " + failed + " failed, " + skipped + " skipped")
                .detail("verified", verified)
                .detail("failed", failed)
                .detail("skipped", skipped));
        return result;
    }

    private List<FileTransfer> randomSample(List<FileTransfer> files, int size) {
        if (size >= files.size()) {
            return files;
        }
        List<FileTransfer> shuffled = new ArrayList<>(files);
        Collections.shuffle(shuffled, random);
        return shuffled.subList(0, size);
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }

    private static String describe(IOException e) {
        if (e.getMessage() == null) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static final class SizeMismatchException extends IOException {
        private SizeMismatchException(long expected, long actual) {
            super("Size mismatch after copy, expected " + expected + " bytes but found " + actual);
        }
    }
}

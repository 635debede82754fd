package io.usbjobs.execution;

import java.util.Objects;

/**
 * Verify-stage tuning. The default trades certainty for throughput on large file sets:
 * sample 20% of the files, never fewer than 10.
 */
public record VerificationConfig(
        VerificationStrategy strategy,
        int samplePercentage,
        int minSampleSize
) {

    public VerificationConfig {
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (samplePercentage < 1 || samplePercentage > 100) {
            throw new IllegalArgumentException("samplePercentage must be between 1 and 100");
        }
        if (minSampleSize < 0) {
            throw new IllegalArgumentException("minSampleSize must not be negative");
        }
    }

    public static VerificationConfig defaults() {
        return new VerificationConfig(VerificationStrategy.SAMPLING, 20, 10);
    }

    public static VerificationConfig full() {
        return new VerificationConfig(VerificationStrategy.FULL, 100, 0);
    }

    /**
     * Number of files to check out of {@code total}: all of them for FULL,
     * {@code min(total, max(minSampleSize, ceil(total * samplePercentage / 100)))} for SAMPLING.
     */
    public int sampleSize(int total) {
        if (strategy == VerificationStrategy.FULL) {
            return total;
        }
        long byPercent = ((long) total * samplePercentage + 99) / 100;
        long size = Math.max(minSampleSize, byPercent);
        return (int) Math.min(size, total);
    }
}

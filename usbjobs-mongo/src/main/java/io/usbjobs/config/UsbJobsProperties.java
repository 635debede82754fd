package io.usbjobs.config;

import io.usbjobs.execution.VerificationConfig;
import io.usbjobs.execution.VerificationStrategy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration for the job pipeline.
 */
@ConfigurationProperties(prefix = "usbjobs")
public class UsbJobsProperties {
    private String workerId;
    private Duration leaseDuration = Duration.ofSeconds(300);
    private Duration pollInterval = Duration.ofMillis(5000);
    private int maxConcurrentJobs = 1;
    private int leaseExtensionThresholdPercent = 50;
    private int maxAttempts = 3;
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private Duration reapInterval = Duration.ofSeconds(60);
    private boolean allowPartialCopy = false;
    private boolean ensureIndexesOnStartup = false;
    private final Verification verification = new Verification();

    /**
     * Reject settings the worker cannot run with.
     *
     * @throws IllegalArgumentException naming the first invalid property
     */
    public void validate() {
        requirePositive(leaseDuration, "usbjobs.leaseDuration");
        requirePositive(pollInterval, "usbjobs.pollInterval");
        requirePositive(reapInterval, "usbjobs.reapInterval");
        Objects.requireNonNull(shutdownGracePeriod, "usbjobs.shutdownGracePeriod must not be null");
        if (shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException("usbjobs.shutdownGracePeriod must not be negative");
        }
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("usbjobs.maxConcurrentJobs must be a positive number");
        }
        if (leaseExtensionThresholdPercent < 1 || leaseExtensionThresholdPercent > 99) {
            throw new IllegalArgumentException("usbjobs.leaseExtensionThresholdPercent must be between 1 and 99");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("usbjobs.maxAttempts must be a positive number");
        }
        verification.toConfig();
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getLeaseDuration() {
        return leaseDuration;
    }

    public void setLeaseDuration(Duration leaseDuration) {
        this.leaseDuration = leaseDuration;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    public void setMaxConcurrentJobs(int maxConcurrentJobs) {
        this.maxConcurrentJobs = maxConcurrentJobs;
    }

    public int getLeaseExtensionThresholdPercent() {
        return leaseExtensionThresholdPercent;
    }

    public void setLeaseExtensionThresholdPercent(int leaseExtensionThresholdPercent) {
        this.leaseExtensionThresholdPercent = leaseExtensionThresholdPercent;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getReapInterval() {
        return reapInterval;
    }

    public void setReapInterval(Duration reapInterval) {
        this.reapInterval = reapInterval;
    }

    public boolean isAllowPartialCopy() {
        return allowPartialCopy;
    }

    public void setAllowPartialCopy(boolean allowPartialCopy) {
        this.allowPartialCopy = allowPartialCopy;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Verification getVerification() {
        return verification;
    }

    /**
     * Verify-stage settings, bound from {@code usbjobs.verification.*}.
     */
    public static class Verification {
        private VerificationStrategy strategy = VerificationStrategy.SAMPLING;
        private int samplePercentage = 20;
        private int minSampleSize = 10;

        public VerificationConfig toConfig() {
            return new VerificationConfig(strategy, samplePercentage, minSampleSize);
        }

        public VerificationStrategy getStrategy() {
            return strategy;
        }

        public void setStrategy(VerificationStrategy strategy) {
            this.strategy = strategy;
        }

        public int getSamplePercentage() {
            return samplePercentage;
        }

        public void setSamplePercentage(int samplePercentage) {
            this.samplePercentage = samplePercentage;
        }

        public int getMinSampleSize() {
            return minSampleSize;
        }

        public void setMinSampleSize(int minSampleSize) {
            this.minSampleSize = minSampleSize;
        }
    }
}

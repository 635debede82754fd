package io.usbjobs.core;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * JobFilter describes which jobs to list.
 *
 * <p>This is an API-layer object (NOT a MongoDB query). The store layer translates it.
 * Every selector is optional; an empty filter matches every job.
 */
public final class JobFilter {

    private final Set<JobStatus> statuses;
    private final String orderRef;
    private final String assignedDeviceId;
    private final Instant createdFrom;
    private final Instant createdTo;

    private JobFilter(Builder b) {
        this.statuses = b.statuses.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.statuses));
        this.orderRef = blankToNull(b.orderRef);
        this.assignedDeviceId = blankToNull(b.assignedDeviceId);
        this.createdFrom = b.createdFrom;
        this.createdTo = b.createdTo;
    }

    public static JobFilter all() {
        return builder().build();
    }

    public static JobFilter byStatus(JobStatus first, JobStatus... rest) {
        return builder().status(first, rest).build();
    }

    public Set<JobStatus> statuses() {
        return statuses;
    }

    public String orderRef() {
        return orderRef;
    }

    public String assignedDeviceId() {
        return assignedDeviceId;
    }

    public Instant createdFrom() {
        return createdFrom;
    }

    public Instant createdTo() {
        return createdTo;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<JobStatus> statuses = EnumSet.noneOf(JobStatus.class);
        private String orderRef;
        private String assignedDeviceId;
        private Instant createdFrom;
        private Instant createdTo;

        public Builder status(JobStatus first, JobStatus... rest) {
            statuses.add(first);
            Collections.addAll(statuses, rest);
            return this;
        }

        public Builder orderRef(String orderRef) {
            this.orderRef = orderRef;
            return this;
        }

        public Builder assignedDeviceId(String assignedDeviceId) {
            this.assignedDeviceId = assignedDeviceId;
            return this;
        }

        public Builder createdFrom(Instant createdFrom) {
            this.createdFrom = createdFrom;
            return this;
        }

        public Builder createdTo(Instant createdTo) {
            this.createdTo = createdTo;
            return this;
        }

        public JobFilter build() {
            if (createdFrom != null && createdTo != null && createdFrom.isAfter(createdTo)) {
                throw new IllegalArgumentException("createdFrom must not be after createdTo");
            }
            return new JobFilter(this);
        }
    }
}

package io.usbjobs.internal.mongo;

import io.usbjobs.core.JobStatus;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.core.StorageStatus;
import org.springframework.data.mongodb.core.query.Criteria;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Shared mapping between {@link ProcessingJobDocument} and {@link ProcessingJob}.
 */
final class JobDocuments {

    private JobDocuments() {
    }

    static ProcessingJob toJob(ProcessingJobDocument doc) {
        return new ProcessingJob(
                doc.getId() == null ? 0L : doc.getId(),
                doc.getJobToken(),
                doc.getOrderRef(),
                doc.getCapacity(),
                doc.getPreferences(),
                doc.getContentPlanId(),
                doc.getVolumeLabel(),
                doc.getAssignedDeviceId(),
                statusOf(doc),
                doc.getProgress(),
                doc.getFailReason(),
                doc.getStartedAt(),
                doc.getFinishedAt(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getLockedBy(),
                doc.getLockedUntil(),
                doc.getAttempts(),
                doc.getLastError()
        );
    }

    static JobStatus statusOf(ProcessingJobDocument doc) {
        if (doc.getStatus() != null) {
            return doc.getStatus();
        }
        return StorageStatus.fromValue(doc.getStorageStatus()).toJobStatus();
    }

    /**
     * Match jobs in any of the given statuses, including rows that only carry the coarse status.
     */
    static Criteria statusIn(Collection<JobStatus> statuses) {
        List<String> coarse = new ArrayList<>();
        for (StorageStatus s : StorageStatus.values()) {
            if (statuses.contains(s.toJobStatus())) {
                coarse.add(s.value());
            }
        }
        Criteria fine = Criteria.where("status").in(statuses);
        if (coarse.isEmpty()) {
            return fine;
        }
        Criteria legacy = Criteria.where("status").is(null).and("storageStatus").in(coarse);
        return new Criteria().orOperator(fine, legacy);
    }

    static String appendError(String previous, String message) {
        if (previous == null || previous.isBlank()) {
            return message;
        }
        return previous + "; " + message;
    }
}

package io.usbjobs.core;

import java.time.Instant;
import java.util.Map;

public final class TestJobs {

    private TestJobs() {
    }

    public static ProcessingJob leased(long id, String workerId, Instant lockedUntil, int attempts) {
        Instant now = Instant.now();
        return new ProcessingJob(id, "job-" + id, "order-" + id, "32GB", Map.of("genres", "salsa"),
                null, "MUSICA", null, JobStatus.PROCESSING, 0, null,
                now, null, now, now, workerId, lockedUntil, attempts, null);
    }

    public static ProcessingJob pending(long id) {
        Instant now = Instant.now();
        return new ProcessingJob(id, "job-" + id, "order-" + id, "32GB", null,
                null, null, null, JobStatus.PENDING, 0, null,
                null, null, now, now, null, null, 0, null);
    }
}

package io.usbjobs.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobStatusTest {

    @Test
    void fineStatusesShouldCollapseToCoarseVocabulary() {
        assertThat(StorageStatus.from(JobStatus.PENDING)).isEqualTo(StorageStatus.QUEUED);
        assertThat(StorageStatus.from(JobStatus.RETRY)).isEqualTo(StorageStatus.QUEUED);
        assertThat(StorageStatus.from(JobStatus.PROCESSING)).isEqualTo(StorageStatus.PROCESSING);
        assertThat(StorageStatus.from(JobStatus.WRITING)).isEqualTo(StorageStatus.PROCESSING);
        assertThat(StorageStatus.from(JobStatus.VERIFYING)).isEqualTo(StorageStatus.PROCESSING);
        assertThat(StorageStatus.from(JobStatus.DONE)).isEqualTo(StorageStatus.COMPLETED);
        assertThat(StorageStatus.from(JobStatus.FAILED)).isEqualTo(StorageStatus.FAILED);
        assertThat(StorageStatus.from(JobStatus.CANCELED)).isEqualTo(StorageStatus.FAILED);
    }

    @Test
    void coarseStatusesShouldReadBackAsFineStatuses() {
        assertThat(StorageStatus.fromValue("queued").toJobStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(StorageStatus.fromValue("completed").toJobStatus()).isEqualTo(JobStatus.DONE);
        assertThat(StorageStatus.fromValue("error").toJobStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(StorageStatus.fromValue("failed").toJobStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(StorageStatus.fromValue("something-else")).isEqualTo(StorageStatus.QUEUED);
    }

    @Test
    void statusGroupsShouldNotOverlap() {
        for (JobStatus s : JobStatus.values()) {
            int groups = (s.isAcquirable() ? 1 : 0) + (s.isActive() ? 1 : 0) + (s.isTerminal() ? 1 : 0);
            assertThat(groups).as(s.name()).isEqualTo(1);
        }
        assertThat(JobStatus.fromValue("verifying")).isEqualTo(JobStatus.VERIFYING);
        assertThatThrownBy(() -> JobStatus.fromValue("queued")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void leaseIsActiveOnlyWithOwnerAndFutureExpiry() {
        Instant now = Instant.now();

        assertThat(TestJobs.leased(1, "worker-a", now.plusSeconds(10), 1).hasActiveLease(now)).isTrue();
        assertThat(TestJobs.leased(1, "worker-a", now.minusSeconds(1), 1).hasActiveLease(now)).isFalse();
        assertThat(TestJobs.leased(1, null, now.plusSeconds(10), 1).hasActiveLease(now)).isFalse();
        assertThat(TestJobs.leased(1, "worker-a", now.plusSeconds(10), 1).isLeasedBy("worker-b", now)).isFalse();
        assertThat(TestJobs.pending(2).hasActiveLease(now)).isFalse();
    }

    @Test
    void listLimitShouldBeClamped() {
        assertThat(JobStore.clampLimit(0)).isEqualTo(50);
        assertThat(JobStore.clampLimit(-5)).isEqualTo(50);
        assertThat(JobStore.clampLimit(10)).isEqualTo(10);
        assertThat(JobStore.clampLimit(500)).isEqualTo(200);
    }
}

package com.example.importscheduler.domain.entity;

import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ImportJob Entity Tests")
class ImportJobTest {

    @Test
    @DisplayName("Builder should default counters to zero")
    void builderShouldDefaultCounters() {
        var job = ImportJob.builder()
                .sourceId("src-1")
                .kind(ImportJobKind.DELTA)
                .status(ImportJobStatus.QUEUED)
                .createdBy("alice")
                .build();

        assertThat(job.getErrorCount()).isZero();
        assertThat(job.getProcessedItems()).isZero();
        assertThat(job.getTotalItems()).isZero();
    }

    @Test
    @DisplayName("Should report finished only for terminal statuses")
    void shouldReportFinished() {
        var job = ImportJob.builder().status(ImportJobStatus.RUNNING).build();
        assertThat(job.isFinished()).isFalse();

        job.setStatus(ImportJobStatus.FAILED);
        assertThat(job.isFinished()).isTrue();
    }

    @Test
    @DisplayName("Should detect a checkpoint left by a previous attempt")
    void shouldDetectCheckpoint() {
        var job = ImportJob.builder().build();
        assertThat(job.hasCheckpoint()).isFalse();

        job.setLastCheckpoint("  ");
        assertThat(job.hasCheckpoint()).isFalse();

        job.setLastCheckpoint("page=7");
        assertThat(job.hasCheckpoint()).isTrue();
    }
}

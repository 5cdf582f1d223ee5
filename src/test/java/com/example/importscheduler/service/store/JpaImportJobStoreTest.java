package com.example.importscheduler.service.store;

import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.domain.entity.ImportJobError;
import com.example.importscheduler.domain.entity.ImportJobLog;
import com.example.importscheduler.domain.enums.ImportJobKind;
import com.example.importscheduler.domain.enums.ImportJobLogLevel;
import com.example.importscheduler.domain.enums.ImportJobStatus;
import com.example.importscheduler.domain.repository.ImportJobErrorRepository;
import com.example.importscheduler.domain.repository.ImportJobLogRepository;
import com.example.importscheduler.domain.repository.ImportJobRepository;
import com.example.importscheduler.exception.ImportJobNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(JpaImportJobStore.class)
@DisplayName("JpaImportJobStore Tests")
class JpaImportJobStoreTest {

    @Autowired
    private JpaImportJobStore jobStore;

    @Autowired
    private ImportJobRepository jobRepository;

    @Autowired
    private ImportJobLogRepository logRepository;

    @Autowired
    private ImportJobErrorRepository errorRepository;

    private ImportJob saveJob(String sourceId, ImportJobStatus status, Instant createdAt) {
        return jobRepository.saveAndFlush(ImportJob.builder()
                .sourceId(sourceId)
                .kind(ImportJobKind.FULL)
                .status(status)
                .createdBy("test")
                .createdAt(createdAt)
                .build());
    }

    @Nested
    @DisplayName("Claim Tests")
    class ClaimTests {

        @Test
        @DisplayName("Should select the oldest queued job")
        void shouldSelectOldestQueued() {
            // Given
            var base = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            saveJob("newer", ImportJobStatus.QUEUED, base);
            var oldest = saveJob("oldest", ImportJobStatus.QUEUED, base.minusSeconds(60));
            saveJob("running", ImportJobStatus.RUNNING, base.minusSeconds(120));

            // When
            var candidate = jobStore.selectOldestQueued();

            // Then
            assertThat(candidate).isPresent();
            assertThat(candidate.get().getId()).isEqualTo(oldest.getId());
        }

        @Test
        @DisplayName("Should return empty when nothing is queued")
        void shouldReturnEmptyWhenNothingQueued() {
            saveJob("done", ImportJobStatus.SUCCESS, Instant.now());

            assertThat(jobStore.selectOldestQueued()).isEmpty();
        }

        @Test
        @DisplayName("Should claim a queued job exactly once")
        void shouldClaimExactlyOnce() {
            // Given
            var job = saveJob("src", ImportJobStatus.QUEUED, Instant.now());

            // When
            var first = jobStore.conditionalClaim(job.getId());
            var second = jobStore.conditionalClaim(job.getId());

            // Then
            assertThat(first).isPresent();
            assertThat(first.get().getStatus()).isEqualTo(ImportJobStatus.RUNNING);
            assertThat(first.get().getStartedAt()).isNotNull();
            assertThat(second).isEmpty();
        }

        @Test
        @DisplayName("Should not claim an unknown job")
        void shouldNotClaimUnknownJob() {
            assertThat(jobStore.conditionalClaim(UUID.randomUUID())).isEmpty();
        }
    }

    @Nested
    @DisplayName("Finalize Tests")
    class FinalizeTests {

        @Test
        @DisplayName("Should finalize a running job")
        void shouldFinalizeRunningJob() {
            // Given
            var job = saveJob("src", ImportJobStatus.QUEUED, Instant.now());
            jobStore.conditionalClaim(job.getId());
            var finishedAt = Instant.now();

            // When
            var finalized = jobStore.finalizeJob(job.getId(), ImportJobStatus.SUCCESS, finishedAt);

            // Then
            assertThat(finalized).isTrue();
            var reloaded = jobStore.getJob(job.getId()).orElseThrow();
            assertThat(reloaded.getStatus()).isEqualTo(ImportJobStatus.SUCCESS);
            assertThat(reloaded.getFinishedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should not finalize a job that is no longer running")
        void shouldNotFinalizeJobNotRunning() {
            // Given
            var job = saveJob("src", ImportJobStatus.FAILED, Instant.now());

            // When
            var finalized = jobStore.finalizeJob(job.getId(), ImportJobStatus.SUCCESS, Instant.now());

            // Then
            assertThat(finalized).isFalse();
            assertThat(jobStore.getJob(job.getId()).orElseThrow().getStatus()).isEqualTo(ImportJobStatus.FAILED);
        }

        @Test
        @DisplayName("Requeue should clear finishedAt and make the job claimable again")
        void requeueShouldClearFinishedAt() {
            // Given
            var job = jobRepository.saveAndFlush(ImportJob.builder()
                    .sourceId("src")
                    .kind(ImportJobKind.DELTA)
                    .status(ImportJobStatus.RUNNING)
                    .createdBy("test")
                    .startedAt(Instant.now())
                    .finishedAt(Instant.now())
                    .build());

            // When
            var requeued = jobStore.finalizeJob(job.getId(), ImportJobStatus.QUEUED, null);

            // Then
            assertThat(requeued).isTrue();
            var reloaded = jobStore.getJob(job.getId()).orElseThrow();
            assertThat(reloaded.getStatus()).isEqualTo(ImportJobStatus.QUEUED);
            assertThat(reloaded.getFinishedAt()).isNull();
            assertThat(jobStore.conditionalClaim(job.getId())).isPresent();
        }
    }

    @Nested
    @DisplayName("Error Tests")
    class ErrorTests {

        @Test
        @DisplayName("Should increment the error count and return the persisted value")
        void shouldIncrementErrorCount() {
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());

            assertThat(jobStore.incrementErrorCount(job.getId())).isEqualTo(1);
            assertThat(jobStore.incrementErrorCount(job.getId())).isEqualTo(2);
            assertThat(jobStore.getJob(job.getId()).orElseThrow().getErrorCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Should fail to increment the error count of an unknown job")
        void shouldFailForUnknownJob() {
            assertThatThrownBy(() -> jobStore.incrementErrorCount(UUID.randomUUID()))
                    .isInstanceOf(ImportJobNotFoundException.class);
        }

        @Test
        @DisplayName("Error record should carry the attempts made before it")
        void errorShouldCarryRetryCount() {
            // Given
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());
            jobStore.incrementErrorCount(job.getId());

            // When
            var error = jobStore.appendError(job.getId(), "process", "boom", "HTTP_500", "item-9");

            // Then
            assertThat(error.getId()).isNotNull();
            assertThat(error.getRetryCount()).isEqualTo(1);
            assertThat(error.getResolved()).isFalse();
            assertThat(error.getExternalId()).isEqualTo("item-9");
        }

        @Test
        @DisplayName("Should truncate very long error messages")
        void shouldTruncateLongMessages() {
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());

            var error = jobStore.appendError(job.getId(), "process", "x".repeat(5000), null, null);

            assertThat(error.getErrorMessage()).hasSize(4000).endsWith("...");
        }

        @Test
        @DisplayName("Should resolve an error record")
        void shouldResolveError() {
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());
            var error = jobStore.appendError(job.getId(), "process", "boom", null, null);

            var resolved = jobStore.resolveError(error.getId());

            assertThat(resolved).isPresent();
            assertThat(resolved.get().getResolved()).isTrue();
            assertThat(jobStore.resolveError(error.getId() + 1000)).isEmpty();
        }

        @Test
        @DisplayName("Errors with the same timestamp should come back in insertion order")
        void errorsWithSameTimestampShouldKeepInsertionOrder() {
            // Given
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());
            var createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            for (var message : new String[]{"first", "second", "third"}) {
                errorRepository.saveAndFlush(ImportJobError.builder()
                        .jobId(job.getId())
                        .stage("process")
                        .errorMessage(message)
                        .retryCount(0)
                        .resolved(false)
                        .createdAt(createdAt)
                        .build());
            }

            // When
            var errors = jobStore.getErrors(job.getId());

            // Then
            assertThat(errors).extracting(ImportJobError::getErrorMessage).containsExactly("first", "second", "third");
        }
    }

    @Nested
    @DisplayName("Log and Progress Tests")
    class LogAndProgressTests {

        @Test
        @DisplayName("Should append and page log entries")
        void shouldAppendAndPageLogs() {
            // Given
            var job = saveJob("src", ImportJobStatus.QUEUED, Instant.now());
            jobStore.appendLog(job.getId(), ImportJobLogLevel.INFO, "first");
            jobStore.appendLog(job.getId(), ImportJobLogLevel.WARN, "second", Map.of("attempt", 1));

            // When
            var all = jobStore.getLogs(job.getId());
            var page = jobStore.getLogs(job.getId(), PageRequest.of(0, 1));

            // Then
            assertThat(all).hasSize(2);
            assertThat(all).extracting("message").containsExactly("first", "second");
            assertThat(page.getTotalElements()).isEqualTo(2);
            assertThat(page.getContent()).hasSize(1);
        }

        @Test
        @DisplayName("Log entries with the same timestamp should come back in insertion order")
        void logsWithSameTimestampShouldKeepInsertionOrder() {
            // Given
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());
            var createdAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
            for (var message : new String[]{"Starting job", "Fetched 10 items", "Job completed"}) {
                logRepository.saveAndFlush(ImportJobLog.builder()
                        .jobId(job.getId())
                        .level(ImportJobLogLevel.INFO)
                        .message(message)
                        .createdAt(createdAt)
                        .build());
            }

            // When
            var all = jobStore.getLogs(job.getId());
            var secondPage = jobStore.getLogs(job.getId(), PageRequest.of(1, 2));

            // Then
            assertThat(all).extracting(ImportJobLog::getMessage)
                    .containsExactly("Starting job", "Fetched 10 items", "Job completed");
            assertThat(secondPage.getContent()).extracting(ImportJobLog::getMessage).containsExactly("Job completed");
        }

        @Test
        @DisplayName("Should update progress and checkpoint")
        void shouldUpdateProgressAndCheckpoint() {
            var job = saveJob("src", ImportJobStatus.RUNNING, Instant.now());

            assertThat(jobStore.updateProgress(job.getId(), 40, 100)).isTrue();
            assertThat(jobStore.updateCheckpoint(job.getId(), "cursor-40")).isTrue();

            var reloaded = jobStore.getJob(job.getId()).orElseThrow();
            assertThat(reloaded.getProcessedItems()).isEqualTo(40);
            assertThat(reloaded.getTotalItems()).isEqualTo(100);
            assertThat(reloaded.getLastCheckpoint()).isEqualTo("cursor-40");
        }

        @Test
        @DisplayName("Should report unknown job on progress update")
        void shouldReportUnknownJobOnProgress() {
            assertThat(jobStore.updateProgress(UUID.randomUUID(), 1, 1)).isFalse();
            assertThat(jobStore.updateCheckpoint(UUID.randomUUID(), "x")).isFalse();
        }
    }

    @Nested
    @DisplayName("Query Tests")
    class QueryTests {

        @Test
        @DisplayName("Should insert queued jobs and list them by source")
        void shouldInsertAndListBySource() {
            var inserted = jobStore.insertJob("shop-1", ImportJobKind.DELTA, "alice");
            jobStore.insertJob("shop-2", ImportJobKind.FULL, "bob");

            assertThat(inserted.getStatus()).isEqualTo(ImportJobStatus.QUEUED);
            assertThat(inserted.getErrorCount()).isZero();
            assertThat(jobStore.getJobsForSource("shop-1")).extracting(ImportJob::getId).containsExactly(inserted.getId());
            assertThat(jobStore.countByStatus(ImportJobStatus.QUEUED)).isEqualTo(2);
        }

        @Test
        @DisplayName("Should find running jobs claimed before the threshold")
        void shouldFindStaleRunningJobs() {
            var stale = jobRepository.saveAndFlush(ImportJob.builder()
                    .sourceId("src").kind(ImportJobKind.FULL).status(ImportJobStatus.RUNNING).createdBy("test")
                    .startedAt(Instant.now().minus(2, ChronoUnit.HOURS))
                    .build());
            jobRepository.saveAndFlush(ImportJob.builder()
                    .sourceId("src").kind(ImportJobKind.FULL).status(ImportJobStatus.RUNNING).createdBy("test")
                    .startedAt(Instant.now())
                    .build());

            var found = jobStore.findStaleRunningJobs(Instant.now().minus(1, ChronoUnit.HOURS));

            assertThat(found).extracting(ImportJob::getId).containsExactly(stale.getId());
        }
    }
}

package com.example.importscheduler.service.executor;

import com.example.importscheduler.config.MetricsConfig;
import com.example.importscheduler.domain.entity.ImportJob;
import com.example.importscheduler.service.store.ImportJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Claims the oldest queued job for this process.
 * <p>
 * The candidate read and the claim are separate statements. Another instance
 * may claim the candidate in between; the conditional update then matches no
 * row and this tick simply has nothing to run. Store failures propagate to the
 * caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobClaimService {

    private final ImportJobStore jobStore;
    private final MetricsConfig metricsConfig;

    public Optional<ImportJob> claimNext() {
        var candidate = jobStore.selectOldestQueued();

        if (candidate.isEmpty()) {
            log.debug("No queued import jobs");
            return Optional.empty();
        }

        var jobId = candidate.get().getId();
        var claimed = jobStore.conditionalClaim(jobId);

        if (claimed.isEmpty()) {
            log.debug("Job {} was claimed by another scheduler, skipping", jobId);
            metricsConfig.recordClaimMiss();
            return Optional.empty();
        }

        log.debug("Claimed job {}", jobId);
        metricsConfig.recordClaim();
        return claimed;
    }
}

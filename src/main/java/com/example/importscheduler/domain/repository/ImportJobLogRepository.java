package com.example.importscheduler.domain.repository;

import com.example.importscheduler.domain.entity.ImportJobLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for ImportJobLog entity
 */
@Repository
public interface ImportJobLogRepository extends JpaRepository<ImportJobLog, Long> {

    /**
     * All log entries of a job in chronological order, insertion order on equal timestamps
     */
    List<ImportJobLog> findByJobIdOrderByCreatedAtAscIdAsc(UUID jobId);

    /**
     * One page of a job's log entries in chronological order
     */
    Page<ImportJobLog> findByJobIdOrderByCreatedAtAscIdAsc(UUID jobId, Pageable pageable);
}

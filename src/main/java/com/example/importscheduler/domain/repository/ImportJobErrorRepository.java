package com.example.importscheduler.domain.repository;

import com.example.importscheduler.domain.entity.ImportJobError;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for ImportJobError entity
 */
@Repository
public interface ImportJobErrorRepository extends JpaRepository<ImportJobError, Long> {

    /**
     * All error records of a job in chronological order, insertion order on equal timestamps
     */
    List<ImportJobError> findByJobIdOrderByCreatedAtAscIdAsc(UUID jobId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ImportJobError e SET e.resolved = true WHERE e.id = :errorId")
    int markResolved(@Param("errorId") Long errorId);
}

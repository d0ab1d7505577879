package com.eyelevel.lotprocessor.repository;

import com.eyelevel.lotprocessor.model.BatchJob;
import com.eyelevel.lotprocessor.model.JobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link BatchJob} entity.
 */
@Repository
public interface BatchJobRepository extends JpaRepository<BatchJob, UUID> {

    /**
     * Loads a job together with its lots in one query.
     */
    @EntityGraph(attributePaths = "lots")
    Optional<BatchJob> findWithLotsById(UUID id);

    /**
     * Finds the ids of every job the reconciliation pass must look at: jobs with a remote batch in flight,
     * and failed jobs that still hold a batch reference and may recover.
     *
     * @param activeStatuses Statuses that always have a batch in flight ({@code PROCESSING}, {@code TRANSLATING}).
     * @param failedStatus   The {@code FAILED} status.
     * @return Job ids, oldest first.
     */
    @Query("SELECT j.id FROM BatchJob j " +
           "WHERE j.status IN :activeStatuses " +
           "   OR (j.status = :failedStatus AND (j.visionBatchRef IS NOT NULL OR j.translationBatchRef IS NOT NULL)) " +
           "ORDER BY j.createdAt ASC")
    List<UUID> findIdsForReconciliation(@Param("activeStatuses") Collection<JobStatus> activeStatuses,
                                        @Param("failedStatus") JobStatus failedStatus);

    Page<BatchJob> findByStatus(JobStatus status, Pageable pageable);

    /**
     * Finds terminal jobs whose last change is older than the retention threshold.
     */
    @Query("SELECT j.id FROM BatchJob j WHERE j.status IN :statuses AND j.updatedAt < :threshold")
    List<UUID> findIdsByStatusInAndUpdatedAtBefore(@Param("statuses") Collection<JobStatus> statuses,
                                                   @Param("threshold") Instant threshold,
                                                   Pageable pageable);

    @Modifying
    @Query("DELETE FROM BatchJob j WHERE j.id IN :jobIds")
    int deleteByIds(@Param("jobIds") Collection<UUID> jobIds);
}

package com.eyelevel.lotprocessor.repository;

import com.eyelevel.lotprocessor.dto.monitoring.DeliveryTiming;
import com.eyelevel.lotprocessor.dto.monitoring.EndpointStats;
import com.eyelevel.lotprocessor.model.DeliveryStatus;
import com.eyelevel.lotprocessor.model.WebhookDelivery;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link WebhookDelivery} entity.
 */
@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, Long> {

    boolean existsByJobId(UUID jobId);

    List<WebhookDelivery> findByJobIdOrderByIdAsc(UUID jobId);

    /**
     * Finds deliveries that are due for an attempt: retryable status, attempts left, and a scheduled time
     * that has passed. The earliest-scheduled deliveries come first.
     */
    @Query("SELECT d.id FROM WebhookDelivery d " +
           "WHERE d.status IN :statuses AND d.attemptCount < :maxAttempts AND d.nextAttemptAt <= :now " +
           "ORDER BY d.nextAttemptAt ASC")
    List<Long> findDueDeliveryIds(@Param("statuses") Collection<DeliveryStatus> statuses,
                                  @Param("maxAttempts") int maxAttempts,
                                  @Param("now") Instant now,
                                  Pageable pageable);

    @Modifying
    @Query("DELETE FROM WebhookDelivery d WHERE d.jobId IN :jobIds")
    int deleteByJobIds(@Param("jobIds") Collection<UUID> jobIds);

    // --- Monitoring queries ---

    long countByCreatedAtGreaterThanEqual(Instant since);

    long countByStatusAndCreatedAtGreaterThanEqual(DeliveryStatus status, Instant since);

    long countByStatusAndAttemptCountGreaterThanEqualAndCreatedAtGreaterThanEqual(DeliveryStatus status,
                                                                                  int attemptCount,
                                                                                  Instant since);

    long countByStatusAndCreatedAtBefore(DeliveryStatus status, Instant before);

    long countByStatusInAndAttemptCountLessThan(Collection<DeliveryStatus> statuses, int attemptCount);

    @Query("SELECT AVG(d.attemptCount) FROM WebhookDelivery d WHERE d.status = :status AND d.createdAt >= :since")
    Double averageAttemptCountSince(@Param("status") DeliveryStatus status, @Param("since") Instant since);

    @Query("SELECT new com.eyelevel.lotprocessor.dto.monitoring.DeliveryTiming(d.createdAt, d.deliveredAt) " +
           "FROM WebhookDelivery d " +
           "WHERE d.status = :status AND d.deliveredAt IS NOT NULL AND d.createdAt >= :since")
    List<DeliveryTiming> findDeliveryTimingsSince(@Param("status") DeliveryStatus status,
                                                  @Param("since") Instant since);

    List<WebhookDelivery> findByStatusAndAttemptCountGreaterThanEqualOrderByLastAttemptAtDesc(DeliveryStatus status,
                                                                                           int attemptCount,
                                                                                           Pageable pageable);

    /**
     * Aggregates delivery outcomes per target URL. "Failed" counts only deliveries that exhausted
     * their attempts.
     */
    @Query("SELECT new com.eyelevel.lotprocessor.dto.monitoring.EndpointStats(" +
           "  d.webhookUrl, COUNT(d), " +
           "  SUM(CASE WHEN d.status = :delivered THEN 1 ELSE 0 END), " +
           "  SUM(CASE WHEN d.status = :failed AND d.attemptCount >= :maxAttempts THEN 1 ELSE 0 END)) " +
           "FROM WebhookDelivery d GROUP BY d.webhookUrl")
    List<EndpointStats> aggregateByEndpoint(@Param("delivered") DeliveryStatus delivered,
                                            @Param("failed") DeliveryStatus failed,
                                            @Param("maxAttempts") int maxAttempts);
}

package com.eyelevel.lotprocessor.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One delivery lineage of a completed job's results to one webhook URL, with its retry bookkeeping.
 * The job is referenced by id only; retention removes deliveries before removing their job.
 */
@Entity
@Table(name = "webhook_delivery")
@Data
public class WebhookDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private UUID jobId;

    @Column(nullable = false, length = 2048)
    private String webhookUrl;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(nullable = false, length = 64)
    private String signature;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryStatus status = DeliveryStatus.PENDING;

    private int attemptCount;

    private Instant lastAttemptAt;

    private Instant nextAttemptAt;

    private Integer responseStatus;

    @Column(columnDefinition = "TEXT")
    private String responseBody;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    private Instant deliveredAt;

    @Version
    private long version;
}

package com.eyelevel.lotprocessor.model;

import com.eyelevel.lotprocessor.model.converter.StringListConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Represents one client batch request: a set of lots that go through vision inference and,
 * when non-English languages are requested, translation inference.
 */
@Entity
@Table(name = "batch_job")
@Data
public class BatchJob {

    public static final String SOURCE_LANGUAGE = "en";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status = JobStatus.PENDING;

    /**
     * Requested language codes in request order. English is the source language and is never translated.
     */
    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> languages = new ArrayList<>();

    @Column(length = 2048)
    private String webhookUrl;

    private int totalLots;

    private int processedLots;

    private int failedLots;

    @Column(length = 128)
    private String visionBatchRef;

    @Column(length = 128)
    private String translationBatchRef;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private int retryCount;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    private Instant completedAt;

    @Version
    private long version;

    @OneToMany(mappedBy = "job", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<BatchLot> lots = new ArrayList<>();

    public void addLot(BatchLot lot) {
        lot.setJob(this);
        lot.setPosition(lots.size());
        lots.add(lot);
    }

    /**
     * @return The requested languages other than English, de-duplicated, in request order.
     */
    @Transient
    public List<String> getTargetLanguages() {
        List<String> targets = new ArrayList<>();
        for (String language : languages) {
            String normalized = language.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty() && !SOURCE_LANGUAGE.equals(normalized) && !targets.contains(normalized)) {
                targets.add(normalized);
            }
        }
        return targets;
    }

    @Transient
    public boolean requiresTranslation() {
        return !getTargetLanguages().isEmpty();
    }

    /**
     * Recomputes {@code processedLots} and {@code failedLots} from the lot records.
     */
    public void refreshCounters() {
        this.processedLots = (int) lots.stream().filter(lot -> lot.getVisionResult() != null).count();
        this.failedLots = (int) lots.stream().filter(lot -> lot.getStatus() == LotStatus.FAILED).count();
    }
}

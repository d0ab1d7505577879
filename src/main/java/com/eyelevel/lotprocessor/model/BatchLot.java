package com.eyelevel.lotprocessor.model;

import com.eyelevel.lotprocessor.model.converter.StringListConverter;
import com.eyelevel.lotprocessor.model.converter.StringMapConverter;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One vehicle lot inside a {@link BatchJob}: its images, its English description and its translations.
 */
@Entity
@Table(name = "batch_lot",
       uniqueConstraints = @UniqueConstraint(name = "uk_batch_lot_job_lot", columnNames = {"job_id", "lot_id"}))
@Data
public class BatchLot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "job_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private BatchJob job;

    @Column(name = "lot_id", nullable = false)
    private String lotId;

    /**
     * Zero-based index of the lot in the original request; keeps results in request order.
     */
    @Column(nullable = false)
    private int position;

    @Column(columnDefinition = "TEXT")
    private String additionalInfo;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> imageUrls = new ArrayList<>();

    /**
     * Per-lot override of the job's webhook URL.
     */
    @Column(length = 2048)
    private String webhookUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LotStatus status = LotStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String visionResult;

    @Convert(converter = StringMapConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private Map<String, String> translations = new LinkedHashMap<>();

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT", nullable = false)
    private List<String> missingImages = new ArrayList<>();

    public void fail(String reason) {
        this.status = LotStatus.FAILED;
        this.errorMessage = reason;
    }

    /**
     * Appends a note to the error message without losing earlier notes.
     */
    public void appendNote(String note) {
        this.errorMessage = (errorMessage == null || errorMessage.isBlank()) ? note : errorMessage + "; " + note;
    }
}

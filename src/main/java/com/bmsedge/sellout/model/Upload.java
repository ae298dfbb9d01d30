package com.bmsedge.sellout.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Setter
@Getter
@Entity
@Table(name = "uploads",
        indexes = {
                @Index(name = "idx_uploads_status", columnList = "status")
        })
public class Upload {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Size(max = 255)
    @Column(name = "filename")
    private String filename;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20, nullable = false)
    private UploadStatus status = UploadStatus.PENDING;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "source_id", length = 50)
    private String sourceId;

    @Column(name = "low_confidence")
    private Boolean lowConfidence = false;

    @Column(name = "rows_processed")
    private Integer rowsProcessed = 0;

    @Column(name = "rows_cleaned")
    private Integer rowsCleaned = 0;

    @Column(name = "rows_skipped")
    private Integer rowsSkipped = 0;

    @Column(name = "transformations_applied")
    private Integer transformationsApplied = 0;

    @Column(name = "anomalies")
    private Integer anomalies = 0;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Upload() {}

    public Upload(String id, String filename) {
        this.id = id;
        this.filename = filename;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}

package com.bmsedge.sellout.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Getter
@Entity
@Immutable
@Table(name = "transform_logs",
        indexes = {
                @Index(name = "idx_transform_upload_seq", columnList = "upload_id, seq_no")
        })
public class TransformLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank
    @Column(name = "upload_id", nullable = false, length = 64)
    private String uploadId;

    // Position within the upload's log, in row-processing order
    @Column(name = "seq_no", nullable = false)
    private Integer seqNo;

    @Column(name = "row_index")
    private Integer rowIndex;

    @Column(name = "column_name", length = 255)
    private String columnName;

    @Column(name = "original_value", length = 1000)
    private String originalValue;

    @Column(name = "cleaned_value", length = 1000)
    private String cleanedValue;

    @Column(name = "transformation_type", length = 50)
    private String transformationType;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected TransformLog() {}

    public TransformLog(String uploadId, int seqNo, int rowIndex, String columnName,
                        String originalValue, String cleanedValue, String transformationType) {
        this.uploadId = uploadId;
        this.seqNo = seqNo;
        this.rowIndex = rowIndex;
        this.columnName = columnName;
        this.originalValue = truncate(originalValue);
        this.cleanedValue = truncate(cleanedValue);
        this.transformationType = transformationType;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }

    private static String truncate(String value) {
        return value != null && value.length() > 1000 ? value.substring(0, 1000) : value;
    }
}

package com.chambua.pricing.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "upload_failure")
public class UploadFailure {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "upload_job_id", nullable = false, foreignKey = @ForeignKey(name = "fk_upload_failure_upload"))
    private UploadJob uploadJob;

    @Column(name = "row_index", nullable = false)
    private int rowIndex;

    @Column(name = "external_id", length = 128)
    private String externalId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private FailureKind kind;

    @Column(length = 1000)
    private String reason;

    @Column(name = "created_at")
    private Instant createdAt;

    protected UploadFailure() {}

    public UploadFailure(UploadJob uploadJob, int rowIndex, String externalId, FailureKind kind, String reason) {
        this.uploadJob = uploadJob;
        this.rowIndex = rowIndex;
        this.externalId = externalId != null && externalId.length() > 128 ? externalId.substring(0, 128) : externalId;
        this.kind = kind;
        this.reason = reason != null && reason.length() > 1000 ? reason.substring(0, 1000) : reason;
        this.createdAt = Instant.now();
    }

    public Long getId() { return id; }
    public UploadJob getUploadJob() { return uploadJob; }
    public int getRowIndex() { return rowIndex; }
    public String getExternalId() { return externalId; }
    public FailureKind getKind() { return kind; }
    public String getReason() { return reason; }
    public Instant getCreatedAt() { return createdAt; }
}

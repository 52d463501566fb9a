package com.chambua.pricing.model;

import jakarta.persistence.*;
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@DynamicUpdate
@Table(name = "upload_job", indexes = {
        @Index(name = "idx_upload_job_created_at", columnList = "created_at")
})
public class UploadJob {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 255)
    private String filename;

    @Column(name = "source_date")
    private LocalDate sourceDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private UploadStatus status = UploadStatus.PENDING;

    @Column(name = "created_by", length = 100)
    private String createdBy; // opaque actor id supplied by the caller

    @Column(name = "total_rows", nullable = false)
    private int totalRows;

    @Column(name = "processed_rows", nullable = false)
    private int processedRows;

    @Column(name = "failed_rows", nullable = false)
    private int failedRows;

    @Column(name = "new_count", nullable = false)
    private int newCount;

    @Column(name = "increased_count", nullable = false)
    private int increasedCount;

    @Column(name = "decreased_count", nullable = false)
    private int decreasedCount;

    @Column(name = "removed_count", nullable = false)
    private int removedCount;

    @Column(name = "unchanged_count", nullable = false)
    private int unchangedCount;

    @Column(name = "progress_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal progressPercent = BigDecimal.ZERO;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    static final int MAX_FILENAME = 255;
    static final int MAX_CREATED_BY = 100;

    public UploadJob() {}

    public UploadJob(String filename, LocalDate sourceDate, String createdBy, int totalRows) {
        this.filename = clip(filename, MAX_FILENAME);
        this.sourceDate = sourceDate;
        this.createdBy = clip(createdBy, MAX_CREATED_BY);
        this.totalRows = totalRows;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    /**
     * Moves the job to {@code next}. Terminal states are absorbing.
     *
     * @throws IllegalStateException when the transition is not part of the upload lifecycle
     */
    public void transitionTo(UploadStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Upload " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
        if (next == UploadStatus.IN_PROGRESS) {
            startedAt = Instant.now();
        } else if (next.isTerminal()) {
            finishedAt = Instant.now();
        }
    }

    private static String clip(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }

    public int classifiedTotal() {
        return newCount + increasedCount + decreasedCount + removedCount + unchangedCount;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getFilename() { return filename; }
    public void setFilename(String filename) { this.filename = clip(filename, MAX_FILENAME); }
    public LocalDate getSourceDate() { return sourceDate; }
    public void setSourceDate(LocalDate sourceDate) { this.sourceDate = sourceDate; }
    public UploadStatus getStatus() { return status; }
    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = clip(createdBy, MAX_CREATED_BY); }
    public int getTotalRows() { return totalRows; }
    public void setTotalRows(int totalRows) { this.totalRows = totalRows; }
    public int getProcessedRows() { return processedRows; }
    public void setProcessedRows(int processedRows) { this.processedRows = processedRows; }
    public int getFailedRows() { return failedRows; }
    public void setFailedRows(int failedRows) { this.failedRows = failedRows; }
    public int getNewCount() { return newCount; }
    public void setNewCount(int newCount) { this.newCount = newCount; }
    public int getIncreasedCount() { return increasedCount; }
    public void setIncreasedCount(int increasedCount) { this.increasedCount = increasedCount; }
    public int getDecreasedCount() { return decreasedCount; }
    public void setDecreasedCount(int decreasedCount) { this.decreasedCount = decreasedCount; }
    public int getRemovedCount() { return removedCount; }
    public void setRemovedCount(int removedCount) { this.removedCount = removedCount; }
    public int getUnchangedCount() { return unchangedCount; }
    public void setUnchangedCount(int unchangedCount) { this.unchangedCount = unchangedCount; }
    public BigDecimal getProgressPercent() { return progressPercent; }
    public void setProgressPercent(BigDecimal progressPercent) { this.progressPercent = progressPercent; }
    public boolean isCancelRequested() { return cancelRequested; }
    public void setCancelRequested(boolean cancelRequested) { this.cancelRequested = cancelRequested; }
    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}

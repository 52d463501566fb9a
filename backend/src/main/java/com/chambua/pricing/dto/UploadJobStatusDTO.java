package com.chambua.pricing.dto;

import com.chambua.pricing.model.UploadJob;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public class UploadJobStatusDTO {
    private Long id;
    private String filename;
    private LocalDate sourceDate;
    private String status;
    private String createdBy;
    private int totalRows;
    private int processedRows;
    private int failedRows;
    private int newCount;
    private int increasedCount;
    private int decreasedCount;
    private int removedCount;
    private int unchangedCount;
    private BigDecimal progressPercent;
    private boolean cancelRequested;
    private String errorMessage;
    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;

    public UploadJobStatusDTO() {}

    public static UploadJobStatusDTO from(UploadJob job) {
        UploadJobStatusDTO dto = new UploadJobStatusDTO();
        dto.id = job.getId();
        dto.filename = job.getFilename();
        dto.sourceDate = job.getSourceDate();
        dto.status = job.getStatus().name();
        dto.createdBy = job.getCreatedBy();
        dto.totalRows = job.getTotalRows();
        dto.processedRows = job.getProcessedRows();
        dto.failedRows = job.getFailedRows();
        dto.newCount = job.getNewCount();
        dto.increasedCount = job.getIncreasedCount();
        dto.decreasedCount = job.getDecreasedCount();
        dto.removedCount = job.getRemovedCount();
        dto.unchangedCount = job.getUnchangedCount();
        dto.progressPercent = job.getProgressPercent();
        dto.cancelRequested = job.isCancelRequested();
        dto.errorMessage = job.getErrorMessage();
        dto.createdAt = job.getCreatedAt();
        dto.startedAt = job.getStartedAt();
        dto.finishedAt = job.getFinishedAt();
        return dto;
    }

    public Long getId() { return id; }
    public String getFilename() { return filename; }
    public LocalDate getSourceDate() { return sourceDate; }
    public String getStatus() { return status; }
    public String getCreatedBy() { return createdBy; }
    public int getTotalRows() { return totalRows; }
    public int getProcessedRows() { return processedRows; }
    public int getFailedRows() { return failedRows; }
    public int getNewCount() { return newCount; }
    public int getIncreasedCount() { return increasedCount; }
    public int getDecreasedCount() { return decreasedCount; }
    public int getRemovedCount() { return removedCount; }
    public int getUnchangedCount() { return unchangedCount; }
    public BigDecimal getProgressPercent() { return progressPercent; }
    public boolean isCancelRequested() { return cancelRequested; }
    public String getErrorMessage() { return errorMessage; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}

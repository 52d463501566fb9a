package com.chambua.pricing.dto;

import com.chambua.pricing.model.UploadStatus;

import java.util.List;

/**
 * What an upload committed. Every batch row is either counted in one classification, listed in
 * {@code failures}, or (for a cancelled upload) among the {@code notProcessed} tail.
 */
public record UploadJobResult(Long jobId,
                              UploadStatus status,
                              int totalRows,
                              int processedRows,
                              int newCount,
                              int increasedCount,
                              int decreasedCount,
                              int unchangedCount,
                              int removedCount,
                              int notProcessed,
                              List<RowFailureDTO> failures,
                              String errorMessage) {
}

package com.chambua.pricing.batch;

import com.chambua.pricing.model.ChangeType;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Counters of one running upload. Owned by the job that executes the upload and mutated only from
 * its thread; a row works on a {@link #copy()} that replaces the live counters once the row commits.
 */
public class UploadProgress {

    private final int totalRows;
    private int processedRows;
    private int failedRows;
    private int newCount;
    private int increasedCount;
    private int decreasedCount;
    private int removedCount;
    private int unchangedCount;

    public UploadProgress(int totalRows) {
        if (totalRows < 0) throw new IllegalArgumentException("totalRows must be >= 0");
        this.totalRows = totalRows;
    }

    public UploadProgress copy() {
        UploadProgress c = new UploadProgress(totalRows);
        c.processedRows = processedRows;
        c.failedRows = failedRows;
        c.newCount = newCount;
        c.increasedCount = increasedCount;
        c.decreasedCount = decreasedCount;
        c.removedCount = removedCount;
        c.unchangedCount = unchangedCount;
        return c;
    }

    /** Counts one committed batch row. */
    public void recordRow(ChangeType type) {
        if (type == ChangeType.REMOVED) {
            throw new IllegalArgumentException("REMOVED is not produced by a batch row");
        }
        if (processedRows + failedRows >= totalRows) {
            throw new IllegalStateException("All " + totalRows + " rows already accounted for");
        }
        processedRows++;
        bump(type);
    }

    /** Counts a product dropped by the removal sweep; it is not a batch row. */
    public void recordRemoval() {
        removedCount++;
    }

    public void recordFailure() {
        if (processedRows + failedRows >= totalRows) {
            throw new IllegalStateException("All " + totalRows + " rows already accounted for");
        }
        failedRows++;
    }

    private void bump(ChangeType type) {
        switch (type) {
            case NEW: newCount++; break;
            case INCREASED: increasedCount++; break;
            case DECREASED: decreasedCount++; break;
            case UNCHANGED: unchangedCount++; break;
            default: throw new IllegalArgumentException("Unexpected change type " + type);
        }
    }

    /** Share of batch rows handled so far (committed or failed), 0..100 with two decimals. */
    public BigDecimal progressPercent() {
        if (totalRows == 0) return new BigDecimal("100.00");
        int handled = Math.min(totalRows, processedRows + failedRows);
        return BigDecimal.valueOf(handled)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(totalRows), 2, RoundingMode.DOWN);
    }

    public int getTotalRows() { return totalRows; }
    public int getProcessedRows() { return processedRows; }
    public int getFailedRows() { return failedRows; }
    public int getNewCount() { return newCount; }
    public int getIncreasedCount() { return increasedCount; }
    public int getDecreasedCount() { return decreasedCount; }
    public int getRemovedCount() { return removedCount; }
    public int getUnchangedCount() { return unchangedCount; }

    @Override
    public String toString() {
        return "processed=" + processedRows + "/" + totalRows + " failed=" + failedRows
                + " new=" + newCount + " up=" + increasedCount + " down=" + decreasedCount
                + " unchanged=" + unchangedCount + " removed=" + removedCount;
    }
}

package com.chambua.pricing.repository;

import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.model.UploadStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

public interface UploadJobRepository extends JpaRepository<UploadJob, Long> {

    Page<UploadJob> findAllByOrderByCreatedAtDesc(Pageable pageable);

    List<UploadJob> findByStatusIn(Collection<UploadStatus> statuses);

    @Query("select j.cancelRequested from UploadJob j where j.id = :id")
    Boolean findCancelRequested(@Param("id") Long id);

    /**
     * Writes the running job's counters. Only an in-progress job is touched and processed_rows never
     * moves backwards; the cancellation flag is left alone.
     */
    @Modifying(flushAutomatically = true)
    @Query("update UploadJob j set j.processedRows = :processed, j.failedRows = :failed, "
            + "j.newCount = :newCount, j.increasedCount = :increased, j.decreasedCount = :decreased, "
            + "j.removedCount = :removed, j.unchangedCount = :unchanged, j.progressPercent = :percent "
            + "where j.id = :id and j.status = com.chambua.pricing.model.UploadStatus.IN_PROGRESS "
            + "and j.processedRows <= :processed")
    int saveProgress(@Param("id") Long id,
                     @Param("processed") int processed,
                     @Param("failed") int failed,
                     @Param("newCount") int newCount,
                     @Param("increased") int increased,
                     @Param("decreased") int decreased,
                     @Param("removed") int removed,
                     @Param("unchanged") int unchanged,
                     @Param("percent") BigDecimal percent);

    @Modifying(clearAutomatically = true)
    @Query("update UploadJob j set j.cancelRequested = true where j.id = :id "
            + "and j.status in (com.chambua.pricing.model.UploadStatus.PENDING, com.chambua.pricing.model.UploadStatus.IN_PROGRESS)")
    int requestCancel(@Param("id") Long id);
}

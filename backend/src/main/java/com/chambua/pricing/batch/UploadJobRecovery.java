package com.chambua.pricing.batch;

import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.model.UploadStatus;
import com.chambua.pricing.repository.UploadJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.List;

/**
 * Uploads still pending or in progress at startup were cut off by a shutdown or crash. Their
 * committed rows stay; the job itself is closed as failed so it can be inspected or re-run.
 */
@Component
public class UploadJobRecovery {
    private static final Logger log = LoggerFactory.getLogger(UploadJobRecovery.class);

    private final UploadJobRepository uploadJobRepository;

    public UploadJobRecovery(UploadJobRepository uploadJobRepository) {
        this.uploadJobRepository = uploadJobRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void failInterruptedJobs() {
        List<UploadJob> orphans = uploadJobRepository.findByStatusIn(EnumSet.of(UploadStatus.PENDING, UploadStatus.IN_PROGRESS));
        for (UploadJob job : orphans) {
            job.transitionTo(UploadStatus.FAILED);
            job.setErrorMessage("Interrupted by restart (" + job.getProcessedRows() + "/" + job.getTotalRows() + " rows committed)");
            log.warn("[PriceUpload][Recovery] jobId={} closed as FAILED after restart, processed={}/{}",
                    job.getId(), job.getProcessedRows(), job.getTotalRows());
        }
        uploadJobRepository.saveAll(orphans);
    }
}

package com.chambua.pricing.service;

import com.chambua.pricing.batch.UploadCancellationRegistry;
import com.chambua.pricing.batch.UploadProgress;
import com.chambua.pricing.dto.RowFailureDTO;
import com.chambua.pricing.dto.UploadJobStatusDTO;
import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.model.UploadStatus;
import com.chambua.pricing.repository.UploadFailureRepository;
import com.chambua.pricing.repository.UploadJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Lifecycle of {@link UploadJob} rows outside the per-row units of work: creation, start, cancellation
 * requests and the final status.
 */
@Service
public class UploadJobService {
    private static final Logger log = LoggerFactory.getLogger(UploadJobService.class);

    private static final int MAX_ERROR_MESSAGE = 1000;

    private final UploadJobRepository uploadJobRepository;
    private final UploadFailureRepository uploadFailureRepository;
    private final UploadCancellationRegistry cancellationRegistry;

    public UploadJobService(UploadJobRepository uploadJobRepository,
                            UploadFailureRepository uploadFailureRepository,
                            UploadCancellationRegistry cancellationRegistry) {
        this.uploadJobRepository = uploadJobRepository;
        this.uploadFailureRepository = uploadFailureRepository;
        this.cancellationRegistry = cancellationRegistry;
    }

    @Transactional
    public UploadJob createJob(String filename, LocalDate sourceDate, String createdBy, int totalRows) {
        UploadJob job = uploadJobRepository.save(new UploadJob(filename, sourceDate, createdBy, totalRows));
        cancellationRegistry.register(job.getId());
        log.info("[PriceUpload][Created] jobId={} file={} rows={} by={}", job.getId(), filename, totalRows, createdBy);
        return job;
    }

    /**
     * Moves a pending job to in progress, or straight to cancelled when a cancellation arrived while it
     * was queued.
     */
    @Transactional
    public UploadJob start(Long jobId) {
        UploadJob job = uploadJobRepository.findById(jobId)
                .orElseThrow(() -> new NoSuchElementException("Upload " + jobId + " not found"));
        if (job.isCancelRequested()) {
            job.transitionTo(UploadStatus.CANCELLED);
        } else {
            job.transitionTo(UploadStatus.IN_PROGRESS);
        }
        return uploadJobRepository.save(job);
    }

    /**
     * Writes the final counters and terminal status. A job that is already terminal is left as it is.
     */
    @Transactional
    public void finish(Long jobId, UploadStatus status, UploadProgress progress, String errorMessage) {
        UploadJob job = uploadJobRepository.findById(jobId)
                .orElseThrow(() -> new NoSuchElementException("Upload " + jobId + " not found"));
        if (job.getStatus().isTerminal()) {
            log.warn("[PriceUpload][Finish] jobId={} already {}; {} ignored", jobId, job.getStatus(), status);
            return;
        }
        if (job.getStatus() == UploadStatus.IN_PROGRESS) {
            job.setProcessedRows(progress.getProcessedRows());
            job.setFailedRows(progress.getFailedRows());
            job.setNewCount(progress.getNewCount());
            job.setIncreasedCount(progress.getIncreasedCount());
            job.setDecreasedCount(progress.getDecreasedCount());
            job.setRemovedCount(progress.getRemovedCount());
            job.setUnchangedCount(progress.getUnchangedCount());
            job.setProgressPercent(progress.progressPercent());
        }
        if (errorMessage != null) {
            job.setErrorMessage(errorMessage.length() > MAX_ERROR_MESSAGE ? errorMessage.substring(0, MAX_ERROR_MESSAGE) : errorMessage);
        }
        job.transitionTo(status);
        uploadJobRepository.save(job);
    }

    /**
     * Records a cancellation request. The running job notices it before its next row.
     *
     * @throws NoSuchElementException when the job does not exist
     * @throws IllegalStateException  when the job already finished
     */
    @Transactional
    public UploadJobStatusDTO cancel(Long jobId) {
        UploadJob job = uploadJobRepository.findById(jobId)
                .orElseThrow(() -> new NoSuchElementException("Upload " + jobId + " not found"));
        if (job.getStatus().isTerminal()) {
            throw new IllegalStateException("Upload " + jobId + " already " + job.getStatus());
        }
        int updated = uploadJobRepository.requestCancel(jobId);
        if (updated == 0) {
            throw new IllegalStateException("Upload " + jobId + " finished before it could be cancelled");
        }
        cancellationRegistry.requestCancel(jobId);
        return uploadJobRepository.findById(jobId).map(UploadJobStatusDTO::from).orElseThrow();
    }

    @Transactional(readOnly = true)
    public Optional<UploadJobStatusDTO> get(Long jobId) {
        return uploadJobRepository.findById(jobId).map(UploadJobStatusDTO::from);
    }

    @Transactional(readOnly = true)
    public List<UploadJobStatusDTO> list(int page, int size) {
        int p = Math.max(0, page);
        int s = Math.min(100, Math.max(1, size));
        return uploadJobRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(p, s))
                .map(UploadJobStatusDTO::from)
                .getContent();
    }

    /**
     * @throws NoSuchElementException when the job does not exist
     */
    @Transactional(readOnly = true)
    public List<RowFailureDTO> failures(Long jobId) {
        if (!uploadJobRepository.existsById(jobId)) {
            throw new NoSuchElementException("Upload " + jobId + " not found");
        }
        return uploadFailureRepository.findByUploadJobIdOrderByRowIndexAsc(jobId).stream()
                .map(f -> new RowFailureDTO(f.getRowIndex(), f.getExternalId(), f.getKind(), f.getReason()))
                .toList();
    }
}

package com.chambua.pricing.service;

import com.chambua.pricing.batch.UploadCancellationRegistry;
import com.chambua.pricing.batch.UploadProgress;
import com.chambua.pricing.config.PricingSettings;
import com.chambua.pricing.dto.PriceListRow;
import com.chambua.pricing.dto.RowFailureDTO;
import com.chambua.pricing.dto.UploadJobResult;
import com.chambua.pricing.model.FailureKind;
import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.model.UploadStatus;
import com.chambua.pricing.repository.CatalogProductRepository;
import com.chambua.pricing.repository.ListedProduct;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Runs one price upload: reconciles the batch row by row against the catalog, soft-removes products
 * missing from the batch and closes the job.
 *
 * Rows commit one at a time. A bad row is recorded and skipped, a conflicting row is retried once
 * against fresh state, and a cancellation request stops the upload before the next row while keeping
 * everything already committed. Only a store outage fails the whole upload.
 */
@Service
public class PriceIngestionService {
    private static final Logger log = LoggerFactory.getLogger(PriceIngestionService.class);

    private static final int LOG_EVERY_ROWS = 500;
    private static final int CONFLICT_ATTEMPTS = 2;
    private static final String EXTERNAL_ID_CONSTRAINT = "uk_catalog_product_external_id";

    private final PriceRowReconciler reconciler;
    private final PriceRowValidator validator;
    private final UploadJobService uploadJobService;
    private final UploadCancellationRegistry cancellationRegistry;
    private final CatalogProductRepository productRepository;
    private final PricingSettings settings;

    public PriceIngestionService(PriceRowReconciler reconciler,
                                 PriceRowValidator validator,
                                 UploadJobService uploadJobService,
                                 UploadCancellationRegistry cancellationRegistry,
                                 CatalogProductRepository productRepository,
                                 PricingSettings settings) {
        this.reconciler = reconciler;
        this.validator = validator;
        this.uploadJobService = uploadJobService;
        this.cancellationRegistry = cancellationRegistry;
        this.productRepository = productRepository;
        this.settings = settings;
    }

    public UploadJobResult run(Long jobId, List<PriceListRow> rows) {
        List<RowFailureDTO> failures = new ArrayList<>();
        UploadProgress progress = new UploadProgress(rows.size());
        long t0 = System.currentTimeMillis();
        try {
            UploadJob job = uploadJobService.start(jobId);
            if (job.getStatus() == UploadStatus.CANCELLED) {
                log.info("[PriceUpload][Job] jobId={} cancelled before start", jobId);
                return result(jobId, UploadStatus.CANCELLED, progress, failures, null);
            }
            LocalDate sourceDate = job.getSourceDate() != null ? job.getSourceDate() : LocalDate.now();
            String currency = settings.getDefaultCurrency();
            log.info("[PriceUpload][Job] jobId={} file={} rows={} started", jobId, job.getFilename(), rows.size());

            Set<String> seen = new HashSet<>();
            boolean cancelled = false;
            for (int i = 0; i < rows.size(); i++) {
                if (cancellationRegistry.isCancellationRequested(jobId)) {
                    cancelled = true;
                    log.info("[PriceUpload][Job] jobId={} cancellation observed before row {} ({})", jobId, i, progress);
                    break;
                }
                progress = processRow(jobId, i, rows.get(i), seen, currency, sourceDate, progress, failures);
                if ((i + 1) % LOG_EVERY_ROWS == 0) {
                    log.info("[PriceUpload][Progress] jobId={} {} percent={}", jobId, progress, progress.progressPercent());
                }
            }

            if (!cancelled) {
                progress = sweepRemoved(jobId, seen, currency, sourceDate, progress);
            }

            UploadStatus finalStatus = cancelled ? UploadStatus.CANCELLED : UploadStatus.DONE;
            uploadJobService.finish(jobId, finalStatus, progress, null);
            log.info("[PriceUpload][Job] jobId={} status={} {} durationMs={}", jobId, finalStatus, progress, System.currentTimeMillis() - t0);
            return result(jobId, finalStatus, progress, failures, null);
        } catch (StoreUnavailableException e) {
            log.error("[PriceUpload][Job] jobId={} aborted, store unavailable: {}", jobId, e.getMessage(), e);
            return failJob(jobId, progress, failures, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[PriceUpload][Job] jobId={} aborted: {}", jobId, e.getMessage(), e);
            return failJob(jobId, progress, failures, e.getMessage());
        } finally {
            cancellationRegistry.release(jobId);
        }
    }

    private UploadProgress processRow(Long jobId, int index, PriceListRow raw, Set<String> seen, String currency,
                                      LocalDate sourceDate, UploadProgress progress, List<RowFailureDTO> failures) {
        String externalId = raw == null ? null : raw.externalId();
        PriceListRow row;
        try {
            row = validator.validate(raw, seen, currency);
        } catch (RowValidationException e) {
            return fail(jobId, index, externalId, FailureKind.VALIDATION, e.getMessage(), progress, failures);
        }

        for (int attempt = 1; attempt <= CONFLICT_ATTEMPTS; attempt++) {
            UploadProgress staged = progress.copy();
            try {
                reconciler.reconcileRow(jobId, row, sourceDate, staged);
                return staged;
            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                if (e instanceof DataIntegrityViolationException && !isExternalIdRace(e)) {
                    String cause = e.getMostSpecificCause().getMessage();
                    log.warn("[PriceUpload][Rejected] jobId={} row={} externalId={}: {}", jobId, index, row.externalId(), cause);
                    return fail(jobId, index, row.externalId(), FailureKind.VALIDATION,
                            "Row rejected by the catalog store: " + cause, progress, failures);
                }
                log.warn("[PriceUpload][Conflict] jobId={} row={} externalId={} attempt={}: {}", jobId, index, row.externalId(), attempt, e.getMessage());
                if (attempt == CONFLICT_ATTEMPTS) {
                    return fail(jobId, index, row.externalId(), FailureKind.CONFLICT,
                            "Concurrent update of " + row.externalId() + " not resolved after retry", progress, failures);
                }
            } catch (DataAccessResourceFailureException | TransientDataAccessResourceException | CannotCreateTransactionException e) {
                throw new StoreUnavailableException("Catalog store unavailable at row " + index, e);
            } catch (IllegalArgumentException e) {
                return fail(jobId, index, row.externalId(), FailureKind.VALIDATION, e.getMessage(), progress, failures);
            }
        }
        throw new IllegalStateException("unreachable");
    }

    /**
     * True when the integrity violation is another writer inserting the same article first, the only
     * integrity error a retry against fresh state can resolve.
     */
    static boolean isExternalIdRace(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) t).getConstraintName();
                if (name != null && name.toLowerCase(Locale.ROOT).contains(EXTERNAL_ID_CONSTRAINT)) return true;
            }
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(EXTERNAL_ID_CONSTRAINT)) return true;
        }
        return false;
    }

    private UploadProgress fail(Long jobId, int index, String externalId, FailureKind kind, String reason,
                                UploadProgress progress, List<RowFailureDTO> failures) {
        UploadProgress staged = progress.copy();
        try {
            reconciler.recordFailure(jobId, index, externalId, kind, reason, staged);
        } catch (DataAccessResourceFailureException | TransientDataAccessResourceException | CannotCreateTransactionException e) {
            throw new StoreUnavailableException("Catalog store unavailable while recording failure of row " + index, e);
        }
        failures.add(new RowFailureDTO(index, externalId, kind, reason));
        return staged;
    }

    private UploadProgress sweepRemoved(Long jobId, Set<String> present, String currency, LocalDate sourceDate, UploadProgress progress) {
        int chunk = Math.max(1, settings.getRemovalChunkSize());
        long afterId = 0L;
        while (true) {
            List<ListedProduct> listed;
            try {
                listed = productRepository.findListedAfter(afterId, PageRequest.of(0, chunk));
            } catch (DataAccessResourceFailureException | TransientDataAccessResourceException | CannotCreateTransactionException e) {
                throw new StoreUnavailableException("Catalog store unavailable during removal sweep", e);
            }
            if (listed.isEmpty()) return progress;
            afterId = listed.get(listed.size() - 1).getId();

            List<Long> absent = new ArrayList<>();
            for (ListedProduct p : listed) {
                if (!present.contains(p.getExternalId())) absent.add(p.getId());
            }
            if (absent.isEmpty()) continue;
            progress = removeChunk(jobId, absent, currency, sourceDate, progress);
        }
    }

    private UploadProgress removeChunk(Long jobId, List<Long> ids, String currency, LocalDate sourceDate, UploadProgress progress) {
        for (int attempt = 1; ; attempt++) {
            UploadProgress staged = progress.copy();
            try {
                reconciler.removeProducts(jobId, ids, currency, sourceDate, staged);
                return staged;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= CONFLICT_ATTEMPTS) throw e;
                log.warn("[PriceUpload][Conflict] jobId={} removal chunk of {} retried: {}", jobId, ids.size(), e.getMessage());
            } catch (DataAccessResourceFailureException | TransientDataAccessResourceException | CannotCreateTransactionException e) {
                throw new StoreUnavailableException("Catalog store unavailable during removal sweep", e);
            }
        }
    }

    private UploadJobResult failJob(Long jobId, UploadProgress progress, List<RowFailureDTO> failures, String message) {
        try {
            uploadJobService.finish(jobId, UploadStatus.FAILED, progress, message);
        } catch (RuntimeException finishError) {
            log.error("[PriceUpload][Job] jobId={} could not be marked FAILED: {}", jobId, finishError.getMessage());
        }
        return result(jobId, UploadStatus.FAILED, progress, failures, message);
    }

    private static UploadJobResult result(Long jobId, UploadStatus status, UploadProgress p, List<RowFailureDTO> failures, String error) {
        int notProcessed = Math.max(0, p.getTotalRows() - p.getProcessedRows() - p.getFailedRows());
        return new UploadJobResult(jobId, status, p.getTotalRows(), p.getProcessedRows(),
                p.getNewCount(), p.getIncreasedCount(), p.getDecreasedCount(), p.getUnchangedCount(), p.getRemovedCount(),
                notProcessed, List.copyOf(failures), error);
    }
}

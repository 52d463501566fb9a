package com.chambua.pricing.service;

import com.chambua.pricing.batch.UploadProgress;
import com.chambua.pricing.dto.PriceListRow;
import com.chambua.pricing.model.*;
import com.chambua.pricing.repository.UploadFailureRepository;
import com.chambua.pricing.repository.UploadJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Units of work of an upload. Each public method runs in its own transaction and commits the catalog
 * rows, history entries, search projection and the job's counters together, so a crash or
 * cancellation leaves every row either fully applied or untouched.
 *
 * The {@link UploadProgress} passed in is a staged copy; it is only adopted by the caller after the
 * transaction commits.
 */
@Service
public class PriceRowReconciler {
    private static final Logger log = LoggerFactory.getLogger(PriceRowReconciler.class);

    private static final BigDecimal MAX_VOLUME = new BigDecimal("99999999.99");

    private final CatalogStore catalogStore;
    private final RoundingPolicy roundingPolicy;
    private final RawNameParser rawNameParser;
    private final UploadJobRepository uploadJobRepository;
    private final UploadFailureRepository uploadFailureRepository;

    public PriceRowReconciler(CatalogStore catalogStore,
                              RoundingPolicy roundingPolicy,
                              RawNameParser rawNameParser,
                              UploadJobRepository uploadJobRepository,
                              UploadFailureRepository uploadFailureRepository) {
        this.catalogStore = catalogStore;
        this.roundingPolicy = roundingPolicy;
        this.rawNameParser = rawNameParser;
        this.uploadJobRepository = uploadJobRepository;
        this.uploadFailureRepository = uploadFailureRepository;
    }

    /**
     * Diffs one validated row against the current catalog row and applies it.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ChangeType reconcileRow(Long jobId, PriceListRow row, LocalDate sourceDate, UploadProgress staged) {
        UploadJob job = uploadJobRepository.getReferenceById(jobId);
        CatalogProduct product = catalogStore.findByExternalId(row.externalId())
                .orElseGet(() -> new CatalogProduct(row.externalId()));
        boolean existed = product.getId() != null;

        BigDecimal oldRaw = product.getRawPrice();
        BigDecimal oldQuoted = product.getQuotedPrice();
        BigDecimal oldDelta = product.getRoundDelta();

        QuotedPrice quoted = roundingPolicy.quote(row.rawPrice());
        ChangeType type = ChangeType.classify(oldRaw, row.rawPrice(), existed);

        if (row.rawName() != null && !row.rawName().isEmpty()) {
            RawNameParser.ParsedName parsed = rawNameParser.parse(row.rawName());
            product.setRawName(clip(row.rawName(), 1000));
            product.setProductName(clip(parsed.productName(), 500));
            if (parsed.brand() != null) product.setBrand(clip(parsed.brand(), 255));
            if (parsed.category() != null) product.setCategory(parsed.category());
            if (parsed.volumeValue() != null && parsed.volumeValue().compareTo(MAX_VOLUME) <= 0) {
                product.setVolumeValue(parsed.volumeValue());
                product.setVolumeUnit(parsed.volumeUnit());
            }
            if (parsed.gender() != null) product.setGender(parsed.gender());
        }
        product.setRawPrice(row.rawPrice());
        product.setQuotedPrice(quoted.price());
        product.setRoundDelta(quoted.delta());
        product.setInCurrentPricelist(true);
        product.setActive(true);
        product.setInStock(row.inStockOrDefault());
        if (type.isPriceChange()) {
            product.setLastPriceChangeAt(Instant.now());
        }
        CatalogProduct saved = catalogStore.save(product);

        catalogStore.append(new HistoryEntry(saved, job, type)
                .oldPrices(oldRaw, oldQuoted, oldDelta)
                .newPrices(row.rawPrice(), quoted.price(), quoted.delta())
                .source(row.currency(), row.observedDate() != null ? row.observedDate() : sourceDate));

        staged.recordRow(type);
        persistProgress(jobId, staged);
        if (log.isDebugEnabled()) {
            log.debug("[PriceUpload][Row] jobId={} externalId={} type={} raw {} -> {} quoted {} -> {}",
                    jobId, row.externalId(), type, oldRaw, row.rawPrice(), oldQuoted, quoted.price());
        }
        return type;
    }

    /**
     * Soft-removes products that were listed before this upload and are absent from its batch.
     *
     * @return number of products actually removed (rows already unlisted are skipped)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int removeProducts(Long jobId, List<Long> productIds, String currency, LocalDate sourceDate, UploadProgress staged) {
        UploadJob job = uploadJobRepository.getReferenceById(jobId);
        int removed = 0;
        for (Long id : productIds) {
            CatalogProduct product = catalogStore.findById(id).orElse(null);
            if (product == null || !product.isInCurrentPricelist()) continue;

            catalogStore.append(new HistoryEntry(product, job, ChangeType.REMOVED)
                    .oldPrices(product.getRawPrice(), product.getQuotedPrice(), product.getRoundDelta())
                    .newPrices(null, null, null)
                    .source(currency, sourceDate));
            product.setInCurrentPricelist(false);
            product.setInStock(false);
            product.setActive(false);
            catalogStore.save(product);
            staged.recordRemoval();
            removed++;
        }
        persistProgress(jobId, staged);
        log.debug("[PriceUpload][Removed] jobId={} removed={} of candidates={}", jobId, removed, productIds.size());
        return removed;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFailure(Long jobId, int rowIndex, String externalId, FailureKind kind, String reason, UploadProgress staged) {
        UploadJob job = uploadJobRepository.getReferenceById(jobId);
        uploadFailureRepository.save(new UploadFailure(job, rowIndex, externalId, kind, reason));
        staged.recordFailure();
        persistProgress(jobId, staged);
        log.warn("[PriceUpload][RowFailed] jobId={} row={} externalId={} kind={} reason={}", jobId, rowIndex, externalId, kind, reason);
    }

    private static String clip(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }

    private void persistProgress(Long jobId, UploadProgress p) {
        int updated = uploadJobRepository.saveProgress(jobId,
                p.getProcessedRows(), p.getFailedRows(),
                p.getNewCount(), p.getIncreasedCount(), p.getDecreasedCount(),
                p.getRemovedCount(), p.getUnchangedCount(),
                p.progressPercent());
        if (updated != 1) {
            throw new IllegalStateException("Upload " + jobId + " is not in progress; row changes rolled back");
        }
    }
}

package com.chambua.pricing.batch;

import com.chambua.pricing.config.PricingSettings;
import com.chambua.pricing.repository.UploadJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation flags shared between whoever asks to cancel an upload and the job running it.
 *
 * The in-memory flag is read on every row. The persisted flag is re-read at most once per
 * {@code pricing.ingestion.cancel-poll-interval-ms}, which covers cancellations recorded by another
 * instance of the service.
 */
@Component
public class UploadCancellationRegistry {
    private static final Logger log = LoggerFactory.getLogger(UploadCancellationRegistry.class);

    private static final class Flag {
        volatile boolean cancelled;
        volatile long lastDbCheckMillis;
        volatile Instant releasedAt;
    }

    private final Map<Long, Flag> flags = new ConcurrentHashMap<>();
    private final UploadJobRepository uploadJobRepository;
    private final PricingSettings settings;

    public UploadCancellationRegistry(UploadJobRepository uploadJobRepository, PricingSettings settings) {
        this.uploadJobRepository = uploadJobRepository;
        this.settings = settings;
    }

    public void register(Long jobId) {
        Flag flag = new Flag();
        flag.lastDbCheckMillis = System.currentTimeMillis();
        flags.putIfAbsent(jobId, flag);
    }

    public void requestCancel(Long jobId) {
        flags.computeIfAbsent(jobId, id -> new Flag()).cancelled = true;
        log.info("[PriceUpload][Cancel] cancellation flagged jobId={}", jobId);
    }

    public boolean isCancellationRequested(Long jobId) {
        Flag flag = flags.computeIfAbsent(jobId, id -> new Flag());
        if (flag.cancelled) return true;
        long now = System.currentTimeMillis();
        if (now - flag.lastDbCheckMillis >= settings.getCancelPollIntervalMs()) {
            flag.lastDbCheckMillis = now;
            if (Boolean.TRUE.equals(uploadJobRepository.findCancelRequested(jobId))) {
                log.info("[PriceUpload][Cancel] persisted cancellation observed jobId={}", jobId);
                flag.cancelled = true;
            }
        }
        return flag.cancelled;
    }

    /** Marks the job's flag as no longer needed; the hourly cleanup drops it later. */
    public void release(Long jobId) {
        Flag flag = flags.get(jobId);
        if (flag != null) flag.releasedAt = Instant.now();
    }

    int size() {
        return flags.size();
    }

    @Scheduled(cron = "0 0 * * * *")
    public void cleanup() {
        Instant cutoff = Instant.now().minus(Duration.ofHours(24));
        flags.values().removeIf(f -> f.releasedAt != null && f.releasedAt.isBefore(cutoff));
    }
}

package com.chambua.pricing.service;

import com.chambua.pricing.batch.UploadCancellationRegistry;
import com.chambua.pricing.batch.UploadProgress;
import com.chambua.pricing.dto.PriceListRow;
import com.chambua.pricing.dto.StartUploadRequest;
import com.chambua.pricing.dto.UploadJobResult;
import com.chambua.pricing.model.UploadJob;
import com.chambua.pricing.model.UploadStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Accepts uploads and queues them on the single ingestion thread, so uploads never write the catalog
 * concurrently. Search index rebuilds go through the same queue.
 */
@Service
public class PriceUploadCoordinator {
    private static final Logger log = LoggerFactory.getLogger(PriceUploadCoordinator.class);

    private final UploadJobService uploadJobService;
    private final PriceIngestionService ingestionService;
    private final UploadCancellationRegistry cancellationRegistry;
    private final SearchIndexSynchronizer searchIndex;
    private final Executor executor;

    public PriceUploadCoordinator(UploadJobService uploadJobService,
                                  PriceIngestionService ingestionService,
                                  UploadCancellationRegistry cancellationRegistry,
                                  SearchIndexSynchronizer searchIndex,
                                  ThreadPoolTaskExecutor priceIngestionExecutor) {
        this.uploadJobService = uploadJobService;
        this.ingestionService = ingestionService;
        this.cancellationRegistry = cancellationRegistry;
        this.searchIndex = searchIndex;
        this.executor = priceIngestionExecutor;
    }

    /**
     * Creates the job and queues it.
     *
     * @return the queued job; its id is how the caller follows progress
     * @throws IllegalArgumentException when the batch is empty
     */
    public UploadJob submit(StartUploadRequest request, String actor) {
        List<PriceListRow> rows = request.getRows();
        if (rows == null || rows.isEmpty()) {
            throw new IllegalArgumentException("Price list has no rows");
        }
        List<PriceListRow> batch = new ArrayList<>(rows);
        UploadJob job = uploadJobService.createJob(request.getFilename(), request.getObservedDate(), actor, batch.size());
        Long jobId = job.getId();
        try {
            CompletableFuture.runAsync(() -> ingestionService.run(jobId, batch), executor);
        } catch (TaskRejectedException e) {
            log.error("[PriceUpload][Queue] jobId={} rejected, ingestion queue is full", jobId);
            uploadJobService.finish(jobId, UploadStatus.FAILED, new UploadProgress(batch.size()), "Ingestion queue is full");
            cancellationRegistry.release(jobId);
            throw e;
        }
        log.info("[PriceUpload][Queued] jobId={} rows={}", jobId, batch.size());
        return job;
    }

    /**
     * Queues a full search index rebuild behind the uploads already waiting. A rebuild running beside an
     * upload could re-project a product from before that upload removed it.
     *
     * @return completes with the number of indexed products
     * @throws TaskRejectedException when the ingestion queue is full
     */
    public CompletableFuture<Long> rebuildSearchIndex() {
        CompletableFuture<Long> rebuild = CompletableFuture.supplyAsync(searchIndex::rebuild, executor);
        log.info("[SearchIndex][Queued] rebuild");
        return rebuild;
    }

    /**
     * Runs an upload on the calling thread, outside the ingestion queue. Test support only: the caller
     * must make sure nothing else writes the catalog meanwhile.
     */
    UploadJobResult runNow(StartUploadRequest request, String actor) {
        List<PriceListRow> rows = request.getRows() == null ? List.of() : new ArrayList<>(request.getRows());
        UploadJob job = uploadJobService.createJob(request.getFilename(), request.getObservedDate(), actor, rows.size());
        return ingestionService.run(job.getId(), rows);
    }
}

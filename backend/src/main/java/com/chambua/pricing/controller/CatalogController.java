package com.chambua.pricing.controller;

import com.chambua.pricing.dto.HistoryEntryDTO;
import com.chambua.pricing.dto.ProductPriceDTO;
import com.chambua.pricing.dto.SearchPageDTO;
import com.chambua.pricing.service.CatalogQueryService;
import com.chambua.pricing.service.CatalogSearchService;
import com.chambua.pricing.service.PriceUploadCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/price")
public class CatalogController {
    private static final Logger log = LoggerFactory.getLogger(CatalogController.class);

    private final CatalogQueryService queryService;
    private final CatalogSearchService searchService;
    private final PriceUploadCoordinator coordinator;

    public CatalogController(CatalogQueryService queryService,
                             CatalogSearchService searchService,
                             PriceUploadCoordinator coordinator) {
        this.queryService = queryService;
        this.searchService = searchService;
        this.coordinator = coordinator;
    }

    @GetMapping("/products/{externalId}")
    public ProductPriceDTO product(@PathVariable("externalId") String externalId) {
        return queryService.currentPrice(externalId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Product not found"));
    }

    @GetMapping("/products/{externalId}/history")
    public List<HistoryEntryDTO> history(@PathVariable("externalId") String externalId) {
        try {
            return queryService.history(externalId);
        } catch (NoSuchElementException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    @GetMapping("/search")
    public SearchPageDTO search(@RequestParam(value = "q", required = false) String q,
                                @RequestParam(value = "uploadId", required = false) Long uploadId,
                                @RequestParam(value = "page", defaultValue = "0") int page,
                                @RequestParam(value = "size", defaultValue = "50") int size) {
        return searchService.search(q, uploadId, page, size);
    }

    @PostMapping("/search-index/rebuild")
    public CompletableFuture<Map<String, Object>> rebuildIndex(@RequestHeader(value = "X-User-Id", required = false) String userId) {
        log.info("[CatalogController][REINDEX] user={}", userId);
        try {
            return coordinator.rebuildSearchIndex().thenApply(indexed -> Map.<String, Object>of("indexed", indexed));
        } catch (TaskRejectedException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Ingestion queue is full, retry later");
        }
    }
}

package com.chambua.pricing.service;

import com.chambua.pricing.model.CatalogProduct;
import com.chambua.pricing.model.HistoryEntry;
import com.chambua.pricing.repository.CatalogProductRepository;
import com.chambua.pricing.repository.HistoryEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Write path for catalog rows and the price history ledger. Every product write is followed by the
 * search projection update in the same transaction; callers must already hold one.
 */
@Service
public class CatalogStore {

    private final CatalogProductRepository productRepository;
    private final HistoryEntryRepository historyRepository;
    private final SearchIndexSynchronizer searchIndex;

    public CatalogStore(CatalogProductRepository productRepository,
                        HistoryEntryRepository historyRepository,
                        SearchIndexSynchronizer searchIndex) {
        this.productRepository = productRepository;
        this.historyRepository = historyRepository;
        this.searchIndex = searchIndex;
    }

    @Transactional(readOnly = true)
    public Optional<CatalogProduct> findByExternalId(String externalId) {
        return productRepository.findByExternalId(externalId);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<CatalogProduct> findById(Long id) {
        return productRepository.findById(id);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public CatalogProduct save(CatalogProduct product) {
        CatalogProduct saved = productRepository.saveAndFlush(product);
        searchIndex.onProductSaved(saved);
        return saved;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public HistoryEntry append(HistoryEntry entry) {
        if (entry.getId() != null) {
            throw new IllegalStateException("History entries are append-only; entry " + entry.getId() + " already written");
        }
        return historyRepository.save(entry);
    }
}

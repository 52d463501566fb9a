package com.chambua.pricing.service;

import com.chambua.pricing.config.PricingSettings;
import com.chambua.pricing.model.CatalogProduct;
import com.chambua.pricing.model.SearchIndexEntry;
import com.chambua.pricing.repository.CatalogProductRepository;
import com.chambua.pricing.repository.SearchIndexEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
public class JpaSearchIndexSynchronizer implements SearchIndexSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(JpaSearchIndexSynchronizer.class);

    static final int MAX_SEARCH_TEXT = 2000;
    private static final int REBUILD_CHUNK = 500;

    private final SearchIndexEntryRepository indexRepository;
    private final CatalogProductRepository productRepository;
    private final PricingSettings settings;

    public JpaSearchIndexSynchronizer(SearchIndexEntryRepository indexRepository,
                                      CatalogProductRepository productRepository,
                                      PricingSettings settings) {
        this.indexRepository = indexRepository;
        this.productRepository = productRepository;
        this.settings = settings;
    }

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public void onProductSaved(CatalogProduct product) {
        Objects.requireNonNull(product.getId(), "product must be persisted before indexing");
        if (isIndexable(product)) {
            indexRepository.save(project(product));
        } else if (indexRepository.existsById(product.getId())) {
            indexRepository.deleteById(product.getId());
            log.debug("[SearchIndex] dropped externalId={} (no longer listed)", product.getExternalId());
        }
    }

    @Override
    @Transactional
    public long rebuild() {
        int dropped = indexRepository.deleteAllEntries();
        long indexed = 0;
        long afterId = 0L;
        while (true) {
            List<Long> ids = productRepository.findIdsAfter(afterId, PageRequest.of(0, REBUILD_CHUNK));
            if (ids.isEmpty()) break;
            for (CatalogProduct p : productRepository.findAllById(ids)) {
                if (isIndexable(p)) {
                    indexRepository.save(project(p));
                    indexed++;
                }
            }
            afterId = ids.get(ids.size() - 1);
        }
        log.info("[SearchIndex][Rebuild] dropped={} indexed={} includeRemoved={}", dropped, indexed, settings.isSearchIncludesRemoved());
        return indexed;
    }

    @Override
    public boolean isIndexable(CatalogProduct product) {
        return product.isInCurrentPricelist() || settings.isSearchIncludesRemoved();
    }

    SearchIndexEntry project(CatalogProduct product) {
        SearchIndexEntry e = new SearchIndexEntry(product.getId());
        e.setExternalId(product.getExternalId());
        e.setBrand(product.getBrand());
        e.setProductName(product.getProductName());
        e.setRawName(product.getRawName());
        e.setSearchText(searchText(product));
        e.setInCurrentPricelist(product.isInCurrentPricelist());
        e.setActive(product.isActive());
        e.setUpdatedAt(Instant.now());
        return e;
    }

    static String searchText(CatalogProduct product) {
        String text = Stream.of(product.getExternalId(), product.getBrand(), product.getProductName(), product.getRawName())
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ");
        return text.length() > MAX_SEARCH_TEXT ? text.substring(0, MAX_SEARCH_TEXT) : text;
    }
}

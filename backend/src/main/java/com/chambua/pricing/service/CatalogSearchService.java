package com.chambua.pricing.service;

import com.chambua.pricing.config.PricingSettings;
import com.chambua.pricing.dto.SearchHitDTO;
import com.chambua.pricing.dto.SearchPageDTO;
import com.chambua.pricing.model.CatalogProduct;
import com.chambua.pricing.model.HistoryEntry;
import com.chambua.pricing.model.SearchIndexEntry;
import com.chambua.pricing.repository.CatalogProductRepository;
import com.chambua.pricing.repository.SearchIndexEntryRepository;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Token search over the search projection. Every token of the query has to occur in an entry's
 * search text; results come newest product first.
 */
@Service
public class CatalogSearchService {
    private static final Logger log = LoggerFactory.getLogger(CatalogSearchService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final SearchIndexEntryRepository indexRepository;
    private final CatalogProductRepository productRepository;
    private final PricingSettings settings;

    public CatalogSearchService(SearchIndexEntryRepository indexRepository,
                                CatalogProductRepository productRepository,
                                PricingSettings settings) {
        this.indexRepository = indexRepository;
        this.productRepository = productRepository;
        this.settings = settings;
    }

    @Transactional(readOnly = true)
    public SearchPageDTO search(String query, Long uploadId, int page, int size) {
        int p = Math.max(0, page);
        int s = Math.min(MAX_PAGE_SIZE, Math.max(1, size));
        List<String> tokens = tokens(query);

        Page<SearchIndexEntry> result = indexRepository.findAll(matching(tokens, uploadId, settings.isSearchIncludesRemoved()),
                PageRequest.of(p, s, Sort.by(Sort.Direction.DESC, "productId")));

        List<Long> ids = result.getContent().stream().map(SearchIndexEntry::getProductId).toList();
        Map<Long, BigDecimal> quoted = new HashMap<>();
        for (CatalogProduct product : productRepository.findAllById(ids)) {
            quoted.put(product.getId(), product.getQuotedPrice());
        }
        List<SearchHitDTO> items = result.getContent().stream()
                .map(e -> new SearchHitDTO(e.getExternalId(), e.getBrand(), e.getProductName(), e.getRawName(),
                        quoted.get(e.getProductId()), e.isInCurrentPricelist()))
                .toList();
        log.debug("[Search] q='{}' tokens={} uploadId={} page={} size={} total={}", query, tokens.size(), uploadId, p, s, result.getTotalElements());
        return new SearchPageDTO(items, result.getTotalElements(), p, s);
    }

    static List<String> tokens(String query) {
        if (query == null || query.isBlank()) return List.of();
        return Arrays.stream(query.toLowerCase(Locale.ROOT).split("[\\s,]+"))
                .filter(t -> !t.isEmpty())
                .toList();
    }

    static Specification<SearchIndexEntry> matching(List<String> tokens, Long uploadId, boolean includeRemoved) {
        return (root, cq, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            for (String token : tokens) {
                predicates.add(cb.like(root.<String>get("searchText"), "%" + escapeLike(token) + "%", '!'));
            }
            if (!includeRemoved) {
                predicates.add(cb.isTrue(root.<Boolean>get("inCurrentPricelist")));
            }
            if (uploadId != null) {
                Subquery<Long> touched = cq.subquery(Long.class);
                Root<HistoryEntry> h = touched.from(HistoryEntry.class);
                touched.select(h.<Long>get("id"))
                        .where(cb.equal(h.get("product").get("id"), root.get("productId")),
                                cb.equal(h.get("uploadJob").get("id"), uploadId));
                predicates.add(cb.exists(touched));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static String escapeLike(String token) {
        return token.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}

package com.chambua.pricing.service;

import com.chambua.pricing.dto.HistoryEntryDTO;
import com.chambua.pricing.dto.ProductPriceDTO;
import com.chambua.pricing.model.CatalogProduct;
import com.chambua.pricing.model.HistoryEntry;
import com.chambua.pricing.repository.CatalogProductRepository;
import com.chambua.pricing.repository.HistoryEntryRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

@Service
public class CatalogQueryService {

    static final int HISTORY_LIMIT = 200;

    private final CatalogProductRepository productRepository;
    private final HistoryEntryRepository historyRepository;

    public CatalogQueryService(CatalogProductRepository productRepository, HistoryEntryRepository historyRepository) {
        this.productRepository = productRepository;
        this.historyRepository = historyRepository;
    }

    @Transactional(readOnly = true)
    public Optional<ProductPriceDTO> currentPrice(String externalId) {
        return productRepository.findByExternalId(externalId.trim()).map(CatalogQueryService::toDto);
    }

    /**
     * Price changes of one product, newest first, at most {@value #HISTORY_LIMIT} entries.
     *
     * @throws NoSuchElementException when no product has this external id
     */
    @Transactional(readOnly = true)
    public List<HistoryEntryDTO> history(String externalId) {
        CatalogProduct product = productRepository.findByExternalId(externalId.trim())
                .orElseThrow(() -> new NoSuchElementException("Product " + externalId + " not found"));
        return historyRepository.findByProductIdOrderByIdDesc(product.getId(), PageRequest.of(0, HISTORY_LIMIT)).stream()
                .map(CatalogQueryService::toDto)
                .toList();
    }

    static ProductPriceDTO toDto(CatalogProduct p) {
        return new ProductPriceDTO(p.getExternalId(), p.getBrand(), p.getProductName(),
                p.getCategory(), p.getVolumeValue(), p.getVolumeUnit(), p.getGender(),
                p.getRawPrice(), p.getQuotedPrice(), p.getRoundDelta(),
                p.isInStock(), p.isInCurrentPricelist(), p.isActive(), p.getLastPriceChangeAt());
    }

    static HistoryEntryDTO toDto(HistoryEntry h) {
        return new HistoryEntryDTO(h.getId(), h.getUploadJob().getId(), h.getChangeType(),
                h.getOldRawPrice(), h.getNewRawPrice(),
                h.getOldQuotedPrice(), h.getNewQuotedPrice(),
                h.getOldRoundDelta(), h.getNewRoundDelta(),
                h.getCurrency(), h.getSourceDate(), h.getCreatedAt());
    }
}

package com.chambua.pricing.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record ProductPriceDTO(String externalId,
                              String brand,
                              String productName,
                              String category,
                              BigDecimal volumeValue,
                              String volumeUnit,
                              String gender,
                              BigDecimal rawPrice,
                              BigDecimal quotedPrice,
                              BigDecimal roundDelta,
                              boolean inStock,
                              boolean inCurrentPricelist,
                              boolean active,
                              Instant lastPriceChangeAt) {
}

package com.chambua.pricing.dto;

import java.math.BigDecimal;

public record SearchHitDTO(String externalId,
                           String brand,
                           String productName,
                           String rawName,
                           BigDecimal quotedPrice,
                           boolean inCurrentPricelist) {
}

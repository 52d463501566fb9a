package com.chambua.pricing.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One parsed price-list observation.
 *
 * @param externalId   supplier article, required and non-blank
 * @param rawPrice     supplier price; {@code null} makes the row a "no price" failure
 * @param currency     ISO code, defaults to the upload's currency when blank
 * @param observedDate date the price was observed
 * @param inStock      stock flag from the price list; {@code null} means in stock
 * @param rawName      free-text article name, optional
 */
public record PriceListRow(String externalId,
                           BigDecimal rawPrice,
                           String currency,
                           LocalDate observedDate,
                           Boolean inStock,
                           String rawName) {

    public PriceListRow(String externalId, BigDecimal rawPrice) {
        this(externalId, rawPrice, null, null, null, null);
    }

    public boolean inStockOrDefault() {
        return inStock == null || inStock;
    }
}

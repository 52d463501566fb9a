package com.chambua.pricing.service;

import com.chambua.pricing.dto.PriceListRow;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Set;

/**
 * Checks one batch row before it touches the catalog and returns it normalized: trimmed article,
 * price at two decimals, upper-case currency.
 */
@Service
public class PriceRowValidator {

    static final int MAX_EXTERNAL_ID = 128;

    /**
     * @param seenExternalIds articles already met earlier in the same batch; the row's article is added on success
     * @throws RowValidationException when the row must be skipped
     */
    public PriceListRow validate(PriceListRow row, Set<String> seenExternalIds, String defaultCurrency) {
        if (row == null) throw new RowValidationException("Empty row");
        String externalId = row.externalId() == null ? "" : row.externalId().trim();
        if (externalId.isEmpty()) throw new RowValidationException("Missing external id");
        if (externalId.length() > MAX_EXTERNAL_ID) {
            throw new RowValidationException("External id longer than " + MAX_EXTERNAL_ID + " characters");
        }
        if (!seenExternalIds.add(externalId)) {
            throw new RowValidationException("Duplicate external id in batch: " + externalId);
        }
        BigDecimal price = row.rawPrice();
        if (price == null) throw new RowValidationException("No price for " + externalId);
        if (price.signum() < 0) throw new RowValidationException("Negative price " + price.toPlainString() + " for " + externalId);
        BigDecimal normalized = price.setScale(2, RoundingMode.HALF_UP);
        if (normalized.compareTo(RoundingPolicy.MAX_PRICE) > 0) {
            throw new RowValidationException("Price " + price.toPlainString() + " for " + externalId
                    + " exceeds " + RoundingPolicy.MAX_PRICE.toPlainString());
        }

        String currency = row.currency() == null || row.currency().isBlank() ? defaultCurrency : row.currency().trim().toUpperCase();
        if (currency != null && currency.length() > 8) throw new RowValidationException("Invalid currency '" + currency + "'");

        String rawName = row.rawName() == null ? null : row.rawName().trim();
        return new PriceListRow(externalId, normalized, currency, row.observedDate(), row.inStock(), rawName);
    }
}

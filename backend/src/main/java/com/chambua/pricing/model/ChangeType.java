package com.chambua.pricing.model;

import java.math.BigDecimal;

public enum ChangeType {
    NEW,
    INCREASED,
    DECREASED,
    REMOVED,
    UNCHANGED;

    /**
     * Classifies a price transition from the previous raw price and the incoming one.
     *
     * @param oldRawPrice previous raw price, {@code null} when the product has never been priced
     * @param newRawPrice incoming raw price, {@code null} when the product left the price list
     * @param existed     whether a catalog row existed before this upload
     */
    public static ChangeType classify(BigDecimal oldRawPrice, BigDecimal newRawPrice, boolean existed) {
        if (newRawPrice == null) return REMOVED;
        if (!existed || oldRawPrice == null) return NEW;
        int cmp = newRawPrice.compareTo(oldRawPrice);
        if (cmp > 0) return INCREASED;
        if (cmp < 0) return DECREASED;
        return UNCHANGED;
    }

    public boolean isPriceChange() {
        return this != UNCHANGED;
    }
}

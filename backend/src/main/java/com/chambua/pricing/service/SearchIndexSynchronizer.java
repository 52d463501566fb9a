package com.chambua.pricing.service;

import com.chambua.pricing.model.CatalogProduct;

/**
 * Keeps the search projection in step with the catalog. {@link CatalogStore} calls it on every write,
 * inside the transaction that writes the product row.
 */
public interface SearchIndexSynchronizer {

    /** Re-projects one product after it was inserted or updated (soft removal included). */
    void onProductSaved(CatalogProduct product);

    /**
     * Drops the whole projection and re-projects every catalog row; returns the number of indexed products.
     * Must not run beside an upload; callers go through {@link PriceUploadCoordinator#rebuildSearchIndex()}.
     */
    long rebuild();

    /** Whether the product belongs in the index; soft-removed products only when removed products stay searchable. */
    boolean isIndexable(CatalogProduct product);
}

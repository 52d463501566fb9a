package com.chambua.pricing.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Read-optimized projection of a {@link CatalogProduct}. Never the source of truth.
 */
@Entity
@Table(name = "catalog_search_index")
public class SearchIndexEntry {
    @Id
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "external_id", nullable = false, length = 128)
    private String externalId;

    @Column(length = 255)
    private String brand;

    @Column(name = "product_name", length = 500)
    private String productName;

    @Column(name = "raw_name", length = 1000)
    private String rawName;

    @Column(name = "search_text", nullable = false, length = 2000)
    private String searchText;

    @Column(name = "in_current_pricelist", nullable = false)
    private boolean inCurrentPricelist;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected SearchIndexEntry() {}

    public SearchIndexEntry(Long productId) {
        this.productId = productId;
    }

    public Long getProductId() { return productId; }
    public String getExternalId() { return externalId; }
    public void setExternalId(String externalId) { this.externalId = externalId; }
    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }
    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }
    public String getRawName() { return rawName; }
    public void setRawName(String rawName) { this.rawName = rawName; }
    public String getSearchText() { return searchText; }
    public void setSearchText(String searchText) { this.searchText = searchText; }
    public boolean isInCurrentPricelist() { return inCurrentPricelist; }
    public void setInCurrentPricelist(boolean inCurrentPricelist) { this.inCurrentPricelist = inCurrentPricelist; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}

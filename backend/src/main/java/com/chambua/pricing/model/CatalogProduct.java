package com.chambua.pricing.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "catalog_product", uniqueConstraints = {
        @UniqueConstraint(name = "uk_catalog_product_external_id", columnNames = "external_id")
})
public class CatalogProduct {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, updatable = false, length = 128)
    private String externalId;

    @Column(name = "raw_name", length = 1000)
    private String rawName;

    @Column(length = 255)
    private String brand;

    @Column(name = "product_name", length = 500)
    private String productName;

    @Column(length = 255)
    private String category;

    @Column(name = "volume_value", precision = 10, scale = 2)
    private BigDecimal volumeValue;

    @Column(name = "volume_unit", length = 8)
    private String volumeUnit;

    @Column(length = 1)
    private String gender; // F, M or U

    @Column(name = "raw_price", precision = 12, scale = 2)
    private BigDecimal rawPrice;

    @Column(name = "quoted_price", precision = 12, scale = 2)
    private BigDecimal quotedPrice;

    @Column(name = "round_delta", precision = 12, scale = 2)
    private BigDecimal roundDelta;

    @Column(name = "in_stock", nullable = false)
    private boolean inStock = true;

    @Column(name = "in_current_pricelist", nullable = false)
    private boolean inCurrentPricelist = true;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "last_price_change_at")
    private Instant lastPriceChangeAt;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected CatalogProduct() {}

    public CatalogProduct(String externalId) {
        this.externalId = externalId;
    }

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = Instant.now();
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }
    public String getExternalId() { return externalId; }
    public String getRawName() { return rawName; }
    public void setRawName(String rawName) { this.rawName = rawName; }
    public String getBrand() { return brand; }
    public void setBrand(String brand) { this.brand = brand; }
    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }
    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
    public BigDecimal getVolumeValue() { return volumeValue; }
    public void setVolumeValue(BigDecimal volumeValue) { this.volumeValue = volumeValue; }
    public String getVolumeUnit() { return volumeUnit; }
    public void setVolumeUnit(String volumeUnit) { this.volumeUnit = volumeUnit; }
    public String getGender() { return gender; }
    public void setGender(String gender) { this.gender = gender; }
    public BigDecimal getRawPrice() { return rawPrice; }
    public void setRawPrice(BigDecimal rawPrice) { this.rawPrice = rawPrice; }
    public BigDecimal getQuotedPrice() { return quotedPrice; }
    public void setQuotedPrice(BigDecimal quotedPrice) { this.quotedPrice = quotedPrice; }
    public BigDecimal getRoundDelta() { return roundDelta; }
    public void setRoundDelta(BigDecimal roundDelta) { this.roundDelta = roundDelta; }
    public boolean isInStock() { return inStock; }
    public void setInStock(boolean inStock) { this.inStock = inStock; }
    public boolean isInCurrentPricelist() { return inCurrentPricelist; }
    public void setInCurrentPricelist(boolean inCurrentPricelist) { this.inCurrentPricelist = inCurrentPricelist; }
    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
    public Instant getLastPriceChangeAt() { return lastPriceChangeAt; }
    public void setLastPriceChangeAt(Instant lastPriceChangeAt) { this.lastPriceChangeAt = lastPriceChangeAt; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Long getVersion() { return version; }
}

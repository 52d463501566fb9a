package com.chambua.pricing.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One price transition of one product within one upload. Rows are insert-only.
 */
@Entity
@Immutable
@Table(name = "price_history", indexes = {
        @Index(name = "idx_price_history_product", columnList = "product_id, id"),
        @Index(name = "idx_price_history_upload", columnList = "upload_job_id")
})
public class HistoryEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_price_history_product"))
    private CatalogProduct product;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "upload_job_id", nullable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_price_history_upload"))
    private UploadJob uploadJob;

    @Enumerated(EnumType.STRING)
    @Column(name = "change_type", nullable = false, updatable = false, length = 16)
    private ChangeType changeType;

    @Column(name = "old_raw_price", precision = 12, scale = 2, updatable = false)
    private BigDecimal oldRawPrice;

    @Column(name = "new_raw_price", precision = 12, scale = 2, updatable = false)
    private BigDecimal newRawPrice;

    @Column(name = "old_quoted_price", precision = 12, scale = 2, updatable = false)
    private BigDecimal oldQuotedPrice;

    @Column(name = "new_quoted_price", precision = 12, scale = 2, updatable = false)
    private BigDecimal newQuotedPrice;

    @Column(name = "old_round_delta", precision = 12, scale = 2, updatable = false)
    private BigDecimal oldRoundDelta;

    @Column(name = "new_round_delta", precision = 12, scale = 2, updatable = false)
    private BigDecimal newRoundDelta;

    @Column(length = 8, updatable = false)
    private String currency;

    @Column(name = "source_date", updatable = false)
    private LocalDate sourceDate;

    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    protected HistoryEntry() {}

    public HistoryEntry(CatalogProduct product, UploadJob uploadJob, ChangeType changeType) {
        this.product = product;
        this.uploadJob = uploadJob;
        this.changeType = changeType;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public HistoryEntry oldPrices(BigDecimal raw, BigDecimal quoted, BigDecimal delta) {
        this.oldRawPrice = raw;
        this.oldQuotedPrice = quoted;
        this.oldRoundDelta = delta;
        return this;
    }

    public HistoryEntry newPrices(BigDecimal raw, BigDecimal quoted, BigDecimal delta) {
        this.newRawPrice = raw;
        this.newQuotedPrice = quoted;
        this.newRoundDelta = delta;
        return this;
    }

    public HistoryEntry source(String currency, LocalDate sourceDate) {
        this.currency = currency;
        this.sourceDate = sourceDate;
        return this;
    }

    public Long getId() { return id; }
    public CatalogProduct getProduct() { return product; }
    public UploadJob getUploadJob() { return uploadJob; }
    public ChangeType getChangeType() { return changeType; }
    public BigDecimal getOldRawPrice() { return oldRawPrice; }
    public BigDecimal getNewRawPrice() { return newRawPrice; }
    public BigDecimal getOldQuotedPrice() { return oldQuotedPrice; }
    public BigDecimal getNewQuotedPrice() { return newQuotedPrice; }
    public BigDecimal getOldRoundDelta() { return oldRoundDelta; }
    public BigDecimal getNewRoundDelta() { return newRoundDelta; }
    public String getCurrency() { return currency; }
    public LocalDate getSourceDate() { return sourceDate; }
    public Instant getCreatedAt() { return createdAt; }
}

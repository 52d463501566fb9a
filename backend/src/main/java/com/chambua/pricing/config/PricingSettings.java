package com.chambua.pricing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
public class PricingSettings {

    public enum RoundingMode { STEPPED, NONE }

    @Value("${pricing.rounding.mode:STEPPED}")
    private RoundingMode roundingMode = RoundingMode.STEPPED;

    @Value("${pricing.rounding.threshold:1000}")
    private BigDecimal roundingThreshold = new BigDecimal("1000");

    @Value("${pricing.rounding.small-step:50}")
    private BigDecimal smallStep = new BigDecimal("50");

    @Value("${pricing.rounding.large-step:500}")
    private BigDecimal largeStep = new BigDecimal("500");

    @Value("${pricing.search.include-removed:false}")
    private boolean searchIncludesRemoved;

    @Value("${pricing.ingestion.cancel-poll-interval-ms:1000}")
    private long cancelPollIntervalMs = 1000;

    @Value("${pricing.ingestion.removal-chunk-size:200}")
    private int removalChunkSize = 200;

    @Value("${pricing.default-currency:RUB}")
    private String defaultCurrency = "RUB";

    public RoundingMode getRoundingMode() { return roundingMode; }
    public void setRoundingMode(RoundingMode roundingMode) { this.roundingMode = roundingMode; }
    public BigDecimal getRoundingThreshold() { return roundingThreshold; }
    public void setRoundingThreshold(BigDecimal roundingThreshold) { this.roundingThreshold = roundingThreshold; }
    public BigDecimal getSmallStep() { return smallStep; }
    public void setSmallStep(BigDecimal smallStep) { this.smallStep = smallStep; }
    public BigDecimal getLargeStep() { return largeStep; }
    public void setLargeStep(BigDecimal largeStep) { this.largeStep = largeStep; }
    public boolean isSearchIncludesRemoved() { return searchIncludesRemoved; }
    public void setSearchIncludesRemoved(boolean searchIncludesRemoved) { this.searchIncludesRemoved = searchIncludesRemoved; }
    public long getCancelPollIntervalMs() { return cancelPollIntervalMs; }
    public void setCancelPollIntervalMs(long cancelPollIntervalMs) { this.cancelPollIntervalMs = cancelPollIntervalMs; }
    public int getRemovalChunkSize() { return removalChunkSize; }
    public void setRemovalChunkSize(int removalChunkSize) { this.removalChunkSize = removalChunkSize; }
    public String getDefaultCurrency() { return defaultCurrency; }
    public void setDefaultCurrency(String defaultCurrency) { this.defaultCurrency = defaultCurrency; }
}

package com.chambua.pricing.service;

import java.math.BigDecimal;

/**
 * Customer-facing price derived from a raw price, and how much rounding added to it.
 */
public record QuotedPrice(BigDecimal price, BigDecimal delta) {}

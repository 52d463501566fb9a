package com.chambua.pricing.dto;

import com.chambua.pricing.model.ChangeType;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

public record HistoryEntryDTO(Long id,
                              Long uploadJobId,
                              ChangeType changeType,
                              BigDecimal oldRawPrice,
                              BigDecimal newRawPrice,
                              BigDecimal oldQuotedPrice,
                              BigDecimal newQuotedPrice,
                              BigDecimal oldRoundDelta,
                              BigDecimal newRoundDelta,
                              String currency,
                              LocalDate sourceDate,
                              Instant createdAt) {
}

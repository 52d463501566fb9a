package com.chambua.pricing.dto;

import com.chambua.pricing.model.FailureKind;

public record RowFailureDTO(int rowIndex, String externalId, FailureKind kind, String reason) {}

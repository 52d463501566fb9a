package com.chambua.pricing.model;

public enum FailureKind {
    VALIDATION,
    CONFLICT
}

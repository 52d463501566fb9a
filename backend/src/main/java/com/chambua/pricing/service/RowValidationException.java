package com.chambua.pricing.service;

/**
 * A batch row that cannot be reconciled as given. The row is skipped and the upload carries on.
 */
public class RowValidationException extends IllegalArgumentException {
    public RowValidationException(String message) {
        super(message);
    }
}

package com.chambua.pricing.service;

/**
 * The catalog database cannot be reached. Fatal for the running upload.
 */
public class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

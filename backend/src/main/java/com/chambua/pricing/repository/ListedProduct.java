package com.chambua.pricing.repository;

public interface ListedProduct {
    Long getId();
    String getExternalId();
}

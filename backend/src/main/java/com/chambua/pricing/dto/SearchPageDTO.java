package com.chambua.pricing.dto;

import java.util.List;

public record SearchPageDTO(List<SearchHitDTO> items, long total, int page, int size) {}

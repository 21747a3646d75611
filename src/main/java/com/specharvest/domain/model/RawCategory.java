package com.specharvest.domain.model;

import java.util.List;

/**
 * Specification category as it appears on a detail page.
 * Pairs keep extraction order.
 */
public record RawCategory(String title, List<SpecPair> pairs) {

    public RawCategory {
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
    }
}

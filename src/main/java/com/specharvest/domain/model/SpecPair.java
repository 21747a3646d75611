package com.specharvest.domain.model;

/**
 * Single key/value row of a specification category.
 */
public record SpecPair(String key, String value) {
}

package com.txwatch.domain.metadata;

import com.txwatch.domain.TransactionType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Untyped key/value details, accepted for any transaction type.
 */
public record GenericMetadata(Map<String, Object> attributes) implements TransactionMetadata {

    public GenericMetadata {
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
                : Map.of();
    }

    @Override
    public boolean supports(TransactionType type) {
        return true;
    }
}

package com.xrplmcp.models;

import java.util.Map;

/**
 * Marker for every ledger model definition.
 * Implementations are immutable records whose components carry {@link ModelField} metadata.
 */
public interface BaseModel {

    /**
     * Fields implied by the model's kind rather than supplied by a caller
     * (for example the transaction type). Prepended to the canonical representation.
     */
    default Map<String, Object> typeFields() {
        return Map.of();
    }
}

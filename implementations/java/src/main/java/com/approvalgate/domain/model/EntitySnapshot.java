package com.approvalgate.domain.model;

import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * A row as read inside an RLS-bound transaction. Column values are normalized
 * to JSON-friendly types (temporal and UUID values as strings).
 */
@Value
public class EntitySnapshot {

    EntityType type;
    UUID id;
    String status;
    Map<String, Object> columns;

    public Object get(String column) {
        return columns.get(column);
    }

    public String describe() {
        return type.describe(columns);
    }
}

package com.ulbaudit.audit.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One row of a data partition, keyed by the entity it belongs to. An entity may
 * own several rows in the same partition (e.g. one row per staff cadre).
 */
public record PartitionRow(String entityId, Map<String, String> cells) {

    public PartitionRow {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId must be provided");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        if (cells != null) {
            cells.forEach((column, value) -> {
                if (column != null && value != null) {
                    copy.put(column, value);
                }
            });
        }
        cells = Collections.unmodifiableMap(copy);
    }

    public boolean hasColumn(String column) {
        return cells.containsKey(column);
    }

    public Optional<String> cell(String column) {
        return Optional.ofNullable(cells.get(column))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}

package com.ulbaudit.audit.model;

import java.util.Optional;

public record AuditEntity(
        String id,
        String name,
        Optional<String> district,
        Optional<Double> population
) {
    public AuditEntity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("entity id must be provided");
        }
        name = name == null ? "" : name.trim();
        district = district == null ? Optional.empty() : district.map(String::trim).filter(value -> !value.isEmpty());
        population = population == null ? Optional.empty() : population;
    }

    public String displayName() {
        return name.isEmpty() ? "ID" + id : name;
    }
}

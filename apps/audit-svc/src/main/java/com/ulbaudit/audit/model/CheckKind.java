package com.ulbaudit.audit.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Per-entity validation checks, evaluated without reference to peers.
 */
public enum CheckKind {
    THRESHOLD("threshold", "percentage"),
    CONSISTENCY("consistency"),
    COMPLETENESS("completeness"),
    CROSS_TABLE("cross_table");

    private final List<String> validationTypes;

    CheckKind(String... validationTypes) {
        this.validationTypes = List.of(validationTypes);
    }

    public String validationType() {
        return validationTypes.get(0);
    }

    public static Optional<CheckKind> fromValidationType(String validationType) {
        if (validationType == null) {
            return Optional.empty();
        }
        String normalized = validationType.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.validationTypes.contains(normalized))
                .findFirst();
    }
}

package com.ulbaudit.audit.model;

import java.util.Locale;

public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static Severity fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MEDIUM;
        }
        try {
            return Severity.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return MEDIUM;
        }
    }

    public String label() {
        String lower = name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}

package io.guildflow.strike;

import java.util.Locale;

public enum Severity {
    MINOR,
    MODERATE,
    SEVERE;

    public static Severity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Severity is required");
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.name().equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + raw);
    }

    public String label() {
        return name().charAt(0) + name().substring(1).toLowerCase(Locale.ROOT);
    }
}

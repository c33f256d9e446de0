package net.lookvault.model;

import java.util.Locale;

public enum GenerationJobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GenerationJobStatus fromDbValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Job status cannot be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

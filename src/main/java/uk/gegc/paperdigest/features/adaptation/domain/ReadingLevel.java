package uk.gegc.paperdigest.features.adaptation.domain;

import java.util.Locale;

public enum ReadingLevel {
    BEGINNER("Beginner"),
    INTERMEDIATE("Intermediate"),
    EXPERT("Expert");

    private final String label;

    ReadingLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a level from its label or constant name, ignoring case. Unknown or blank input maps to
     * {@link #INTERMEDIATE}.
     */
    public static ReadingLevel fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return INTERMEDIATE;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ReadingLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        return INTERMEDIATE;
    }
}

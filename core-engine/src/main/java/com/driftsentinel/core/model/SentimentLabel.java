package com.driftsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * The three classes produced by the sentiment classifier.
 *
 * <p>
 * On the wire labels use their display name ({@code Negative},
 * {@code Neutral}, {@code Positive}); {@link #fromName(String)} accepts any
 * casing of either the display name or the constant name.
 * </p>
 *
 * @since 1.0.0
 */
public enum SentimentLabel {

    NEGATIVE("Negative"),
    NEUTRAL("Neutral"),
    POSITIVE("Positive");

    private final String displayName;

    SentimentLabel(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a label from its display or constant name.
     *
     * @param name label name, may be {@code null}
     * @return the matching label, or empty if {@code name} is null or unknown
     */
    public static Optional<SentimentLabel> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalised = name.trim().toUpperCase(Locale.ROOT);
        for (SentimentLabel label : values()) {
            if (label.name().equals(normalised)) {
                return Optional.of(label);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return displayName;
    }
}

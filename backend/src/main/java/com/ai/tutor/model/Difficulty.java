package com.ai.tutor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Exercise difficulty. Serialized as its lowercase name ("easy", "medium", "hard").
 */
public enum Difficulty {
    EASY("nivel básico, conceptos fundamentales"),
    MEDIUM("nivel intermedio, requiere varios pasos"),
    HARD("nivel avanzado, requiere pensamiento crítico");

    private final String promptDescription;

    Difficulty(String promptDescription) {
        this.promptDescription = promptDescription;
    }

    /** Wording used when asking the generative engine for this level. */
    public String promptDescription() {
        return promptDescription;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value; {@code null} or blank means {@link #MEDIUM}.
     *
     * @throws IllegalArgumentException for an unknown level
     */
    @JsonCreator
    public static Difficulty fromWire(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown difficulty: " + value);
        }
    }
}

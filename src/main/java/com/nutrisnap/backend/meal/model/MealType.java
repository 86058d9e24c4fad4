package com.nutrisnap.backend.meal.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MealType {
    BREAKFAST,
    LUNCH,
    DINNER,
    SNACK;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MealType parse(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("MEAL_TYPE_REQUIRED");
        try {
            return MealType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("MEAL_TYPE_INVALID", e);
        }
    }
}

package com.nutrisnap.backend.recognition.model;

import java.util.Objects;

/**
 * Per-100g reference values for one canonical food key.
 */
public record NutritionProfile(
        String key,
        String displayName,
        double caloriesPer100g,
        double carbsG,
        double proteinG,
        double fatG,
        double giValue,
        GiCategory giCategory,
        PortionClass portionClass
) {
    public NutritionProfile {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(giCategory, "giCategory");
        Objects.requireNonNull(portionClass, "portionClass");
        if (displayName == null || displayName.isBlank()) displayName = key;
        requireNonNegative(caloriesPer100g, "CALORIES_INVALID");
        requireNonNegative(carbsG, "CARBS_INVALID");
        requireNonNegative(proteinG, "PROTEIN_INVALID");
        requireNonNegative(fatG, "FAT_INVALID");
        requireNonNegative(giValue, "GI_VALUE_INVALID");
    }

    private static void requireNonNegative(double v, String code) {
        if (!Double.isFinite(v) || v < 0) throw new IllegalArgumentException(code + ": " + v);
    }
}

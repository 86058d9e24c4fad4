package com.nutrisnap.backend.meal.model;

import com.nutrisnap.backend.recognition.model.NutritionTotals;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record MealRecord(
        String mealId,
        Long userId,
        MealType mealType,
        List<RecognizedFoodItem> foods,
        NutritionTotals totals,
        LocalDate localDate,
        Instant createdAtUtc
) {
}

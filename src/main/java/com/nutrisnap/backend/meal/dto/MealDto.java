package com.nutrisnap.backend.meal.dto;

import com.nutrisnap.backend.meal.model.MealRecord;
import com.nutrisnap.backend.meal.model.MealType;
import com.nutrisnap.backend.recognition.model.NutritionTotals;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One logged meal as the history list shows it.
 */
public record MealDto(
        String mealId,
        MealType mealType,
        LocalDate localDate,
        Instant createdAtUtc,
        List<RecognizedFoodItem> foods,
        NutritionTotals totals
) {
    public static MealDto from(MealRecord m) {
        return new MealDto(m.mealId(), m.mealType(), m.localDate(), m.createdAtUtc(), m.foods(), m.totals());
    }
}

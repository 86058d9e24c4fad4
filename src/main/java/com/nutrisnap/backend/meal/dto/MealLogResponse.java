package com.nutrisnap.backend.meal.dto;

import com.nutrisnap.backend.meal.model.MealType;
import com.nutrisnap.backend.recognition.model.NutritionTotals;

import java.time.LocalDate;

public record MealLogResponse(
        String mealId,
        MealType mealType,
        LocalDate localDate,
        int foodCount,
        NutritionTotals totals,
        DailySummaryDto dailySummary
) {
}

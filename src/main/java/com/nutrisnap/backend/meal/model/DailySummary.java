package com.nutrisnap.backend.meal.model;

import com.nutrisnap.backend.recognition.model.NutritionTotals;

import java.time.LocalDate;

public record DailySummary(Long userId, LocalDate date, NutritionTotals totals, int mealCount) {

    public static DailySummary empty(Long userId, LocalDate date) {
        return new DailySummary(userId, date, NutritionTotals.ZERO, 0);
    }

    public DailySummary add(NutritionTotals meal) {
        return new DailySummary(userId, date, totals.plus(meal), mealCount + 1);
    }
}

package com.nutrisnap.backend.meal.dto;

import com.nutrisnap.backend.meal.model.DailySummary;

import java.time.LocalDate;

public record DailySummaryDto(
        LocalDate date,
        int totalCalories,
        double totalProtein,
        double totalCarbs,
        double totalFat,
        int mealCount
) {
    public static DailySummaryDto from(DailySummary s) {
        return new DailySummaryDto(
                s.date(),
                s.totals().calories(),
                s.totals().protein(),
                s.totals().carbs(),
                s.totals().fat(),
                s.mealCount()
        );
    }
}

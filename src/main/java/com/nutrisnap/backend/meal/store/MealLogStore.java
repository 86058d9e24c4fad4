package com.nutrisnap.backend.meal.store;

import com.nutrisnap.backend.meal.model.DailySummary;
import com.nutrisnap.backend.meal.model.MealRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Persistence seam for logged meals. Implementations must add the meal and bump
 * the user's daily summary as one step.
 */
public interface MealLogStore {

    /** @return the daily summary after this meal was added */
    DailySummary save(MealRecord meal);

    DailySummary dailySummary(Long userId, LocalDate date);

    /** @return meals of that local day, newest first */
    List<MealRecord> meals(Long userId, LocalDate date);
}

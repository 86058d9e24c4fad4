package com.nutrisnap.backend.meal.service;

import com.nutrisnap.backend.meal.dto.DailySummaryDto;
import com.nutrisnap.backend.meal.dto.LogMealRequest;
import com.nutrisnap.backend.meal.dto.MealDto;
import com.nutrisnap.backend.meal.dto.MealListResponse;
import com.nutrisnap.backend.meal.dto.MealLogResponse;
import com.nutrisnap.backend.meal.model.DailySummary;
import com.nutrisnap.backend.meal.model.MealRecord;
import com.nutrisnap.backend.meal.model.MealType;
import com.nutrisnap.backend.meal.store.MealLogStore;
import com.nutrisnap.backend.recognition.model.NutritionTotals;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class MealLogService {

    private final MealLogStore store;
    private final Clock clock;

    public MealLogResponse logMeal(Long userId, ZoneId zoneId, LogMealRequest req) {
        MealType mealType = MealType.parse(req == null ? null : req.mealType());
        List<RecognizedFoodItem> foods = requireFoods(req.foods());

        NutritionTotals totals = NutritionTotals.of(foods);
        Instant now = clock.instant();
        LocalDate localDate = LocalDate.ofInstant(now, zoneId);

        MealRecord meal = new MealRecord(
                UUID.randomUUID().toString(),
                userId,
                mealType,
                foods,
                totals,
                localDate,
                now
        );
        DailySummary day = store.save(meal);

        log.info("meal_logged userId={} mealId={} mealType={} foods={} kcal={} dayKcal={}",
                userId, meal.mealId(), mealType.wireName(), foods.size(), totals.calories(),
                day.totals().calories());

        return new MealLogResponse(
                meal.mealId(),
                mealType,
                localDate,
                foods.size(),
                totals,
                DailySummaryDto.from(day)
        );
    }

    public DailySummaryDto dailySummary(Long userId, ZoneId zoneId, LocalDate date) {
        LocalDate d = date != null ? date : LocalDate.ofInstant(clock.instant(), zoneId);
        return DailySummaryDto.from(store.dailySummary(userId, d));
    }

    public MealListResponse meals(Long userId, ZoneId zoneId, LocalDate date) {
        LocalDate d = date != null ? date : LocalDate.ofInstant(clock.instant(), zoneId);
        List<MealDto> meals = store.meals(userId, d).stream().map(MealDto::from).toList();
        return new MealListResponse(d, meals);
    }

    private static List<RecognizedFoodItem> requireFoods(List<RecognizedFoodItem> foods) {
        if (foods == null || foods.isEmpty()) throw new IllegalArgumentException("FOODS_REQUIRED");
        if (foods.size() > LogMealRequest.MAX_FOODS) throw new IllegalArgumentException("FOOD_ITEM_INVALID");
        for (RecognizedFoodItem f : foods) {
            if (f == null
                || f.name() == null || f.name().isBlank()
                || f.calories() < 0
                || !nonNegative(f.protein()) || !nonNegative(f.carbs()) || !nonNegative(f.fat())) {
                throw new IllegalArgumentException("FOOD_ITEM_INVALID");
            }
        }
        return List.copyOf(foods);
    }

    private static boolean nonNegative(double v) {
        return Double.isFinite(v) && v >= 0.0;
    }
}

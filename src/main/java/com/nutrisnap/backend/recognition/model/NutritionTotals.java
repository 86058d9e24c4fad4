package com.nutrisnap.backend.recognition.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Sum of a set of food items. Calories stay integer, macros are rounded to 1 decimal.
 */
public record NutritionTotals(int calories, double protein, double carbs, double fat) {

    public static final NutritionTotals ZERO = new NutritionTotals(0, 0, 0, 0);

    public static NutritionTotals of(List<RecognizedFoodItem> items) {
        if (items == null || items.isEmpty()) return ZERO;

        int kcal = 0;
        BigDecimal p = BigDecimal.ZERO;
        BigDecimal c = BigDecimal.ZERO;
        BigDecimal f = BigDecimal.ZERO;
        for (RecognizedFoodItem it : items) {
            kcal += it.calories();
            p = p.add(BigDecimal.valueOf(it.protein()));
            c = c.add(BigDecimal.valueOf(it.carbs()));
            f = f.add(BigDecimal.valueOf(it.fat()));
        }
        return new NutritionTotals(kcal, round1(p), round1(c), round1(f));
    }

    public NutritionTotals plus(NutritionTotals o) {
        return new NutritionTotals(
                calories + o.calories,
                round1(BigDecimal.valueOf(protein).add(BigDecimal.valueOf(o.protein))),
                round1(BigDecimal.valueOf(carbs).add(BigDecimal.valueOf(o.carbs))),
                round1(BigDecimal.valueOf(fat).add(BigDecimal.valueOf(o.fat)))
        );
    }

    private static double round1(BigDecimal v) {
        return v.setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}

package com.nutrisnap.backend.recognition.service;

import com.nutrisnap.backend.recognition.model.NutritionTotals;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;

import java.util.List;

public record FoodRecognitionResult(
        boolean success,
        List<RecognizedFoodItem> foods,
        NutritionTotals totals,
        String error,
        long processingTimeMs
) {
    public static FoodRecognitionResult ok(List<RecognizedFoodItem> foods, long processingTimeMs) {
        return new FoodRecognitionResult(true, List.copyOf(foods), NutritionTotals.of(foods), null, processingTimeMs);
    }

    public static FoodRecognitionResult failed(String error, long processingTimeMs) {
        return new FoodRecognitionResult(false, List.of(), null, error, processingTimeMs);
    }
}

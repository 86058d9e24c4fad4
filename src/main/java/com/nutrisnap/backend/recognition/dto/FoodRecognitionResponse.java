package com.nutrisnap.backend.recognition.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nutrisnap.backend.recognition.model.NutritionTotals;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import com.nutrisnap.backend.recognition.service.FoodRecognitionResult;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FoodRecognitionResponse(
        boolean success,
        @JsonInclude(JsonInclude.Include.ALWAYS) List<RecognizedFoodItem> foods,
        NutritionTotals totals,
        String error,
        @JsonProperty("processing_time_ms") Long processingTimeMs
) {
    public static FoodRecognitionResponse from(FoodRecognitionResult r) {
        return new FoodRecognitionResponse(
                r.success(),
                r.foods() == null ? List.of() : r.foods(),
                r.totals(),
                r.error(),
                r.processingTimeMs()
        );
    }
}

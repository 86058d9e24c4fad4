package com.nutrisnap.backend.recognition.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * One nutrition-annotated food in a recognition response.
 * giValue / giCategory 只有查到 reference 的食物才有
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecognizedFoodItem(
        String id,
        @NotBlank String name,
        @JsonProperty("portion_size") String portionSize,
        @JsonProperty("portion_grams") double portionGrams,
        @PositiveOrZero int calories,
        @PositiveOrZero double protein,
        @PositiveOrZero double carbs,
        @PositiveOrZero double fat,
        double confidence,
        @JsonProperty("gi_value") Double giValue,
        @JsonProperty("gi_category") GiCategory giCategory
) {
    public RecognizedFoodItem withId(String newId) {
        return new RecognizedFoodItem(newId, name, portionSize, portionGrams, calories,
                protein, carbs, fat, confidence, giValue, giCategory);
    }
}

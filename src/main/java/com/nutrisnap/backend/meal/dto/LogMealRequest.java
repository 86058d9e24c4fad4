package com.nutrisnap.backend.meal.dto;

import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * @param mealType breakfast / lunch / dinner / snack
 * @param foods    finalized items (usually the recognition result after the user edits it)
 */
public record LogMealRequest(
        @NotBlank String mealType,
        @NotEmpty @Size(max = LogMealRequest.MAX_FOODS) List<@Valid RecognizedFoodItem> foods
) {
    public static final int MAX_FOODS = 50;
}

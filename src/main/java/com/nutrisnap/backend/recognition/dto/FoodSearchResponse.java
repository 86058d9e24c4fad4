package com.nutrisnap.backend.recognition.dto;

import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;

import java.util.List;

public record FoodSearchResponse(String query, List<RecognizedFoodItem> foods) {
}

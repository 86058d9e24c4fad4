package com.nutrisnap.backend.meal.dto;

import java.time.LocalDate;
import java.util.List;

public record MealListResponse(LocalDate date, List<MealDto> meals) {
}

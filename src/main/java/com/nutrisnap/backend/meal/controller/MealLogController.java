package com.nutrisnap.backend.meal.controller;

import com.nutrisnap.backend.auth.security.AuthContext;
import com.nutrisnap.backend.meal.dto.DailySummaryDto;
import com.nutrisnap.backend.meal.dto.LogMealRequest;
import com.nutrisnap.backend.meal.dto.MealListResponse;
import com.nutrisnap.backend.meal.dto.MealLogResponse;
import com.nutrisnap.backend.meal.service.MealLogService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

@Tag(name = "Meals", description = "Log a finalized meal, list a day's meals and read the daily running total")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/meals")
public class MealLogController {

    private final AuthContext auth;
    private final MealLogService service;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public MealLogResponse log(
            @RequestHeader(value = "X-Client-Timezone", required = false) String clientTz,
            @Valid @RequestBody(required = false) LogMealRequest body
    ) {
        Long uid = auth.requireUserId();
        return service.logMeal(uid, zoneOrUtc(clientTz), body);
    }

    /**
     * 某一天（client 時區）的餐點，新的在前
     */
    @GetMapping
    public MealListResponse meals(
            @RequestHeader(value = "X-Client-Timezone", required = false) String clientTz,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        Long uid = auth.requireUserId();
        return service.meals(uid, zoneOrUtc(clientTz), date);
    }

    @GetMapping("/daily-summary")
    public DailySummaryDto dailySummary(
            @RequestHeader(value = "X-Client-Timezone", required = false) String clientTz,
            @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        Long uid = auth.requireUserId();
        return service.dailySummary(uid, zoneOrUtc(clientTz), date);
    }

    private static ZoneId zoneOrUtc(String tz) {
        if (tz == null || tz.isBlank()) return ZoneOffset.UTC;
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("TIMEZONE_INVALID", e);
        }
    }
}

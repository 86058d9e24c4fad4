package com.nutrisnap.backend.recognition.provider;

import com.nutrisnap.backend.recognition.model.Detection;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Used when app.detector.enabled=false (local dev without the Python service).
 */
@Slf4j
public class FallbackFoodDetector implements FoodDetector {

    private final List<Detection> fallback;

    public FallbackFoodDetector(List<Detection> fallback) {
        this.fallback = List.copyOf(fallback);
    }

    @Override
    public List<Detection> detect(String imageBase64) {
        log.debug("detector disabled, returning fallback detections size={}", fallback.size());
        return fallback;
    }
}

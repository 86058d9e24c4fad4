package com.nutrisnap.backend.recognition.provider.config;

import com.nutrisnap.backend.recognition.model.Detection;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * app.detector.*
 *
 * @param enabled        false → never call out, always use {@code fallback}
 * @param baseUrl        detection service root, e.g. http://localhost:8000
 * @param detectPath     POST path on the service
 * @param connectTimeout TCP connect bound
 * @param readTimeout    response bound; a hung detector cannot stall the request past this
 * @param fallback       detections used whenever the detector cannot answer
 */
@ConfigurationProperties(prefix = "app.detector")
public record DetectorProperties(
        Boolean enabled,
        String baseUrl,
        String detectPath,
        Duration connectTimeout,
        Duration readTimeout,
        List<FallbackDetection> fallback
) {
    public record FallbackDetection(String foodName, double confidence, double areaRatio) {}

    private static final List<Detection> DEFAULT_FALLBACK = List.of(
            new Detection("Idli", 0.92, 0.15),
            new Detection("Sambar", 0.87, 0.35),
            new Detection("Chapathi", 0.78, 0.20)
    );

    public boolean enabledOrDefault() {
        return enabled == null || enabled;
    }

    public String baseUrlOrDefault() {
        return (baseUrl == null || baseUrl.isBlank()) ? "http://localhost:8000" : baseUrl.trim();
    }

    public String detectPathOrDefault() {
        return (detectPath == null || detectPath.isBlank()) ? "/detect" : detectPath.trim();
    }

    public Duration connectTimeoutOrDefault() {
        return connectTimeout != null ? connectTimeout : Duration.ofSeconds(3);
    }

    public Duration readTimeoutOrDefault() {
        return readTimeout != null ? readTimeout : Duration.ofSeconds(10);
    }

    /** 設定沒給就用內建三筆（Idli / Sambar / Chapathi） */
    public List<Detection> fallbackOrDefault() {
        if (fallback == null || fallback.isEmpty()) return DEFAULT_FALLBACK;
        return fallback.stream()
                .map(f -> new Detection(f.foodName(), f.confidence(), f.areaRatio()))
                .toList();
    }
}

package com.nutrisnap.backend.recognition.service;

import com.nutrisnap.backend.recognition.detection.DetectionNormalizer;
import com.nutrisnap.backend.recognition.estimate.NutritionEstimator;
import com.nutrisnap.backend.recognition.model.Detection;
import com.nutrisnap.backend.recognition.model.DetectionGroup;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import com.nutrisnap.backend.recognition.provider.FoodDetector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * image → detections → groups → items.
 * <p>
 * No nutrition math here. Every exception is turned into {@code success=false};
 * nothing escapes {@link #recognize(String)}.
 */
@Slf4j
@Service
public class FoodRecognitionService {

    static final String GENERIC_ERROR = "Failed to analyze image";

    private final FoodDetector detector;
    private final DetectionNormalizer normalizer;
    private final NutritionEstimator estimator;
    private final Clock clock;

    public FoodRecognitionService(FoodDetector detector,
                                  DetectionNormalizer normalizer,
                                  NutritionEstimator estimator,
                                  Clock clock) {
        this.detector = detector;
        this.normalizer = normalizer;
        this.estimator = estimator;
        this.clock = clock;
    }

    public FoodRecognitionResult recognize(String imageBase64) {
        long t0 = System.nanoTime();
        try {
            List<Detection> detections = detector.detect(imageBase64);
            List<DetectionGroup> groups = normalizer.normalize(detections);

            // id：food_{epochMillis}_{index}，同一次呼叫內不會重複
            long stamp = clock.millis();
            List<RecognizedFoodItem> foods = new ArrayList<>(groups.size());
            for (int i = 0; i < groups.size(); i++) {
                RecognizedFoodItem item = estimator.estimate(groups.get(i));
                foods.add(item.withId("food_" + stamp + "_" + i));
            }

            long ms = msSince(t0);
            log.info("food_recognition status=OK detections={} groups={} latencyMs={}",
                    detections == null ? 0 : detections.size(), groups.size(), ms);
            return FoodRecognitionResult.ok(foods, ms);
        } catch (Exception e) {
            log.error("food_recognition status=FAILED latencyMs={}", msSince(t0), e);
            return FoodRecognitionResult.failed(GENERIC_ERROR, msSince(t0));
        }
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}

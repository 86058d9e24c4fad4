package com.nutrisnap.backend.recognition.detection;

import com.nutrisnap.backend.recognition.model.Detection;
import com.nutrisnap.backend.recognition.model.DetectionGroup;
import com.nutrisnap.backend.recognition.reference.FoodKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges repeated detections of the same food into one {@link DetectionGroup}.
 * <p>
 * Groups come out in first-occurrence order. count / mean confidence / max area
 * do not depend on the order inside a group (confidence is summed in BigDecimal,
 * so shuffled input gives bit-identical averages).
 */
@Slf4j
@Component
public class DetectionNormalizer {

    public List<DetectionGroup> normalize(List<Detection> detections) {
        if (detections == null || detections.isEmpty()) return List.of();

        Map<String, Acc> grouped = new LinkedHashMap<>();
        int dropped = 0;
        for (Detection d : detections) {
            String key = d == null ? "" : FoodKeys.normalize(d.foodLabel());
            if (key.isEmpty()) {
                dropped++;
                continue;
            }
            grouped.computeIfAbsent(key, k -> new Acc(d.foodLabel().trim()))
                    .add(unit(d.confidence()), unit(d.areaRatio()));
        }
        if (dropped > 0) log.debug("detection_normalize droppedBlankLabels={}", dropped);

        List<DetectionGroup> out = new ArrayList<>(grouped.size());
        grouped.forEach((key, acc) -> out.add(acc.toGroup(key)));
        return List.copyOf(out);
    }

    /** clamp into [0,1]，NaN 當 0 */
    private static double unit(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    private static final class Acc {
        private final String label;
        private int count;
        private BigDecimal confidenceSum = BigDecimal.ZERO;
        private double maxArea;

        private Acc(String label) {
            this.label = label;
        }

        private void add(double confidence, double area) {
            count++;
            confidenceSum = confidenceSum.add(BigDecimal.valueOf(confidence));
            if (count == 1 || area > maxArea) maxArea = area;
        }

        private DetectionGroup toGroup(String key) {
            double avg = confidenceSum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64).doubleValue();
            return new DetectionGroup(key, label, count, avg, maxArea);
        }
    }
}

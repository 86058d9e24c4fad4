package com.nutrisnap.backend.recognition.model;

/**
 * All detections of one normalized food key within a single image.
 * label 保留第一次出現的原始字串，給 unknown food 顯示用
 */
public record DetectionGroup(
        String foodKey,
        String label,
        int count,
        double avgConfidence,
        double maxAreaRatio
) {
    public DetectionGroup {
        if (count < 1) throw new IllegalArgumentException("GROUP_COUNT_INVALID");
    }
}

package com.nutrisnap.backend.recognition.model;

/**
 * One raw region reported by the external food detector.
 *
 * @param foodLabel  free-text label as the detector emits it (e.g. "Idli")
 * @param confidence detector score in [0,1]
 * @param areaRatio  fraction of the image covered by the region, in [0,1]
 */
public record Detection(String foodLabel, double confidence, double areaRatio) {
}

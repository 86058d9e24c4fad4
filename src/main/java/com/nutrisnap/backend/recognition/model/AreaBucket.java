package com.nutrisnap.backend.recognition.model;

/**
 * Discretized image-area buckets for {@link PortionClass.AreaBased} foods.
 * Lower bound inclusive, next bucket's lower bound exclusive.
 */
public enum AreaBucket {
    SMALL("Small", 0.0, 75),
    MEDIUM("Medium", 0.10, 100),
    LARGE("Large", 0.25, 150),
    VERY_LARGE("Very Large", 0.50, 200);

    private final String label;
    private final double lowerBound;
    private final double grams;

    AreaBucket(String label, double lowerBound, double grams) {
        this.label = label;
        this.lowerBound = lowerBound;
        this.grams = grams;
    }

    public String label() { return label; }

    public double lowerBound() { return lowerBound; }

    public double grams() { return grams; }

    public static AreaBucket of(double areaRatio) {
        if (areaRatio < MEDIUM.lowerBound) return SMALL;
        if (areaRatio < LARGE.lowerBound) return MEDIUM;
        if (areaRatio < VERY_LARGE.lowerBound) return LARGE;
        return VERY_LARGE;
    }
}

package com.nutrisnap.backend.recognition.model;

/**
 * How a food's serving weight is estimated.
 * Every reference entry carries exactly one of the two variants.
 */
public interface PortionClass {

    /** Discrete food with a fixed average weight per piece (one idli ≈ 40 g). */
    record Countable(double unitWeightGrams) implements PortionClass {
        public Countable {
            if (!(unitWeightGrams > 0)) throw new IllegalArgumentException("UNIT_WEIGHT_INVALID");
        }
    }

    /** Bulk food whose weight comes from the image-area bucket. */
    record AreaBased() implements PortionClass {
    }

    AreaBased AREA_BASED = new AreaBased();

    static PortionClass countable(double unitWeightGrams) {
        return new Countable(unitWeightGrams);
    }
}

package com.nutrisnap.backend.recognition.portion;

import com.nutrisnap.backend.recognition.model.AreaBucket;
import com.nutrisnap.backend.recognition.model.PortionClass;
import com.nutrisnap.backend.recognition.model.PortionEstimate;
import org.springframework.stereotype.Component;

/**
 * Serving weight rules.
 * - Countable: count × unit weight, "{count} pieces"
 * - AreaBased: bucket weight from area ratio, "{bucket} portion"
 */
@Component
public class PortionModel {

    public PortionEstimate estimateGrams(String foodKey, PortionClass portionClass, int count, double areaRatio) {
        if (portionClass == null) throw new IllegalArgumentException("PORTION_CLASS_REQUIRED: " + foodKey);

        if (portionClass instanceof PortionClass.Countable c) {
            return pieces(c, count);
        }
        return ofBucket(areaBucket(areaRatio));
    }

    /**
     * Manual entry：沒有照片可以量面積，直接指定 bucket。
     * Countable 一律 1 piece。
     */
    public PortionEstimate standardServing(String foodKey, PortionClass portionClass, AreaBucket bucket) {
        if (portionClass == null) throw new IllegalArgumentException("PORTION_CLASS_REQUIRED: " + foodKey);

        if (portionClass instanceof PortionClass.Countable c) {
            return pieces(c, 1);
        }
        if (bucket == null) throw new IllegalArgumentException("AREA_BUCKET_REQUIRED: " + foodKey);
        return ofBucket(bucket);
    }

    public AreaBucket areaBucket(double areaRatio) {
        return AreaBucket.of(areaRatio);
    }

    private static PortionEstimate pieces(PortionClass.Countable c, int count) {
        if (count < 1) throw new IllegalArgumentException("COUNT_INVALID: " + count);
        return new PortionEstimate(count * c.unitWeightGrams(), count + " pieces");
    }

    private static PortionEstimate ofBucket(AreaBucket bucket) {
        return new PortionEstimate(bucket.grams(), bucket.label() + " portion");
    }
}

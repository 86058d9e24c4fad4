package com.nutrisnap.backend.recognition.estimate;

import com.nutrisnap.backend.recognition.model.AreaBucket;
import com.nutrisnap.backend.recognition.model.DetectionGroup;
import com.nutrisnap.backend.recognition.model.NutritionProfile;
import com.nutrisnap.backend.recognition.model.PortionEstimate;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import com.nutrisnap.backend.recognition.portion.PortionModel;
import com.nutrisnap.backend.recognition.reference.NutritionReferenceTable;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Turns one {@link DetectionGroup} into one {@link RecognizedFoodItem} (id left null,
 * the orchestrator assigns it).
 */
@Slf4j
public class NutritionEstimator {

    // unknown food：固定預設值，任何 key 都一樣
    static final String UNKNOWN_PORTION_SIZE = "1 portion";
    static final double UNKNOWN_PORTION_GRAMS = 100;
    static final int UNKNOWN_CALORIES = 200;
    static final double UNKNOWN_PROTEIN = 10;
    static final double UNKNOWN_CARBS = 30;
    static final double UNKNOWN_FAT = 5;
    static final double UNKNOWN_CONFIDENCE = 0.5;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final NutritionReferenceTable table;
    private final PortionModel portionModel;

    public NutritionEstimator(NutritionReferenceTable table, PortionModel portionModel) {
        this.table = table;
        this.portionModel = portionModel;
    }

    public RecognizedFoodItem estimate(DetectionGroup group) {
        Optional<NutritionProfile> found = table.lookup(group.foodKey());
        if (found.isEmpty()) {
            log.debug("nutrition_estimate unknownFood key={} count={}", group.foodKey(), group.count());
            return unknownFood(group.label());
        }

        NutritionProfile p = found.get();
        PortionEstimate portion = portionModel.estimateGrams(
                p.key(), p.portionClass(), group.count(), group.maxAreaRatio());
        return toItem(p, portion, group.avgConfidence());
    }

    /**
     * Standard serving of a reference food, used by manual search.
     * Countable → 1 piece, AreaBased → {@code bucket}.
     */
    public RecognizedFoodItem serving(NutritionProfile p, AreaBucket bucket, double confidence) {
        PortionEstimate portion = portionModel.standardServing(p.key(), p.portionClass(), bucket);
        return toItem(p, portion, confidence);
    }

    private static RecognizedFoodItem toItem(NutritionProfile p, PortionEstimate portion, double confidence) {
        return new RecognizedFoodItem(
                null,
                p.displayName(),
                portion.description(),
                portion.grams(),
                scaleToInt(p.caloriesPer100g(), portion.grams()),
                scaleTo1dp(p.proteinG(), portion.grams()),
                scaleTo1dp(p.carbsG(), portion.grams()),
                scaleTo1dp(p.fatG(), portion.grams()),
                confidence,
                p.giValue(),
                p.giCategory()
        );
    }

    public static RecognizedFoodItem unknownFood(String label) {
        return new RecognizedFoodItem(
                null,
                label,
                UNKNOWN_PORTION_SIZE,
                UNKNOWN_PORTION_GRAMS,
                UNKNOWN_CALORIES,
                UNKNOWN_PROTEIN,
                UNKNOWN_CARBS,
                UNKNOWN_FAT,
                UNKNOWN_CONFIDENCE,
                null,
                null
        );
    }

    private static int scaleToInt(double per100g, double grams) {
        return scaled(per100g, grams).setScale(0, RoundingMode.HALF_UP).intValueExact();
    }

    private static double scaleTo1dp(double per100g, double grams) {
        return scaled(per100g, grams).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private static BigDecimal scaled(double per100g, double grams) {
        return BigDecimal.valueOf(per100g)
                .multiply(BigDecimal.valueOf(grams))
                .divide(HUNDRED);
    }
}

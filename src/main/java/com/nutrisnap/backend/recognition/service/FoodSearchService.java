package com.nutrisnap.backend.recognition.service;

import com.nutrisnap.backend.recognition.estimate.NutritionEstimator;
import com.nutrisnap.backend.recognition.model.AreaBucket;
import com.nutrisnap.backend.recognition.model.NutritionProfile;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import com.nutrisnap.backend.recognition.reference.NutritionReferenceTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Manual add: substring search over the reference table, standard serving per hit.
 * This is the only place that matches loosely; pipeline lookups stay exact.
 */
@Service
@RequiredArgsConstructor
public class FoodSearchService {

    static final int MAX_RESULTS = 20;
    private static final double MANUAL_CONFIDENCE = 1.0;
    static final AreaBucket MANUAL_BUCKET = AreaBucket.MEDIUM;

    private final NutritionReferenceTable table;
    private final NutritionEstimator estimator;

    public List<RecognizedFoodItem> search(String query) {
        if (query == null || query.isBlank()) return List.of();
        String q = query.trim().toLowerCase(Locale.ROOT);

        List<RecognizedFoodItem> out = new ArrayList<>();
        for (NutritionProfile p : table.all()) {
            if (out.size() >= MAX_RESULTS) break;
            if (matches(p, q)) {
                RecognizedFoodItem item = estimator.serving(p, MANUAL_BUCKET, MANUAL_CONFIDENCE);
                out.add(item.withId(UUID.randomUUID().toString()));
            }
        }
        return out;
    }

    private static boolean matches(NutritionProfile p, String q) {
        return p.displayName().toLowerCase(Locale.ROOT).contains(q)
               || p.key().contains(q.replace(' ', '_'));
    }
}

package com.nutrisnap.backend.recognition.reference;

import com.nutrisnap.backend.recognition.model.NutritionProfile;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable per-100g reference data, keyed by {@link FoodKeys#normalize(String)}.
 * <p>
 * Lookup is exact-match only. An absent key is a normal outcome (unknown food),
 * callers decide what to do with it.
 */
public final class NutritionReferenceTable {

    private final Map<String, NutritionProfile> byKey;

    private NutritionReferenceTable(Map<String, NutritionProfile> byKey) {
        this.byKey = byKey;
    }

    public static NutritionReferenceTable of(List<NutritionProfile> profiles) {
        Map<String, NutritionProfile> m = new LinkedHashMap<>();
        for (NutritionProfile p : profiles) {
            String key = FoodKeys.normalize(p.key());
            if (key.isEmpty()) throw new IllegalArgumentException("REFERENCE_KEY_BLANK");
            if (!key.equals(p.key())) {
                throw new IllegalArgumentException("REFERENCE_KEY_NOT_NORMALIZED: " + p.key());
            }
            if (m.putIfAbsent(key, p) != null) {
                throw new IllegalArgumentException("REFERENCE_KEY_DUPLICATED: " + key);
            }
        }
        return new NutritionReferenceTable(Collections.unmodifiableMap(m));
    }

    public Optional<NutritionProfile> lookup(String key) {
        if (key == null) return Optional.empty();
        return Optional.ofNullable(byKey.get(key));
    }

    public Collection<NutritionProfile> all() {
        return byKey.values();
    }

    public int size() {
        return byKey.size();
    }
}

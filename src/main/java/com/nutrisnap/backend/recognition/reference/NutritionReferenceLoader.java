package com.nutrisnap.backend.recognition.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrisnap.backend.recognition.model.GiCategory;
import com.nutrisnap.backend.recognition.model.NutritionProfile;
import com.nutrisnap.backend.recognition.model.PortionClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the reference table JSON:
 * <pre>
 * {"foods":[{"key":"idli","name":"Idli","calories_per_100g":58,"carbs_g":12,
 *            "protein_g":2,"fat_g":0.4,"gi_value":60,"gi_category":"Medium",
 *            "unit_weight_g":40}, ...]}
 * </pre>
 * unit_weight_g 有值 → Countable，沒有 → AreaBased
 */
@Slf4j
public class NutritionReferenceLoader {

    private final ObjectMapper om;

    public NutritionReferenceLoader(ObjectMapper om) {
        this.om = om;
    }

    public NutritionReferenceTable load(Resource resource) {
        if (resource == null || !resource.exists()) {
            throw new IllegalStateException("REFERENCE_TABLE_NOT_FOUND: " + describe(resource));
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = om.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("REFERENCE_TABLE_UNREADABLE: " + describe(resource), e);
        }

        JsonNode foods = root == null ? null : root.get("foods");
        if (foods == null || !foods.isArray()) {
            throw new IllegalStateException("REFERENCE_TABLE_FOODS_MISSING: " + describe(resource));
        }

        List<NutritionProfile> out = new ArrayList<>(foods.size());
        for (JsonNode f : foods) {
            out.add(toProfile(f));
        }

        NutritionReferenceTable table = NutritionReferenceTable.of(out);
        long countable = table.all().stream()
                .filter(p -> p.portionClass() instanceof PortionClass.Countable)
                .count();
        log.info("nutrition_reference loaded source={} foods={} countable={}",
                describe(resource), table.size(), countable);
        return table;
    }

    private static NutritionProfile toProfile(JsonNode f) {
        String key = requireText(f, "key");
        JsonNode unit = f.get("unit_weight_g");
        PortionClass portionClass = (unit != null && unit.isNumber())
                ? PortionClass.countable(unit.asDouble())
                : PortionClass.AREA_BASED;

        return new NutritionProfile(
                key,
                f.path("name").asText(null),
                requireNumber(f, "calories_per_100g", key),
                requireNumber(f, "carbs_g", key),
                requireNumber(f, "protein_g", key),
                requireNumber(f, "fat_g", key),
                requireNumber(f, "gi_value", key),
                GiCategory.fromLabel(requireText(f, "gi_category")),
                portionClass
        );
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isBlank()) {
            throw new IllegalStateException("REFERENCE_FIELD_MISSING: " + field);
        }
        return v.asText().trim();
    }

    private static double requireNumber(JsonNode node, String field, String key) {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) {
            throw new IllegalStateException("REFERENCE_FIELD_MISSING: " + key + "." + field);
        }
        return v.asDouble();
    }

    private static String describe(Resource r) {
        return r == null ? "null" : r.getDescription();
    }
}

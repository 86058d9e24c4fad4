package com.nutrisnap.backend.recognition.reference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrisnap.backend.recognition.model.GiCategory;
import com.nutrisnap.backend.recognition.model.NutritionProfile;
import com.nutrisnap.backend.recognition.model.PortionClass;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NutritionReferenceLoaderTest {

    private final NutritionReferenceLoader loader = new NutritionReferenceLoader(new ObjectMapper());

    @Test
    void bundled_table_has_30_foods_and_9_countable() {
        NutritionReferenceTable table = loader.load(new ClassPathResource("nutrition/reference-table.json"));

        assertThat(table.size()).isEqualTo(30);
        long countable = table.all().stream()
                .filter(p -> p.portionClass() instanceof PortionClass.Countable)
                .count();
        assertThat(countable).isEqualTo(9);
    }

    @Test
    void dal_matches_reference_values_and_is_area_based() {
        NutritionReferenceTable table = loader.load(new ClassPathResource("nutrition/reference-table.json"));

        NutritionProfile dal = table.lookup("dal").orElseThrow();
        assertThat(dal.caloriesPer100g()).isEqualTo(116);
        assertThat(dal.proteinG()).isEqualTo(9);
        assertThat(dal.carbsG()).isEqualTo(20);
        assertThat(dal.fatG()).isEqualTo(1);
        assertThat(dal.giCategory()).isEqualTo(GiCategory.LOW);
        assertThat(dal.portionClass()).isEqualTo(PortionClass.AREA_BASED);
    }

    @Test
    void idli_carries_unit_weight_40() {
        NutritionReferenceTable table = loader.load(new ClassPathResource("nutrition/reference-table.json"));

        assertThat(table.lookup("idli").orElseThrow().portionClass())
                .isEqualTo(new PortionClass.Countable(40));
    }

    @Test
    void lookup_is_exact_match_only() {
        NutritionReferenceTable table = loader.load(new ClassPathResource("nutrition/reference-table.json"));

        assertThat(table.lookup("cooked_rice")).isPresent();
        assertThat(table.lookup("rice")).isEmpty();
        assertThat(table.lookup("Cooked Rice")).isEmpty();
        assertThat(table.lookup("pho")).isEmpty();
        assertThat(table.lookup(null)).isEmpty();
    }

    @Test
    void missing_resource_fails_fast() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("nutrition/nope.json")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("REFERENCE_TABLE_NOT_FOUND");
    }

    @Test
    void entry_without_calories_fails_fast() {
        assertThatThrownBy(() -> loader.load(new ClassPathResource("nutrition/broken-reference.json")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("calories_per_100g");
    }

    @Test
    void duplicated_key_is_rejected() {
        String json = """
        {"foods":[
          {"key":"dal","calories_per_100g":116,"carbs_g":20,"protein_g":9,"fat_g":1,"gi_value":30,"gi_category":"Low"},
          {"key":"dal","calories_per_100g":100,"carbs_g":20,"protein_g":9,"fat_g":1,"gi_value":30,"gi_category":"Low"}
        ]}
        """;
        var res = new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> loader.load(res))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("REFERENCE_KEY_DUPLICATED");
    }

    @Test
    void table_can_be_built_from_profiles_directly() {
        var table = NutritionReferenceTable.of(List.of(
                new NutritionProfile("pho", "Pho", 50, 6, 3, 1, 40, GiCategory.LOW, PortionClass.AREA_BASED)
        ));

        assertThat(table.lookup("pho")).isPresent();
        assertThat(table.lookup("pho").get().displayName()).isEqualTo("Pho");
    }
}

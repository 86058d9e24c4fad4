package com.nutrisnap.backend.recognition.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrisnap.backend.recognition.detection.DetectionNormalizer;
import com.nutrisnap.backend.recognition.estimate.NutritionEstimator;
import com.nutrisnap.backend.recognition.model.Detection;
import com.nutrisnap.backend.recognition.model.NutritionTotals;
import com.nutrisnap.backend.recognition.model.RecognizedFoodItem;
import com.nutrisnap.backend.recognition.portion.PortionModel;
import com.nutrisnap.backend.recognition.provider.FallbackFoodDetector;
import com.nutrisnap.backend.recognition.provider.FoodDetector;
import com.nutrisnap.backend.recognition.reference.NutritionReferenceLoader;
import com.nutrisnap.backend.recognition.reference.NutritionReferenceTable;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class FoodRecognitionServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:30:00Z");

    private final NutritionReferenceTable table =
            new NutritionReferenceLoader(new ObjectMapper()).load(new ClassPathResource("nutrition/reference-table.json"));
    private final NutritionEstimator estimator = new NutritionEstimator(table, new PortionModel());
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private FoodRecognitionService service(FoodDetector detector) {
        return new FoodRecognitionService(detector, new DetectionNormalizer(), estimator, clock);
    }

    @Test
    void idli_twice_and_sambar_end_to_end() {
        FoodDetector detector = image -> List.of(
                new Detection("Idli", 0.92, 0.15),
                new Detection("Idli", 0.88, 0.20),
                new Detection("Sambar", 0.87, 0.35)
        );

        FoodRecognitionResult r = service(detector).recognize("aGVsbG8=");

        assertThat(r.success()).isTrue();
        assertThat(r.error()).isNull();
        assertThat(r.foods()).hasSize(2);

        RecognizedFoodItem idli = r.foods().get(0);
        assertThat(idli.id()).isEqualTo("food_" + NOW.toEpochMilli() + "_0");
        assertThat(idli.name()).isEqualTo("Idli");
        assertThat(idli.portionSize()).isEqualTo("2 pieces");
        assertThat(idli.portionGrams()).isEqualTo(80.0);
        assertThat(idli.calories()).isEqualTo(46);
        assertThat(idli.confidence()).isEqualTo(0.90);

        RecognizedFoodItem sambar = r.foods().get(1);
        assertThat(sambar.id()).isEqualTo("food_" + NOW.toEpochMilli() + "_1");
        assertThat(sambar.portionSize()).isEqualTo("Large portion");
        assertThat(sambar.portionGrams()).isEqualTo(150.0);
        assertThat(sambar.calories()).isEqualTo(135);
        assertThat(sambar.protein()).isEqualTo(6.0);
        assertThat(sambar.carbs()).isEqualTo(18.0);
        assertThat(sambar.fat()).isEqualTo(4.5);
        assertThat(sambar.confidence()).isEqualTo(0.87);

        assertThat(r.totals()).isEqualTo(new NutritionTotals(181, 7.6, 27.6, 4.8));
    }

    @Test
    void ids_are_unique_within_one_call() {
        FoodDetector detector = image -> List.of(
                new Detection("Dosa", 0.9, 0.3),
                new Detection("Pho", 0.9, 0.3),
                new Detection("Vada", 0.9, 0.3),
                new Detection("Ramen", 0.9, 0.3)
        );

        List<String> ids = service(detector).recognize("x").foods().stream().map(RecognizedFoodItem::id).toList();

        assertThat(ids).hasSize(4).doesNotHaveDuplicates();
    }

    @Test
    void fallback_detector_gives_three_foods() {
        FoodDetector detector = new FallbackFoodDetector(List.of(
                new Detection("Idli", 0.92, 0.15),
                new Detection("Sambar", 0.87, 0.35),
                new Detection("Chapathi", 0.78, 0.20)
        ));

        FoodRecognitionResult r = service(detector).recognize("aGVsbG8=");

        assertThat(r.success()).isTrue();
        assertThat(r.foods()).extracting(RecognizedFoodItem::name)
                .containsExactly("Idli", "Sambar", "Chapathi");
        assertThat(r.foods().get(2).portionSize()).isEqualTo("1 pieces");
        assertThat(r.foods().get(2).portionGrams()).isEqualTo(45.0);
    }

    @Test
    void unknown_label_becomes_default_item() {
        FoodDetector detector = image -> List.of(new Detection("Pho", 0.99, 0.7));

        RecognizedFoodItem pho = service(detector).recognize("x").foods().get(0);

        assertThat(pho.name()).isEqualTo("Pho");
        assertThat(pho.calories()).isEqualTo(200);
        assertThat(pho.confidence()).isEqualTo(0.5);
    }

    @Test
    void detector_with_no_food_gives_empty_success() {
        FoodRecognitionResult r = service(image -> List.of()).recognize("x");

        assertThat(r.success()).isTrue();
        assertThat(r.foods()).isEmpty();
        assertThat(r.totals()).isEqualTo(NutritionTotals.ZERO);
    }

    @Test
    void any_failure_becomes_generic_error_and_never_throws() {
        FoodDetector broken = image -> {
            throw new IllegalStateException("socket closed with secret token abc");
        };

        assertThatCode(() -> service(broken).recognize("x")).doesNotThrowAnyException();

        FoodRecognitionResult r = service(broken).recognize("x");
        assertThat(r.success()).isFalse();
        assertThat(r.foods()).isEmpty();
        assertThat(r.error()).isEqualTo("Failed to analyze image");
        assertThat(r.totals()).isNull();
    }

    @Test
    void null_from_detector_is_handled() {
        FoodRecognitionResult r = service(image -> null).recognize("x");

        assertThat(r.success()).isTrue();
        assertThat(r.foods()).isEmpty();
    }
}

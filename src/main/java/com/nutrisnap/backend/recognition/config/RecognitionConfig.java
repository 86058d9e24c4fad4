package com.nutrisnap.backend.recognition.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrisnap.backend.recognition.estimate.NutritionEstimator;
import com.nutrisnap.backend.recognition.portion.PortionModel;
import com.nutrisnap.backend.recognition.reference.NutritionReferenceLoader;
import com.nutrisnap.backend.recognition.reference.NutritionReferenceTable;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RecognitionProperties.class)
public class RecognitionConfig {

    /**
     * 啟動就載入；檔案壞掉直接 fail-fast，不要等到第一張照片才炸
     */
    @Bean
    @ConditionalOnMissingBean
    public NutritionReferenceTable nutritionReferenceTable(
            RecognitionProperties props,
            ResourceLoader resourceLoader,
            ObjectMapper om
    ) {
        return new NutritionReferenceLoader(om)
                .load(resourceLoader.getResource(props.referenceTableOrDefault()));
    }

    @Bean
    public NutritionEstimator nutritionEstimator(NutritionReferenceTable table, PortionModel portionModel) {
        return new NutritionEstimator(table, portionModel);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}

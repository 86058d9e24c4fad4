package com.nutrisnap.backend.recognition.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * app.recognition.*
 *
 * @param referenceTable Spring resource location of the nutrition reference JSON
 * @param maxImageBytes  decoded image size limit for POST /api/v1/food-recognition
 */
@ConfigurationProperties(prefix = "app.recognition")
public record RecognitionProperties(String referenceTable, Long maxImageBytes) {

    public long maxImageBytesOrDefault() {
        return (maxImageBytes == null || maxImageBytes <= 0) ? 10L * 1024 * 1024 : maxImageBytes;
    }

    public String referenceTableOrDefault() {
        return (referenceTable == null || referenceTable.isBlank())
                ? "classpath:nutrition/reference-table.json"
                : referenceTable.trim();
    }
}

package com.nutrisnap.backend.recognition.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GiCategory {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    private final String label;

    GiCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static GiCategory fromLabel(String raw) {
        if (raw == null) throw new IllegalArgumentException("GI_CATEGORY_REQUIRED");
        return GiCategory.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}

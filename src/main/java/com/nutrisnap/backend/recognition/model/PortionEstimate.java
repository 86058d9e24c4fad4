package com.nutrisnap.backend.recognition.model;

public record PortionEstimate(double grams, String description) {
}

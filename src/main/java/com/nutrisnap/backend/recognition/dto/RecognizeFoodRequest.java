package com.nutrisnap.backend.recognition.dto;

/**
 * @param image base64 image or data URL
 */
public record RecognizeFoodRequest(String image) {
}

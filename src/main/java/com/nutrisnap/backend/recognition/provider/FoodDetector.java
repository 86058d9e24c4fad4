package com.nutrisnap.backend.recognition.provider;

import com.nutrisnap.backend.recognition.model.Detection;

import java.util.List;

public interface FoodDetector {

    /**
     * Runs the external detector on a base64 image.
     * Never throws; when the detector cannot answer the configured fallback set is returned.
     */
    List<Detection> detect(String imageBase64);
}

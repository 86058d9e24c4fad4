package com.nutrisnap.backend.recognition.provider;

import lombok.Getter;

/**
 * Detector answered 2xx but the body is not something we can use.
 */
@Getter
public class DetectorResponseException extends RuntimeException {

    private final String code;
    private final String bodySnippet;

    public DetectorResponseException(String code, String message, String bodySnippet) {
        super(message);
        this.code = code;
        this.bodySnippet = bodySnippet;
    }
}

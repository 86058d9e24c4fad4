package com.nutrisnap.backend.recognition.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 4xx/5xx body for the recognition + meal endpoints.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FoodRecognitionErrorResponse(
        String errorCode,          // ✅ client 判斷用
        String message,
        String requestId
) {
    // ✅ success 固定 false，前端可以跟正常回應用同一個欄位判斷
    @JsonProperty("success")
    public boolean success() {
        return false;
    }

    // ✅ 跟 FoodRecognitionResponse.error 同名
    @JsonProperty("error")
    public String error() {
        return message;
    }
}

package com.nutrisnap.backend.recognition.web;

import com.nutrisnap.backend.common.web.RequestIdFilter;
import com.nutrisnap.backend.meal.controller.MealLogController;
import com.nutrisnap.backend.recognition.controller.FoodRecognitionController;
import com.nutrisnap.backend.recognition.dto.FoodRecognitionErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

@Slf4j
@RestControllerAdvice(assignableTypes = {
        FoodRecognitionController.class,
        MealLogController.class
})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class FoodRecognitionExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<FoodRecognitionErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        HttpStatus status = "IMAGE_TOO_LARGE".equals(code) ? HttpStatus.PAYLOAD_TOO_LARGE : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(err(code, message(code), req));
    }

    /**
     * {@code @Valid} 擋下來的 body：轉成跟 service 一樣的 error code
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<FoodRecognitionErrorResponse> handleInvalid(MethodArgumentNotValidException e, HttpServletRequest req) {
        FieldError fe = e.getBindingResult().getFieldError();
        String code = fe == null ? "BODY_INVALID" : validationCode(fe);
        return ResponseEntity.badRequest().body(err(code, message(code), req));
    }

    /** body 不是 JSON / 欄位型別錯 */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<FoodRecognitionErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("BODY_INVALID", "Request body is not valid JSON", req));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<FoodRecognitionErrorResponse> handleBadParam(Exception e, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(err("PARAM_INVALID", e.getMessage(), req));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<FoodRecognitionErrorResponse> handleStatus(ResponseStatusException e, HttpServletRequest req) {
        String code = norm(e.getReason(), "ERROR");
        return ResponseEntity.status(e.getStatusCode()).body(err(code, code, req));
    }

    /**
     * 不把 stack trace / exception message 回給 client
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<FoodRecognitionErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled error path={}", req.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", "Failed to analyze image", req));
    }

    // ===== helpers =====

    private static FoodRecognitionErrorResponse err(String code, String message, HttpServletRequest req) {
        return new FoodRecognitionErrorResponse(code, message, RequestIdFilter.getOrCreate(req));
    }

    static String validationCode(FieldError fe) {
        String field = fe.getField();
        if ("mealType".equals(field)) return "MEAL_TYPE_REQUIRED";
        // foods 空 → FOODS_REQUIRED；超過上限 / foods[i].xxx 不合法 → FOOD_ITEM_INVALID
        if ("foods".equals(field)) return "Size".equals(fe.getCode()) ? "FOOD_ITEM_INVALID" : "FOODS_REQUIRED";
        if (field.startsWith("foods[")) return "FOOD_ITEM_INVALID";
        return "BODY_INVALID";
    }

    private static String message(String code) {
        return switch (code) {
            case "IMAGE_REQUIRED" -> "No image provided";
            case "IMAGE_INVALID_BASE64" -> "Image is not valid base64 data";
            case "IMAGE_TOO_LARGE" -> "Image is too large";
            case "MEAL_TYPE_REQUIRED" -> "mealType is required";
            case "MEAL_TYPE_INVALID" -> "mealType must be one of breakfast, lunch, dinner, snack";
            case "FOODS_REQUIRED" -> "At least one food item is required";
            case "FOOD_ITEM_INVALID" -> "Food item has missing or negative values";
            case "TIMEZONE_INVALID" -> "X-Client-Timezone is not a valid zone id";
            case "BODY_INVALID" -> "Request body is not valid";
            default -> code;
        };
    }

    private static String norm(String msg, String fallback) {
        if (msg == null) return fallback;
        String c = msg.trim();
        return c.isEmpty() ? fallback : c;
    }
}

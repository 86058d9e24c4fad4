package com.nutrisnap.backend.recognition.controller;

import com.nutrisnap.backend.recognition.config.RecognitionProperties;
import com.nutrisnap.backend.recognition.dto.FoodRecognitionResponse;
import com.nutrisnap.backend.recognition.dto.FoodSearchResponse;
import com.nutrisnap.backend.recognition.dto.RecognizeFoodRequest;
import com.nutrisnap.backend.recognition.image.ImagePayload;
import com.nutrisnap.backend.recognition.service.FoodRecognitionResult;
import com.nutrisnap.backend.recognition.service.FoodRecognitionService;
import com.nutrisnap.backend.recognition.service.FoodSearchService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "FoodRecognition", description = "Meal photo → per-food nutrition estimate + manual food search")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/food-recognition")
public class FoodRecognitionController {

    private final FoodRecognitionService recognitionService;
    private final FoodSearchService searchService;
    private final RecognitionProperties props;

    /**
     * 圖片缺少 / 不是 base64 → 400，不會呼叫 detector
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<FoodRecognitionResponse> recognize(@RequestBody(required = false) RecognizeFoodRequest body) {
        String image = body == null ? null : body.image();
        ImagePayload.requireValid(image, props.maxImageBytesOrDefault());

        FoodRecognitionResult result = recognitionService.recognize(image);
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(FoodRecognitionResponse.from(result));
    }

    @GetMapping(value = "/foods", produces = MediaType.APPLICATION_JSON_VALUE)
    public FoodSearchResponse search(@RequestParam(value = "q", required = false) String q) {
        return new FoodSearchResponse(q, searchService.search(q));
    }
}

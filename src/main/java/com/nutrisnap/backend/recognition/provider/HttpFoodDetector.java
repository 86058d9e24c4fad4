package com.nutrisnap.backend.recognition.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrisnap.backend.recognition.model.Detection;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Calls the YOLO detection service:
 * <pre>
 * POST {baseUrl}/detect  {"image": "&lt;base64&gt;"}
 * 200 {"success": true, "detections": [{"food_name":"Idli","confidence":0.92,"area_ratio":0.15}]}
 * </pre>
 * Anything else (network, timeout, non-2xx, success=false, malformed body) → fallback list.
 */
public class HttpFoodDetector implements FoodDetector {

    static final String DETECTOR_NAME = "YOLO_HTTP";
    private static final int MAX_SNIPPET_CHARS = 300;

    private final RestClient http;
    private final String detectPath;
    private final List<Detection> fallback;
    private final ObjectMapper om;
    private final DetectorTelemetry telemetry;

    public HttpFoodDetector(RestClient http,
                            String detectPath,
                            List<Detection> fallback,
                            ObjectMapper om,
                            DetectorTelemetry telemetry) {
        this.http = http;
        this.detectPath = detectPath;
        this.fallback = List.copyOf(fallback);
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public List<Detection> detect(String imageBase64) {
        long t0 = System.nanoTime();
        try {
            String body = http.post()
                    .uri(detectPath)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(Map.of("image", imageBase64 == null ? "" : imageBase64))
                    .retrieve()
                    .body(String.class);

            List<Detection> detections = parse(body);
            telemetry.ok(DETECTOR_NAME, msSince(t0), detections.size());
            return detections;
        } catch (Exception e) {
            DetectorErrorMapper.Mapped m = DetectorErrorMapper.map(e);
            telemetry.fallback(DETECTOR_NAME, msSince(t0), m.code(), m.message());
            return fallback;
        }
    }

    List<Detection> parse(String body) {
        if (body == null || body.isBlank()) {
            throw new DetectorResponseException("DETECTOR_EMPTY_BODY", "detector returned empty body", null);
        }

        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (Exception e) {
            throw new DetectorResponseException("DETECTOR_JSON_PARSE_FAILED",
                    "detector body is not JSON", shrink(body));
        }

        if (root == null || !root.path("success").asBoolean(false)) {
            String err = root == null ? null : root.path("error").asText(null);
            throw new DetectorResponseException("DETECTOR_NOT_SUCCESS",
                    err == null ? "detector reported success=false" : err, shrink(body));
        }

        JsonNode arr = root.get("detections");
        if (arr == null || !arr.isArray()) {
            throw new DetectorResponseException("DETECTOR_DETECTIONS_MISSING",
                    "detections field missing or not an array", shrink(body));
        }

        List<Detection> out = new ArrayList<>(arr.size());
        for (JsonNode d : arr) {
            out.add(toDetection(d, body));
        }
        return List.copyOf(out);
    }

    private Detection toDetection(JsonNode d, String body) {
        JsonNode name = d.get("food_name");
        JsonNode conf = d.get("confidence");
        JsonNode area = d.get("area_ratio");

        if (name == null || !name.isTextual() || name.asText().isBlank()
            || !isUnitNumber(conf) || !isUnitNumber(area)) {
            throw new DetectorResponseException("DETECTOR_DETECTION_MALFORMED",
                    "malformed detection entry: " + d, shrink(body));
        }
        return new Detection(name.asText(), conf.asDouble(), area.asDouble());
    }

    private static boolean isUnitNumber(JsonNode v) {
        if (v == null || !v.isNumber()) return false;
        double x = v.asDouble();
        return Double.isFinite(x) && x >= 0.0 && x <= 1.0;
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }

    private static String shrink(String s) {
        if (s == null) return null;
        String t = s.replaceAll("\\s+", " ").trim();
        if (t.length() <= MAX_SNIPPET_CHARS) return t;
        return t.substring(0, MAX_SNIPPET_CHARS) + "...";
    }
}

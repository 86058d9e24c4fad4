package com.nutrisnap.backend.recognition.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class DetectorTelemetry {

    public void ok(String detector, long latencyMs, int detections) {
        log.info("detector_call status=OK detector={} latencyMs={} detections={}",
                safe(detector), latencyMs, detections);
    }

    /** fallback 不是錯誤給使用者，但要留 WARN 方便追 detector 掛掉 */
    public void fallback(String detector, long latencyMs, String errorCode, String message) {
        log.warn("detector_call status=FALLBACK detector={} latencyMs={} errorCode={} message={}",
                safe(detector), latencyMs, safe(errorCode), safe(message));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
}

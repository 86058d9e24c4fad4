package com.nutrisnap.backend.recognition.provider;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps any detector call failure to a stable error code for logs / telemetry.
 */
public final class DetectorErrorMapper {

    private DetectorErrorMapper() {}

    public record Mapped(String code, String message) {}

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("DETECTOR_FAILED", null);

        // timeout 先擋（RestClient 常把它包在 ResourceAccessException 裡）
        if (isTimeoutThrowable(e)) {
            return new Mapped("DETECTOR_TIMEOUT", safeMsg(e));
        }

        if (e instanceof DetectorResponseException dre) {
            return new Mapped(dre.getCode(), safeMsg(dre));
        }

        if (e instanceof RestClientResponseException re) {
            var sc = re.getStatusCode();
            if (sc.is5xxServerError()) return new Mapped("DETECTOR_UPSTREAM_5XX", "upstream " + sc.value());
            if (sc.is4xxClientError()) return new Mapped("DETECTOR_BAD_REQUEST", "upstream " + sc.value());
            return new Mapped("DETECTOR_HTTP_ERROR", "upstream " + sc.value());
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped("DETECTOR_NETWORK_ERROR", safeMsg(rae));
        }

        if (e instanceof RestClientException rce) {
            // 沒有 status code：body 解不開 / converter 問題
            return new Mapped("DETECTOR_CLIENT_ERROR", safeMsg(rce));
        }

        return new Mapped("DETECTOR_FAILED", safeMsg(e));
    }

    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException) return true;
            if (c instanceof HttpTimeoutException) return true;
            if (c instanceof TimeoutException) return true;

            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timed out") || s.contains("timeout")) return true;
            }
        }
        return false;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}

package com.nutrisnap.backend.recognition.provider;

import com.nutrisnap.backend.recognition.provider.config.DetectorProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DetectorConfigHealthIndicatorTest {

    @Test
    void disabled_detector_is_up_in_fallback_mode() {
        var props = new DetectorProperties(false, null, null, null, null, null);

        Health h = new DetectorConfigHealthIndicator(props).health();

        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails()).containsEntry("mode", "FALLBACK_ONLY")
                .containsEntry("fallbackDetections", 3);
    }

    @Test
    void http_base_url_is_up() {
        var props = new DetectorProperties(true, "http://detector:8000", "/detect",
                Duration.ofSeconds(3), Duration.ofSeconds(7), null);

        Health h = new DetectorConfigHealthIndicator(props).health();

        assertThat(h.getStatus()).isEqualTo(Status.UP);
        assertThat(h.getDetails()).containsEntry("baseUrl", "http://detector:8000")
                .containsEntry("readTimeoutMs", 7000L);
    }

    @Test
    void non_http_base_url_is_down() {
        var props = new DetectorProperties(true, "detector:8000", null, null, null, null);

        Health h = new DetectorConfigHealthIndicator(props).health();

        assertThat(h.getStatus()).isEqualTo(Status.DOWN);
        assertThat(h.getDetails()).containsEntry("reason", "DETECTOR_BASE_URL_INVALID");
    }
}

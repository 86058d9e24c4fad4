package com.nutrisnap.backend.recognition.provider;

import com.nutrisnap.backend.recognition.provider.config.DetectorProperties;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 啟動自檢（不打外網）：
 * - enabled=false → UP，mode=FALLBACK_ONLY
 * - enabled=true 且 baseUrl 是 http(s) → UP
 * - 其他 → DOWN
 */
@Component
public class DetectorConfigHealthIndicator implements HealthIndicator {

    private final DetectorProperties props;

    public DetectorConfigHealthIndicator(DetectorProperties props) {
        this.props = props;
    }

    @Override
    public Health health() {
        boolean enabled = props.enabledOrDefault();
        int fallbackSize = props.fallbackOrDefault().size();

        if (!enabled) {
            return Health.up()
                    .withDetail("enabled", false)
                    .withDetail("mode", "FALLBACK_ONLY")
                    .withDetail("fallbackDetections", fallbackSize)
                    .build();
        }

        String baseUrl = props.baseUrlOrDefault();
        String lower = baseUrl.toLowerCase(Locale.ROOT);
        boolean baseOk = lower.startsWith("http://") || lower.startsWith("https://");

        Health.Builder b = baseOk
                ? Health.up()
                : Health.down().withDetail("reason", "DETECTOR_BASE_URL_INVALID");

        return b.withDetail("enabled", true)
                .withDetail("baseUrl", baseUrl)
                .withDetail("readTimeoutMs", props.readTimeoutOrDefault().toMillis())
                .withDetail("fallbackDetections", fallbackSize)
                .build();
    }
}

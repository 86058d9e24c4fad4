package com.nutrisnap.backend.recognition.provider.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nutrisnap.backend.recognition.provider.DetectorTelemetry;
import com.nutrisnap.backend.recognition.provider.FallbackFoodDetector;
import com.nutrisnap.backend.recognition.provider.FoodDetector;
import com.nutrisnap.backend.recognition.provider.HttpFoodDetector;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
@EnableConfigurationProperties(DetectorProperties.class)
public class DetectorConfig {

    @Bean("detectorRestClient")
    public RestClient detectorRestClient(DetectorProperties props) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(props.connectTimeoutOrDefault())
                // uvicorn 不吃 h2c upgrade，固定 HTTP/1.1
                .version(HttpClient.Version.HTTP_1_1)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(props.readTimeoutOrDefault());

        return RestClient.builder()
                .baseUrl(props.baseUrlOrDefault())
                .requestFactory(rf)
                .build();
    }

    /**
     * enabled=false → 不打外網，永遠回 fallback
     */
    @Bean
    public FoodDetector foodDetector(
            DetectorProperties props,
            RestClient detectorRestClient,
            ObjectMapper om,
            DetectorTelemetry telemetry
    ) {
        if (!props.enabledOrDefault()) {
            return new FallbackFoodDetector(props.fallbackOrDefault());
        }
        return new HttpFoodDetector(
                detectorRestClient,
                props.detectPathOrDefault(),
                props.fallbackOrDefault(),
                om,
                telemetry
        );
    }
}

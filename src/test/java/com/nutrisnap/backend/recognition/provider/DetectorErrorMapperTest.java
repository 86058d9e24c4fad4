package com.nutrisnap.backend.recognition.provider;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DetectorErrorMapperTest {

    @Test
    void socket_timeout_is_timeout() {
        assertEquals("DETECTOR_TIMEOUT", DetectorErrorMapper.map(new SocketTimeoutException("Read timed out")).code());
    }

    @Test
    void timeout_wrapped_by_rest_client_is_still_timeout() {
        var e = new ResourceAccessException("I/O error on POST", new HttpTimeoutException("request timed out"));
        assertEquals("DETECTOR_TIMEOUT", DetectorErrorMapper.map(e).code());
    }

    @Test
    void response_exception_keeps_its_own_code() {
        var e = new DetectorResponseException("DETECTOR_NOT_SUCCESS", "model not loaded", null);
        DetectorErrorMapper.Mapped m = DetectorErrorMapper.map(e);
        assertEquals("DETECTOR_NOT_SUCCESS", m.code());
        assertEquals("model not loaded", m.message());
    }

    @Test
    void status_codes_are_bucketed() {
        assertEquals("DETECTOR_UPSTREAM_5XX",
                DetectorErrorMapper.map(HttpServerErrorException.create(HttpStatus.BAD_GATEWAY, "bad gateway", null, null, null)).code());
        assertEquals("DETECTOR_BAD_REQUEST",
                DetectorErrorMapper.map(HttpClientErrorException.create(HttpStatus.UNPROCESSABLE_ENTITY, "unprocessable", null, null, null)).code());
    }

    @Test
    void plain_io_failure_is_network_error() {
        var e = new ResourceAccessException("I/O error on POST", new IOException("Connection refused"));
        assertEquals("DETECTOR_NETWORK_ERROR", DetectorErrorMapper.map(e).code());
    }

    @Test
    void rest_client_without_status_is_client_error() {
        assertEquals("DETECTOR_CLIENT_ERROR", DetectorErrorMapper.map(new RestClientException("no converter")).code());
    }

    @Test
    void anything_else_is_generic_failure() {
        assertEquals("DETECTOR_FAILED", DetectorErrorMapper.map(new IllegalStateException("boom")).code());
        assertEquals("DETECTOR_FAILED", DetectorErrorMapper.map(null).code());
    }
}

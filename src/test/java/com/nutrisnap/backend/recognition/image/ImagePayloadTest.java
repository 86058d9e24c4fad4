package com.nutrisnap.backend.recognition.image;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ImagePayloadTest {

    private static final String JPEG_HEAD = Base64.getEncoder().encodeToString(
            new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0x00, 0x10});

    @Test
    void plain_base64_returns_decoded_size() {
        assertThat(ImagePayload.requireValid(JPEG_HEAD, 1024)).isEqualTo(6);
    }

    @Test
    void data_url_prefix_and_line_breaks_are_accepted() {
        String b64 = Base64.getMimeEncoder().encodeToString("x".repeat(200).getBytes(StandardCharsets.US_ASCII));

        int n = ImagePayload.requireValid("data:image/jpeg;base64," + b64, 1024);

        assertThat(n).isEqualTo(200);
    }

    @Test
    void missing_or_blank_is_image_required() {
        assertThatThrownBy(() -> ImagePayload.requireValid(null, 1024)).hasMessage("IMAGE_REQUIRED");
        assertThatThrownBy(() -> ImagePayload.requireValid("  ", 1024)).hasMessage("IMAGE_REQUIRED");
        assertThatThrownBy(() -> ImagePayload.requireValid("data:image/png;base64,", 1024)).hasMessage("IMAGE_REQUIRED");
    }

    @Test
    void garbage_is_invalid_base64() {
        assertThatThrownBy(() -> ImagePayload.requireValid("not*base64!", 1024))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("IMAGE_INVALID_BASE64");
    }

    @Test
    void oversized_image_is_rejected_before_decoding() {
        String big = Base64.getEncoder().encodeToString(new byte[4096]);

        assertThatThrownBy(() -> ImagePayload.requireValid(big, 1024)).hasMessage("IMAGE_TOO_LARGE");
    }

    @Test
    void strip_keeps_plain_payload() {
        assertThat(ImagePayload.stripDataUrlPrefix("  abcd ")).isEqualTo("abcd");
        assertThat(ImagePayload.stripDataUrlPrefix("data:image/png;base64,abcd")).isEqualTo("abcd");
    }
}

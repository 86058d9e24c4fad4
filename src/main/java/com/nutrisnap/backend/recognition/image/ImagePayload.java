package com.nutrisnap.backend.recognition.image;

import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Checks the base64 image sent by the client before any detector call.
 * Accepts plain base64 or a data URL ("data:image/jpeg;base64,....").
 */
public final class ImagePayload {

    private ImagePayload() {}

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @return decoded byte count
     * @throws IllegalArgumentException IMAGE_REQUIRED / IMAGE_INVALID_BASE64 / IMAGE_TOO_LARGE
     */
    public static int requireValid(String image, long maxBytes) {
        if (image == null || image.isBlank()) throw new IllegalArgumentException("IMAGE_REQUIRED");

        String b64 = WHITESPACE.matcher(stripDataUrlPrefix(image)).replaceAll("");
        if (b64.isBlank()) throw new IllegalArgumentException("IMAGE_REQUIRED");

        // 先用長度估，避免超大字串真的 decode 進記憶體
        long estimated = (long) b64.length() * 3 / 4;
        if (maxBytes > 0 && estimated > maxBytes + 2) throw new IllegalArgumentException("IMAGE_TOO_LARGE");

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("IMAGE_INVALID_BASE64", e);
        }
        if (bytes.length == 0) throw new IllegalArgumentException("IMAGE_INVALID_BASE64");
        if (maxBytes > 0 && bytes.length > maxBytes) throw new IllegalArgumentException("IMAGE_TOO_LARGE");
        return bytes.length;
    }

    static String stripDataUrlPrefix(String s) {
        String t = s.trim();
        if (t.startsWith("data:")) {
            int comma = t.indexOf(',');
            return comma < 0 ? "" : t.substring(comma + 1);
        }
        return t;
    }
}

package com.nutrisnap.backend.recognition.reference;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical lookup key for a food label: lowercase, trimmed, whitespace runs → "_".
 * "Lemon Rice" / " lemon  rice " → "lemon_rice"
 */
public final class FoodKeys {
    private FoodKeys() {}

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static String normalize(String label) {
        if (label == null) return "";
        String t = label.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) return "";
        return WHITESPACE.matcher(t).replaceAll("_");
    }
}

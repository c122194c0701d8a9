package com.example.reelbot_backend.util;

import java.util.Arrays;
import java.util.Optional;

/**
 * Output aspect ratios. Extended ratios are rendered with the closest ratio the provider supports.
 */
public enum AspectRatio {
    LANDSCAPE("16:9", 1920, 1080, "16:9"),
    PORTRAIT("9:16", 1080, 1920, "9:16"),
    SQUARE("1:1", 1080, 1080, "1:1"),
    STANDARD("4:3", 1440, 1080, "16:9"),
    PORTRAIT_STANDARD("3:4", 1080, 1440, "9:16"),
    ULTRA_WIDE("21:9", 2560, 1080, "16:9");

    private final String label;
    private final int width;
    private final int height;
    private final String providerRatio;

    AspectRatio(String label, int width, int height, String providerRatio) {
        this.label = label;
        this.width = width;
        this.height = height;
        this.providerRatio = providerRatio;
    }

    public String label() {
        return label;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public String providerRatio() {
        return providerRatio;
    }

    public static Optional<AspectRatio> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        return Arrays.stream(values()).filter(r -> r.label.equals(trimmed)).findFirst();
    }
}

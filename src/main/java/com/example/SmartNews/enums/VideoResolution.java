package com.example.SmartNews.enums;

/**
 * Resolutions in ascending order; the declaration order is the ranking used by the quota gate.
 */
public enum VideoResolution {
    P360("360p"),
    P480("480p"),
    P720("720p"),
    P1080("1080p");

    private final String label;

    VideoResolution(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    // Unrecognized values rank lowest.
    public static int rank(String resolution) {
        if (resolution == null) {
            return 0;
        }
        for (VideoResolution value : values()) {
            if (value.label.equalsIgnoreCase(resolution.trim())) {
                return value.ordinal();
            }
        }
        return 0;
    }
}

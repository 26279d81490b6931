package com.example.SmartNews.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Video transformation recipe applied after download.
 * The id is the value used in tier configuration and the API.
 */
public enum ProcessingMode {
    ORIGINAL("original"),
    WITH_SUBTITLE("with_subtitle"),
    REPEAT_TWICE("repeat_twice"),
    SLOW("slow");

    private final String id;

    ProcessingMode(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<ProcessingMode> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(mode -> mode.id.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value))
                .findFirst();
    }
}

package com.example.SmartNews.enums;

import java.util.Arrays;
import java.util.Optional;

public enum UserTier {
    FREE,
    BASIC,
    PREMIUM;

    public String getId() {
        return name().toLowerCase();
    }

    /**
     * Unknown or missing values fall back to FREE.
     */
    public static UserTier fromId(String value) {
        return parse(value).orElse(FREE);
    }

    public static Optional<UserTier> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(tier -> tier.name().equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}

package com.example.SmartNews.config;

import com.example.SmartNews.entity.TierLimits;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Built-in tier table, used only when tiers.json is missing or unreadable.
 */
final class DefaultTiers {

    private DefaultTiers() {
    }

    static Map<String, TierLimits> defaults() {
        Map<String, TierLimits> tiers = new LinkedHashMap<>();
        tiers.put("free", TierLimits.builder()
                .dailyTasks(3)
                .maxResolution("480p")
                .allowedModes(new LinkedHashSet<>(List.of("original", "with_subtitle")))
                .priority(1)
                .aiSubtitle(false)
                .concurrentTasks(1)
                .name("Free")
                .description("Basic access")
                .priceMonthly("Free")
                .priceYearly("Free")
                .build());
        tiers.put("basic", TierLimits.builder()
                .dailyTasks(15)
                .maxResolution("720p")
                .allowedModes(new LinkedHashSet<>(List.of("original", "with_subtitle", "repeat_twice")))
                .priority(5)
                .aiSubtitle(true)
                .concurrentTasks(2)
                .name("Basic")
                .description("For regular learners")
                .priceMonthly("19")
                .priceYearly("190")
                .build());
        tiers.put("premium", TierLimits.builder()
                .dailyTasks(TierLimits.UNLIMITED)
                .maxResolution("1080p")
                .allowedModes(new LinkedHashSet<>(List.of("original", "with_subtitle", "repeat_twice", "slow")))
                .priority(10)
                .aiSubtitle(true)
                .concurrentTasks(5)
                .name("Premium")
                .description("Unlimited access")
                .priceMonthly("49")
                .priceYearly("490")
                .build());
        return tiers;
    }

    static List<String> resolutions() {
        return List.of("360p", "480p", "720p", "1080p");
    }
}

package com.example.SmartNews.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TierLimits {

    public static final int UNLIMITED = -1;

    @JsonProperty("daily_tasks")
    @Builder.Default
    private int dailyTasks = 3;

    @JsonProperty("max_resolution")
    @Builder.Default
    private String maxResolution = "480p";

    @JsonProperty("allowed_modes")
    @Builder.Default
    private Set<String> allowedModes = new LinkedHashSet<>(Set.of("original"));

    @Builder.Default
    private int priority = 1;

    @JsonProperty("ai_subtitle")
    private boolean aiSubtitle;

    @JsonProperty("concurrent_tasks")
    @Builder.Default
    private int concurrentTasks = 1;

    private String name;
    private String description;

    @JsonProperty("price_monthly")
    private String priceMonthly;

    @JsonProperty("price_yearly")
    private String priceYearly;

    @JsonIgnore
    public boolean isUnlimited() {
        return dailyTasks == UNLIMITED;
    }
}

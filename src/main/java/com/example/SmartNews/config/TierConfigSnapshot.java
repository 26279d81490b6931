package com.example.SmartNews.config;

import com.example.SmartNews.entity.TierLimits;
import com.example.SmartNews.enums.UserTier;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of the tier table. A reload builds a new snapshot; readers never see a partial one.
 */
public final class TierConfigSnapshot {

    private final Map<String, TierLimits> tiers;
    private final Map<String, Map<String, Object>> processingModes;
    private final List<String> resolutions;
    private final LocalDateTime loadedAt;
    private final boolean fromFile;

    public TierConfigSnapshot(Map<String, TierLimits> tiers,
                              Map<String, Map<String, Object>> processingModes,
                              List<String> resolutions,
                              boolean fromFile) {
        this.tiers = Collections.unmodifiableMap(new LinkedHashMap<>(tiers));
        this.processingModes = Collections.unmodifiableMap(new LinkedHashMap<>(processingModes));
        this.resolutions = List.copyOf(resolutions);
        this.loadedAt = LocalDateTime.now();
        this.fromFile = fromFile;
    }

    /**
     * Limits for the given tier id, falling back to the FREE entry (and then to the
     * built-in FREE defaults) when the id is unknown.
     */
    public TierLimits getLimits(String tierId) {
        TierLimits limits = tierId != null ? tiers.get(tierId.toLowerCase()) : null;
        if (limits != null) {
            return limits;
        }
        TierLimits free = tiers.get(UserTier.FREE.getId());
        return free != null ? free : DefaultTiers.defaults().get(UserTier.FREE.getId());
    }

    public Map<String, TierLimits> getTiers() {
        return tiers;
    }

    public Map<String, Map<String, Object>> getProcessingModes() {
        return processingModes;
    }

    public List<String> getResolutions() {
        return resolutions;
    }

    public LocalDateTime getLoadedAt() {
        return loadedAt;
    }

    public boolean isFromFile() {
        return fromFile;
    }
}

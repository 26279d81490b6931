package com.example.SmartNews.dto;

import com.example.SmartNews.entity.TierLimits;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a quota check. When the tier has no daily cap {@code unlimited}
 * is true and {@code remainingToday} is -1; zero always means "none left".
 */
@Data
@Builder
public class QuotaCheckResult {
    private boolean allowed;
    private String reason;
    private int remainingToday;
    private boolean unlimited;
    private String tier;
    private TierLimits limits;
}

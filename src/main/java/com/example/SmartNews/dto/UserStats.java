package com.example.SmartNews.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Set;

@Data
@Builder
public class UserStats {
    private String userId;
    private String tier;
    private int dailyTasksUsed;
    // -1 when the tier is unlimited
    private int dailyTasksLimit;
    private int dailyTasksRemaining;
    private boolean unlimited;
    private long totalTasks;
    private double totalDataProcessedMb;
    private String maxResolution;
    private Set<String> allowedModes;
    private boolean aiSubtitleEnabled;
    private LocalDateTime memberSince;
}

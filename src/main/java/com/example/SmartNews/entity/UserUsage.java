package com.example.SmartNews.entity;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Per-user usage counters kept in the quota ledger snapshot.
 * The tier is stored as its lower-case id so values written by an older
 * configuration survive a reload and resolve to FREE when unknown.
 */
@Data
@NoArgsConstructor
public class UserUsage {
    private String userId;
    private String tier = "free";
    private int dailyTaskCount;
    private LocalDate lastTaskDate;
    private long totalTasks;
    private long totalBytesProcessed;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public UserUsage(String userId) {
        this.userId = userId;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = this.createdAt;
    }

    /**
     * Zeroes the daily counter when {@code today} differs from the last recorded date.
     *
     * @return true if a reset happened
     */
    public boolean resetDailyIfNeeded(LocalDate today) {
        if (today.equals(lastTaskDate)) {
            return false;
        }
        dailyTaskCount = 0;
        lastTaskDate = today;
        return true;
    }
}

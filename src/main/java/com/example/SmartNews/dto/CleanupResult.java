package com.example.SmartNews.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class CleanupResult {
    private int filesRemoved;
    private long bytesFreed;

    public static CleanupResult none() {
        return new CleanupResult(0, 0L);
    }
}

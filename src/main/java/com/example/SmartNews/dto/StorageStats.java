package com.example.SmartNews.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {
    private long totalBytes;
    private int fileCount;
    private String oldestFile;
    private String newestFile;
    private double quotaUsedPercent;
}

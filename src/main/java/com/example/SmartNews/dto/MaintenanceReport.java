package com.example.SmartNews.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class MaintenanceReport {
    private LocalDateTime timestamp;
    private StorageStats storageBefore;
    private CleanupResult expiredCleanup;
    private CleanupResult quotaCleanup;
    private StorageStats storageAfter;
}

package com.example.SmartNews.controller;

import com.example.SmartNews.dto.MaintenanceReport;
import com.example.SmartNews.dto.StorageStats;
import com.example.SmartNews.entity.CachedArtifact;
import com.example.SmartNews.service.StorageLifecycleService;
import com.example.SmartNews.service.media.VideoFormats;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

@RestController
@RequestMapping("/api/v1/storage")
@RequiredArgsConstructor
public class StorageController {
    private static final Logger logger = LoggerFactory.getLogger(StorageController.class);

    private final StorageLifecycleService storageLifecycleService;

    @GetMapping("/formats")
    public ResponseEntity<?> getFormats() {
        return ResponseEntity.ok(Map.of(
                "formats", VideoFormats.all(),
                "default", VideoFormats.DEFAULT_FORMAT));
    }

    @GetMapping("/stats")
    public ResponseEntity<?> getStats() {
        StorageStats stats = storageLifecycleService.getStorageStats();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("totalBytes", stats.getTotalBytes());
        body.put("totalMb", Math.round(stats.getTotalBytes() / (1024.0 * 1024.0) * 100) / 100.0);
        body.put("fileCount", stats.getFileCount());
        body.put("quotaBytes", storageLifecycleService.getQuotaBytes());
        body.put("quotaUsedPercent", Math.round(stats.getQuotaUsedPercent() * 10) / 10.0);
        body.put("oldestFile", stats.getOldestFile());
        body.put("newestFile", stats.getNewestFile());
        OptionalLong remote = storageLifecycleService.getRemoteUsage();
        if (remote.isPresent()) {
            body.put("remoteBytes", remote.getAsLong());
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/maintenance")
    public ResponseEntity<MaintenanceReport> runMaintenance() {
        logger.info("Manual storage maintenance requested");
        return ResponseEntity.ok(storageLifecycleService.runMaintenance());
    }

    @GetMapping("/cache")
    public ResponseEntity<?> getCacheEntries() {
        List<CachedArtifact> entries = storageLifecycleService.getCacheEntries();
        long totalBytes = entries.stream().mapToLong(CachedArtifact::getFileSize).sum();
        return ResponseEntity.ok(Map.of(
                "entries", entries,
                "total", entries.size(),
                "totalBytes", totalBytes));
    }
}

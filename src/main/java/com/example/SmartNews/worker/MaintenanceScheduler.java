package com.example.SmartNews.worker;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.service.StorageLifecycleService;
import com.example.SmartNews.service.TaskStoreService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@Profile("!test")
public class MaintenanceScheduler {
    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final StorageLifecycleService storageLifecycleService;
    private final TaskStoreService taskStoreService;
    private final AppProperties properties;

    public MaintenanceScheduler(StorageLifecycleService storageLifecycleService,
                                TaskStoreService taskStoreService,
                                AppProperties properties) {
        this.storageLifecycleService = storageLifecycleService;
        this.taskStoreService = taskStoreService;
        this.properties = properties;
    }

    @Scheduled(cron = "${app.storage.maintenance-cron:0 0 * * * *}")
    public void runStorageMaintenance() {
        try {
            storageLifecycleService.runMaintenance();
        } catch (RuntimeException e) {
            logger.error("Scheduled storage maintenance failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${app.tasks.cleanup-cron:0 30 * * * *}")
    public void cleanupOldTasks() {
        try {
            int removed = taskStoreService.cleanupOlderThan(Duration.ofHours(properties.getTasks().getRetentionHours()));
            logger.info("Scheduled task cleanup removed {} tasks", removed);
        } catch (RuntimeException e) {
            logger.error("Scheduled task cleanup failed: {}", e.getMessage(), e);
        }
    }
}

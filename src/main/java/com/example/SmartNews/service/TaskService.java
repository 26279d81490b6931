package com.example.SmartNews.service;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.config.SourceConfigProvider;
import com.example.SmartNews.config.SourceConfigSnapshot;
import com.example.SmartNews.dto.CreateTaskRequest;
import com.example.SmartNews.dto.QuotaCheckResult;
import com.example.SmartNews.dto.TaskCreationResult;
import com.example.SmartNews.dto.VideoInfo;
import com.example.SmartNews.entity.LearningTask;
import com.example.SmartNews.entity.VideoSource;
import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.service.media.VideoDownloader;
import com.example.SmartNews.service.media.VideoFormats;
import com.example.SmartNews.worker.TaskExecutionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Admission path for new tasks: queue depth, source, quota, video lookup, then insert and
 * hand-off to the {@link TaskExecutionCoordinator}.
 */
@Service
public class TaskService {
    private static final Logger logger = LoggerFactory.getLogger(TaskService.class);

    private final TaskStoreService taskStore;
    private final QuotaLedgerService quotaLedger;
    private final VideoDownloader downloader;
    private final SourceConfigProvider sourceConfigProvider;
    private final TaskExecutionCoordinator coordinator;
    private final long maxActiveTasks;

    // serializes the cap check with the insert
    private final Object admissionLock = new Object();

    @Autowired
    public TaskService(TaskStoreService taskStore,
                       QuotaLedgerService quotaLedger,
                       VideoDownloader downloader,
                       SourceConfigProvider sourceConfigProvider,
                       TaskExecutionCoordinator coordinator,
                       AppProperties properties) {
        this(taskStore, quotaLedger, downloader, sourceConfigProvider, coordinator,
                (long) properties.getTasks().getMaxConcurrent() * properties.getTasks().getQueueDepthMultiplier());
    }

    public TaskService(TaskStoreService taskStore,
                       QuotaLedgerService quotaLedger,
                       VideoDownloader downloader,
                       SourceConfigProvider sourceConfigProvider,
                       TaskExecutionCoordinator coordinator,
                       long maxActiveTasks) {
        this.taskStore = taskStore;
        this.quotaLedger = quotaLedger;
        this.downloader = downloader;
        this.sourceConfigProvider = sourceConfigProvider;
        this.coordinator = coordinator;
        this.maxActiveTasks = maxActiveTasks;
    }

    public TaskCreationResult createTask(String userId, CreateTaskRequest request) {
        ProcessingMode mode = ProcessingMode.fromId(request.getProcessingMode())
                .orElseThrow(() -> new IllegalArgumentException("Unknown processing mode: " + request.getProcessingMode()));
        String format = request.getVideoFormat() != null ? request.getVideoFormat() : VideoFormats.DEFAULT_FORMAT;
        if (!VideoFormats.isKnown(format)) {
            throw new IllegalArgumentException("Unknown video format: " + format);
        }

        // cheap early rejection; re-checked under the lock before insert
        if (atCapacity()) {
            return tooManyPending();
        }

        SourceConfigSnapshot sources = sourceConfigProvider.current();
        if (!sources.isEmpty()) {
            Optional<VideoSource> source = sources.getSource(request.getSourceId());
            if (source.isEmpty() || !source.get().isEnabled()) {
                return TaskCreationResult.rejected(TaskCreationResult.Outcome.INVALID_SOURCE,
                        "Unknown or disabled source: " + request.getSourceId());
            }
        }

        QuotaCheckResult quota = quotaLedger.checkQuota(userId, mode, format);
        if (!quota.isAllowed()) {
            logger.info("Task rejected for {}: {}", userId, quota.getReason());
            return TaskCreationResult.builder()
                    .outcome(TaskCreationResult.Outcome.QUOTA_DENIED)
                    .message(quota.getReason())
                    .quota(quota)
                    .build();
        }

        Optional<VideoInfo> info = downloader.getVideoInfo(request.getVideoUrl());
        if (info.isEmpty()) {
            return TaskCreationResult.rejected(TaskCreationResult.Outcome.VIDEO_UNAVAILABLE,
                    "Could not get video information. Please check the URL.");
        }

        LearningTask task;
        synchronized (admissionLock) {
            if (atCapacity()) {
                return tooManyPending();
            }
            task = taskStore.createTask(userId, request.getSourceId(), info.get().getId(),
                    request.getVideoUrl(), info.get().getTitle(), mode,
                    Map.of(LearningTask.METADATA_VIDEO_FORMAT, format));
        }

        coordinator.submit(task.getId());
        return TaskCreationResult.builder()
                .outcome(TaskCreationResult.Outcome.CREATED)
                .task(task)
                .quota(quota)
                .build();
    }

    private boolean atCapacity() {
        return taskStore.countActiveTasks() >= maxActiveTasks;
    }

    private static TaskCreationResult tooManyPending() {
        return TaskCreationResult.rejected(TaskCreationResult.Outcome.TOO_MANY_PENDING,
                "Too many pending tasks. Please wait and try again.");
    }
}

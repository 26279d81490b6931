package com.example.SmartNews.service;

import com.example.SmartNews.dto.TaskUpdate;
import com.example.SmartNews.dto.TaskUpdateResult;
import com.example.SmartNews.entity.LearningTask;
import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.enums.TaskStatus;
import com.example.SmartNews.repository.LearningTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable task records. All writes to an existing task go through
 * {@link #updateTaskConditionally(String, TaskUpdate)}, which holds a row lock for the
 * duration of the read-modify-write.
 */
@Service
public class TaskStoreService {

    private static final Logger logger = LoggerFactory.getLogger(TaskStoreService.class);

    public static final int MAX_LIST_LIMIT = 100;

    private final LearningTaskRepository taskRepository;

    public TaskStoreService(LearningTaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Transactional
    public LearningTask createTask(String userId, String sourceId, String videoId,
                                   String videoUrl, String videoTitle, ProcessingMode processingMode) {
        return createTask(userId, sourceId, videoId, videoUrl, videoTitle, processingMode, Map.of());
    }

    @Transactional
    public LearningTask createTask(String userId, String sourceId, String videoId, String videoUrl,
                                   String videoTitle, ProcessingMode processingMode, Map<String, String> metadata) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (videoUrl == null || videoUrl.isBlank()) {
            throw new IllegalArgumentException("Video URL is required");
        }
        if (processingMode == null) {
            throw new IllegalArgumentException("Processing mode is required");
        }

        LocalDateTime now = LocalDateTime.now();
        LearningTask task = new LearningTask();
        task.setId(UUID.randomUUID().toString());
        task.setUserId(userId);
        task.setSourceId(sourceId != null ? sourceId : "");
        task.setVideoId(videoId != null ? videoId : "");
        task.setVideoUrl(videoUrl);
        task.setVideoTitle(videoTitle != null ? videoTitle : "");
        task.setStatus(TaskStatus.PENDING);
        task.setProcessingMode(processingMode);
        task.setProgress(0);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        task.setMetadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>());

        LearningTask saved = taskRepository.save(task);
        logger.info("Created task {} for user {} ({})", saved.getId(), userId, processingMode.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<LearningTask> getTask(String taskId) {
        return taskRepository.findById(taskId);
    }

    /**
     * Newest first.
     *
     * @param status optional filter, null for all statuses
     * @param limit  1..100
     */
    @Transactional(readOnly = true)
    public List<LearningTask> listUserTasks(String userId, TaskStatus status, int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        PageRequest page = PageRequest.of(0, limit);
        if (status != null) {
            return taskRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, page);
        }
        return taskRepository.findByUserIdOrderByCreatedAtDesc(userId, page);
    }

    /**
     * Applies the update and returns the resulting task, or the unchanged task when the
     * update was rejected. Empty when no task has the given id.
     */
    @Transactional
    public Optional<LearningTask> updateTask(String taskId, TaskUpdate update) {
        return Optional.ofNullable(updateTaskConditionally(taskId, update).getTask());
    }

    @Transactional
    public TaskUpdateResult updateTaskConditionally(String taskId, TaskUpdate update) {
        Optional<LearningTask> found = taskRepository.findByIdForUpdate(taskId);
        if (found.isEmpty()) {
            return TaskUpdateResult.notFound();
        }
        LearningTask task = found.get();
        TaskStatus current = task.getStatus();

        if (update.getExpectedStatuses() != null && !update.getExpectedStatuses().contains(current)) {
            logger.debug("Update of task {} rejected: status is {}, expected {}",
                    taskId, current, update.getExpectedStatuses());
            return TaskUpdateResult.rejected(task);
        }
        if (current.isTerminal() && update.getStatus() != null && update.getStatus() != current) {
            logger.warn("Update of task {} rejected: cannot move from {} to {}", taskId, current, update.getStatus());
            return TaskUpdateResult.rejected(task);
        }

        LocalDateTime now = LocalDateTime.now();
        if (update.getStatus() != null) {
            task.setStatus(update.getStatus());
            if (update.getStatus().isTerminal() && task.getCompletedAt() == null) {
                task.setCompletedAt(now);
            }
        }
        if (update.getProgress() != null) {
            int progress = Math.max(0, Math.min(100, update.getProgress()));
            int stored = task.getProgress() != null ? task.getProgress() : 0;
            // regressions are dropped until the task is terminal
            if (progress >= stored || current.isTerminal()) {
                task.setProgress(progress);
            }
        }
        if (update.getOutputFile() != null) {
            task.setOutputFile(update.getOutputFile());
        }
        if (update.getSubtitleFile() != null) {
            task.setSubtitleFile(update.getSubtitleFile());
        }
        if (update.getErrorMessage() != null) {
            task.setErrorMessage(update.getErrorMessage());
        }
        if (update.getMetadata() != null) {
            Map<String, String> merged = task.getMetadata() != null ? new HashMap<>(task.getMetadata()) : new HashMap<>();
            merged.putAll(update.getMetadata());
            task.setMetadata(merged);
        }
        task.setUpdatedAt(now);

        return TaskUpdateResult.applied(taskRepository.save(task));
    }

    /**
     * Moves a non-terminal task to CANCELLED. A worker still holding the task sees the
     * status on its next conditional update and stops.
     */
    @Transactional
    public TaskUpdateResult cancelTask(String taskId) {
        TaskUpdate update = TaskUpdate.builder()
                .status(TaskStatus.CANCELLED)
                .errorMessage("Cancelled by user")
                .build()
                .expecting(TaskStatus.PENDING, TaskStatus.DOWNLOADING, TaskStatus.PROCESSING);
        TaskUpdateResult result = updateTaskConditionally(taskId, update);
        if (result.isApplied()) {
            logger.info("Task {} cancelled", taskId);
        }
        return result;
    }

    @Transactional
    public boolean deleteTask(String taskId) {
        Optional<LearningTask> found = taskRepository.findById(taskId);
        if (found.isEmpty()) {
            return false;
        }
        LearningTask task = found.get();
        deleteFileQuietly(task.getOutputFile());
        deleteFileQuietly(task.getSubtitleFile());
        taskRepository.delete(task);
        logger.info("Deleted task {}", taskId);
        return true;
    }

    /**
     * Removes terminal tasks whose completion is older than {@code retention}, with their files.
     *
     * @return number of tasks removed
     */
    @Transactional
    public int cleanupOlderThan(Duration retention) {
        LocalDateTime cutoff = LocalDateTime.now().minus(retention);
        List<LearningTask> expired = taskRepository.findByStatusInAndCompletedAtBefore(TaskStatus.TERMINAL, cutoff);
        for (LearningTask task : expired) {
            deleteFileQuietly(task.getOutputFile());
            deleteFileQuietly(task.getSubtitleFile());
        }
        taskRepository.deleteAll(expired);
        if (!expired.isEmpty()) {
            logger.info("Cleaned up {} tasks completed before {}", expired.size(), cutoff);
        }
        return expired.size();
    }

    /**
     * Fails tasks left mid-flight by a previous process. Called once at startup, before any
     * worker runs.
     */
    @Transactional
    public int failInterruptedTasks() {
        List<LearningTask> interrupted = taskRepository.findByStatusIn(TaskStatus.ACTIVE);
        int failed = 0;
        for (LearningTask task : interrupted) {
            TaskUpdate update = TaskUpdate.builder()
                    .status(TaskStatus.FAILED)
                    .errorMessage("Interrupted by server restart")
                    .build()
                    .expecting(TaskStatus.PENDING, TaskStatus.DOWNLOADING, TaskStatus.PROCESSING);
            if (updateTaskConditionally(task.getId(), update).isApplied()) {
                failed++;
            }
        }
        if (failed > 0) {
            logger.warn("Marked {} interrupted tasks as failed", failed);
        }
        return failed;
    }

    @Transactional(readOnly = true)
    public long countActiveTasks() {
        return taskRepository.countByStatusIn(TaskStatus.ACTIVE);
    }

    private void deleteFileQuietly(String path) {
        if (path == null || path.isEmpty()) {
            return;
        }
        try {
            if (Files.deleteIfExists(Paths.get(path))) {
                logger.debug("Deleted file: {}", path);
            }
        } catch (IOException e) {
            logger.warn("Failed to delete file {}: {}", path, e.getMessage());
        }
    }
}

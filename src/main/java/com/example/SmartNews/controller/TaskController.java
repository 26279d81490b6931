package com.example.SmartNews.controller;

import com.example.SmartNews.dto.CreateTaskRequest;
import com.example.SmartNews.dto.TaskCreationResult;
import com.example.SmartNews.dto.TaskResponse;
import com.example.SmartNews.dto.TaskUpdateResult;
import com.example.SmartNews.entity.LearningTask;
import com.example.SmartNews.enums.TaskStatus;
import com.example.SmartNews.security.ApiKeyFilter;
import com.example.SmartNews.service.TaskService;
import com.example.SmartNews.service.TaskStoreService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
public class TaskController {
    private static final Logger logger = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;
    private final TaskStoreService taskStoreService;

    @PostMapping
    public ResponseEntity<?> createTask(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @Valid @RequestBody CreateTaskRequest request) {
        TaskCreationResult result = taskService.createTask(userId, request);
        if (result.isCreated()) {
            logger.info("Task created: id={}, user={}", result.getTask().getId(), userId);
            return ResponseEntity.ok(mapToResponse(result.getTask()));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("error", result.getMessage());
        body.put("outcome", result.getOutcome().name());
        if (result.getQuota() != null) {
            body.put("tier", result.getQuota().getTier());
            body.put("remainingToday", result.getQuota().getRemainingToday());
        }
        HttpStatus status = switch (result.getOutcome()) {
            case TOO_MANY_PENDING -> HttpStatus.TOO_MANY_REQUESTS;
            case QUOTA_DENIED -> HttpStatus.FORBIDDEN;
            default -> HttpStatus.BAD_REQUEST;
        };
        logger.warn("Task creation rejected for {}: {} ({})", userId, result.getOutcome(), result.getMessage());
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping
    public ResponseEntity<?> listTasks(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "20") int limit) {
        TaskStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = TaskStatus.valueOf(status.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", "Invalid status: " + status));
            }
        }
        List<TaskResponse> tasks = taskStoreService.listUserTasks(userId, filter, limit).stream()
                .map(this::mapToResponse)
                .toList();
        return ResponseEntity.ok(Map.of("tasks", tasks, "total", tasks.size()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getTask(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @PathVariable String id) {
        Optional<LearningTask> task = findOwnedTask(id, userId);
        if (task.isEmpty()) {
            return notFound("Task not found");
        }
        return ResponseEntity.ok(mapToResponse(task.get()));
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<?> downloadTaskFile(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @PathVariable String id) {
        Optional<LearningTask> found = findOwnedTask(id, userId);
        if (found.isEmpty()) {
            return notFound("Task not found");
        }
        LearningTask task = found.get();
        if (task.getStatus() != TaskStatus.COMPLETED) {
            return ResponseEntity.badRequest().body(Map.of("error", "Task not completed yet"));
        }
        if (task.getOutputFile() == null || task.getOutputFile().isEmpty()) {
            return notFound("Output file not found");
        }
        Path file = Paths.get(task.getOutputFile());
        if (!Files.isRegularFile(file)) {
            logger.warn("Output file missing on disk for task {}: {}", id, file);
            return notFound("File not found on server");
        }

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(downloadFilename(task))
                        .build()
                        .toString())
                .contentType(MediaType.parseMediaType("video/mp4"))
                .body(new FileSystemResource(file));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<?> cancelTask(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @PathVariable String id) {
        if (findOwnedTask(id, userId).isEmpty()) {
            return notFound("Task not found");
        }
        TaskUpdateResult result = taskStoreService.cancelTask(id);
        return switch (result.getOutcome()) {
            case APPLIED -> ResponseEntity.ok(mapToResponse(result.getTask()));
            case REJECTED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Task already " + result.getTask().getStatus().name().toLowerCase()));
            case NOT_FOUND -> notFound("Task not found");
        };
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteTask(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @PathVariable String id) {
        if (findOwnedTask(id, userId).isEmpty()) {
            return notFound("Task not found");
        }
        if (!taskStoreService.deleteTask(id)) {
            return notFound("Task not found");
        }
        return ResponseEntity.ok(Map.of("message", "Task deleted successfully"));
    }

    // tasks of other users are reported as missing
    private Optional<LearningTask> findOwnedTask(String id, String userId) {
        return taskStoreService.getTask(id).filter(task -> task.getUserId().equals(userId));
    }

    static String downloadFilename(LearningTask task) {
        String title = task.getVideoTitle() != null ? task.getVideoTitle() : "video";
        if (title.length() > 50) {
            title = title.substring(0, 50);
        }
        String name = (title + "_" + task.getVideoId()).replaceAll("[^A-Za-z0-9._-]", "_");
        return name + ".mp4";
    }

    private static ResponseEntity<Map<String, String>> notFound(String message) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", message));
    }

    private TaskResponse mapToResponse(LearningTask task) {
        String downloadUrl = null;
        if (task.getStatus() == TaskStatus.COMPLETED && task.getOutputFile() != null) {
            downloadUrl = "/api/v1/tasks/" + task.getId() + "/download";
        }
        return TaskResponse.builder()
                .id(task.getId())
                .userId(task.getUserId())
                .sourceId(task.getSourceId())
                .videoId(task.getVideoId())
                .videoUrl(task.getVideoUrl())
                .videoTitle(task.getVideoTitle())
                .status(task.getStatus().name().toLowerCase())
                .processingMode(task.getProcessingMode().getId())
                .progress(task.getProgress())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .completedAt(task.getCompletedAt())
                .downloadUrl(downloadUrl)
                .errorMessage(task.getErrorMessage())
                .build();
    }
}

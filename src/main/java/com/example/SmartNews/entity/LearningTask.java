package com.example.SmartNews.entity;

import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.enums.TaskStatus;
import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Data
@Entity
@Table(name = "learning_tasks",
        indexes = {
                @Index(name = "idx_tasks_user_id", columnList = "user_id"),
                @Index(name = "idx_tasks_user_status", columnList = "user_id, status"),
                @Index(name = "idx_tasks_status", columnList = "status")
        })
public class LearningTask {

    public static final String METADATA_VIDEO_FORMAT = "video_format";
    public static final String METADATA_REMOTE_KEY = "remote_key";

    @Id
    @Column(name = "id", length = 36, nullable = false, updatable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Column(name = "video_id", nullable = false)
    private String videoId;

    @Column(name = "video_url", nullable = false, length = 1024)
    private String videoUrl;

    @Column(name = "video_title", nullable = false, length = 512)
    private String videoTitle;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_mode", nullable = false, length = 20)
    private ProcessingMode processingMode;

    @Column(name = "progress", nullable = false)
    private Integer progress = 0;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "output_file", length = 1024)
    private String outputFile;

    @Column(name = "subtitle_file", length = 1024)
    private String subtitleFile;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Convert(converter = StringMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    private Map<String, String> metadata = new HashMap<>();
}

package com.example.SmartNews.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Builder
public class TaskResponse {
    private String id;
    private String userId;
    private String sourceId;
    private String videoId;
    private String videoUrl;
    private String videoTitle;
    private String status;
    private String processingMode;
    private Integer progress;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime completedAt;
    private String downloadUrl;
    private String errorMessage;
}

package com.example.SmartNews.dto;

import com.example.SmartNews.entity.LearningTask;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TaskCreationResult {

    public enum Outcome {
        CREATED,
        // soft queue-depth cap reached, caller should retry later
        TOO_MANY_PENDING,
        QUOTA_DENIED,
        VIDEO_UNAVAILABLE,
        INVALID_SOURCE
    }

    private Outcome outcome;
    private LearningTask task;
    private String message;
    private QuotaCheckResult quota;

    public boolean isCreated() {
        return outcome == Outcome.CREATED;
    }

    public static TaskCreationResult rejected(Outcome outcome, String message) {
        return TaskCreationResult.builder().outcome(outcome).message(message).build();
    }
}

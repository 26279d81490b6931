package com.example.SmartNews.dto;

import com.example.SmartNews.entity.LearningTask;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class TaskUpdateResult {

    public enum Outcome {
        APPLIED,
        REJECTED,
        NOT_FOUND
    }

    private Outcome outcome;
    private LearningTask task;

    public boolean isApplied() {
        return outcome == Outcome.APPLIED;
    }

    public static TaskUpdateResult applied(LearningTask task) {
        return new TaskUpdateResult(Outcome.APPLIED, task);
    }

    public static TaskUpdateResult rejected(LearningTask task) {
        return new TaskUpdateResult(Outcome.REJECTED, task);
    }

    public static TaskUpdateResult notFound() {
        return new TaskUpdateResult(Outcome.NOT_FOUND, null);
    }
}

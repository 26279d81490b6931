package com.example.SmartNews.dto;

import com.example.SmartNews.enums.TaskStatus;
import lombok.Builder;
import lombok.Data;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Partial update of a task. Null fields are left untouched.
 * When {@code expectedStatuses} is set the update is applied only if the
 * task is currently in one of those statuses.
 */
@Data
@Builder
public class TaskUpdate {
    private TaskStatus status;
    private Integer progress;
    private String outputFile;
    private String subtitleFile;
    private String errorMessage;
    private Map<String, String> metadata;
    private Set<TaskStatus> expectedStatuses;

    public static TaskUpdate progress(int progress) {
        return TaskUpdate.builder().progress(progress).build();
    }

    public TaskUpdate expecting(TaskStatus first, TaskStatus... rest) {
        this.expectedStatuses = EnumSet.of(first, rest);
        return this;
    }
}

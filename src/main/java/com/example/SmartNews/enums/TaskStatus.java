package com.example.SmartNews.enums;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING,
    DOWNLOADING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<TaskStatus> ACTIVE = EnumSet.of(PENDING, DOWNLOADING, PROCESSING);
    public static final Set<TaskStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}

package com.example.SmartNews.service.media;

/**
 * Receives transform progress as {@code current} out of {@code total} steps.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(int current, int total);

    static ProgressListener none() {
        return (current, total) -> { };
    }
}

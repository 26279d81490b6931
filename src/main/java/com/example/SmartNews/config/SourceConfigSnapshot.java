package com.example.SmartNews.config;

import com.example.SmartNews.entity.VideoSource;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SourceConfigSnapshot {

    private final Map<String, VideoSource> sources;
    private final LocalDateTime loadedAt;
    private final boolean fromFile;

    public SourceConfigSnapshot(Map<String, VideoSource> sources, boolean fromFile) {
        this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        this.loadedAt = LocalDateTime.now();
        this.fromFile = fromFile;
    }

    public Optional<VideoSource> getSource(String sourceId) {
        return Optional.ofNullable(sources.get(sourceId));
    }

    public List<VideoSource> getSources(boolean enabledOnly) {
        return sources.values().stream()
                .filter(source -> !enabledOnly || source.isEnabled())
                .toList();
    }

    public boolean isEmpty() {
        return sources.isEmpty();
    }

    public LocalDateTime getLoadedAt() {
        return loadedAt;
    }

    public boolean isFromFile() {
        return fromFile;
    }
}

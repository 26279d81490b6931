package com.example.SmartNews.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedArtifact {
    private String videoId;
    private String sourceId;
    private String formatId;
    private String filePath;
    private long fileSize;
    private LocalDateTime createdAt;
    private LocalDateTime lastAccessed;
    private int accessCount;
    private boolean hasSubtitle;
    private String subtitlePath;

    private static final String KEY_SEPARATOR = "@";

    /**
     * Builds {@code sourceId@videoId@formatId} with each part URL-encoded, so ids that
     * contain {@code _} or {@code /} can neither collide nor escape the cache directory.
     */
    public static String cacheKey(String videoId, String sourceId, String formatId) {
        return encode(sourceId) + KEY_SEPARATOR + encode(videoId) + KEY_SEPARATOR + encode(formatId);
    }

    private static String encode(String part) {
        return URLEncoder.encode(String.valueOf(part), StandardCharsets.UTF_8);
    }

    @JsonIgnore
    public String getCacheKey() {
        return cacheKey(videoId, sourceId, formatId);
    }
}

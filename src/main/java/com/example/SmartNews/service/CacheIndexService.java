package com.example.SmartNews.service;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.entity.CachedArtifact;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index of cached video files keyed by {@link CachedArtifact#cacheKey}.
 * An entry whose file is gone is dropped the next time it is looked up.
 */
@Service
public class CacheIndexService {

    private static final Logger logger = LoggerFactory.getLogger(CacheIndexService.class);
    private static final String INDEX_FILE = "cache_index.json";

    private final Path indexFile;
    private final ObjectMapper objectMapper;
    private final Map<String, CachedArtifact> entries;

    @Autowired
    public CacheIndexService(AppProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getStorage().getLocalPath()), objectMapper);
    }

    public CacheIndexService(Path storageRoot, ObjectMapper objectMapper) {
        this.indexFile = storageRoot.resolve(INDEX_FILE);
        this.objectMapper = objectMapper;
        this.entries = loadIndex();
    }

    public synchronized Optional<CachedArtifact> lookup(String videoId, String sourceId, String formatId) {
        String key = CachedArtifact.cacheKey(videoId, sourceId, formatId);
        CachedArtifact entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.getFilePath() == null || !Files.exists(Paths.get(entry.getFilePath()))) {
            entries.remove(key);
            persist();
            logger.info("Evicted stale cache entry {}", key);
            return Optional.empty();
        }
        entry.setLastAccessed(LocalDateTime.now());
        entry.setAccessCount(entry.getAccessCount() + 1);
        persist();
        return Optional.of(copyOf(entry));
    }

    /**
     * Adds or replaces the entry for the given key. The size is read from the file.
     */
    public synchronized CachedArtifact insert(String videoId, String sourceId, String formatId,
                                              Path filePath, boolean hasSubtitle, Path subtitlePath) {
        long size;
        try {
            size = Files.size(filePath);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read cached file " + filePath + ": " + e.getMessage(), e);
        }
        LocalDateTime now = LocalDateTime.now();
        CachedArtifact entry = CachedArtifact.builder()
                .videoId(videoId)
                .sourceId(sourceId)
                .formatId(formatId)
                .filePath(filePath.toString())
                .fileSize(size)
                .createdAt(now)
                .lastAccessed(now)
                .accessCount(1)
                .hasSubtitle(hasSubtitle)
                .subtitlePath(subtitlePath != null ? subtitlePath.toString() : null)
                .build();
        entries.put(entry.getCacheKey(), entry);
        persist();
        logger.info("Cached {} ({} bytes)", entry.getCacheKey(), size);
        return copyOf(entry);
    }

    public synchronized List<CachedArtifact> allEntries() {
        List<CachedArtifact> copies = new ArrayList<>(entries.size());
        for (CachedArtifact entry : entries.values()) {
            copies.add(copyOf(entry));
        }
        return copies;
    }

    /**
     * Drops the index entry only; the caller owns the files.
     */
    public synchronized boolean remove(String cacheKey) {
        if (entries.remove(cacheKey) == null) {
            return false;
        }
        persist();
        return true;
    }

    /**
     * Deletes the cached file, its subtitle and the index entry.
     *
     * @return bytes freed, 0 when the key is unknown
     */
    public synchronized long removeWithFiles(String cacheKey) {
        CachedArtifact entry = entries.remove(cacheKey);
        if (entry == null) {
            return 0L;
        }
        long freed = deleteIfPresent(entry.getFilePath());
        freed += deleteIfPresent(entry.getSubtitlePath());
        persist();
        logger.debug("Removed cache entry {} ({} bytes)", cacheKey, freed);
        return freed;
    }

    private long deleteIfPresent(String path) {
        if (path == null) {
            return 0L;
        }
        Path file = Paths.get(path);
        try {
            long size = Files.exists(file) ? Files.size(file) : 0L;
            return Files.deleteIfExists(file) ? size : 0L;
        } catch (IOException e) {
            logger.warn("Failed to delete cached file {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    private Map<String, CachedArtifact> loadIndex() {
        if (Files.exists(indexFile)) {
            try {
                Map<String, CachedArtifact> loaded = objectMapper.readValue(indexFile.toFile(),
                        new TypeReference<LinkedHashMap<String, CachedArtifact>>() {});
                // re-keyed from the entry fields so snapshots written with an older key format stay reachable
                Map<String, CachedArtifact> rekeyed = new LinkedHashMap<>();
                for (CachedArtifact entry : loaded.values()) {
                    rekeyed.put(entry.getCacheKey(), entry);
                }
                logger.info("Loaded {} cache entries from {}", rekeyed.size(), indexFile);
                return rekeyed;
            } catch (IOException e) {
                logger.error("Failed to load cache index from {}", indexFile, e);
            }
        }
        return new LinkedHashMap<>();
    }

    private void persist() {
        try {
            Files.createDirectories(indexFile.getParent());
            Path tmp = indexFile.resolveSibling(INDEX_FILE + ".tmp");
            objectMapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, indexFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.error("Failed to persist cache index to {}", indexFile, e);
        }
    }

    private static CachedArtifact copyOf(CachedArtifact entry) {
        return CachedArtifact.builder()
                .videoId(entry.getVideoId())
                .sourceId(entry.getSourceId())
                .formatId(entry.getFormatId())
                .filePath(entry.getFilePath())
                .fileSize(entry.getFileSize())
                .createdAt(entry.getCreatedAt())
                .lastAccessed(entry.getLastAccessed())
                .accessCount(entry.getAccessCount())
                .hasSubtitle(entry.isHasSubtitle())
                .subtitlePath(entry.getSubtitlePath())
                .build();
    }
}

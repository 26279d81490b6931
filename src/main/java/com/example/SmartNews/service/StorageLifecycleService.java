package com.example.SmartNews.service;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.dto.CleanupResult;
import com.example.SmartNews.dto.MaintenanceReport;
import com.example.SmartNews.dto.StorageStats;
import com.example.SmartNews.entity.CachedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Keeps the local video store inside its time and size budget.
 * <p>
 * Usage is measured over the {@code cache/} and {@code processed/} directories under the
 * storage root. Eviction only ever removes files known to the {@link CacheIndexService},
 * plus orphaned {@code *_processed.*} outputs once they pass the expiry cutoff.
 * <p>
 * Running tasks hold a lease on the cache key of their input
 * ({@link #retainCacheEntry}/{@link #releaseCacheEntry}); leased entries are never evicted.
 */
@Service
public class StorageLifecycleService {
    private static final Logger logger = LoggerFactory.getLogger(StorageLifecycleService.class);

    static final double QUOTA_TARGET_RATIO = 0.8;
    private static final String PROCESSED_GLOB = "*_processed.*";

    private final Path storageRoot;
    private final Path cacheDir;
    private final Path processedDir;
    private final long quotaBytes;
    private final int cacheHours;
    private final CacheIndexService cacheIndex;
    private final RemoteStorageService remoteStorage;
    private final ReentrantLock maintenanceLock = new ReentrantLock();
    // cache key -> number of running tasks using it; also guards check-then-evict
    private final Map<String, Integer> cacheLeases = new HashMap<>();

    @Autowired
    public StorageLifecycleService(AppProperties properties, CacheIndexService cacheIndex, RemoteStorageService remoteStorage) {
        this(Paths.get(properties.getStorage().getLocalPath()),
                properties.getStorage().getQuotaBytes(),
                properties.getStorage().getCacheHours(),
                cacheIndex,
                remoteStorage);
    }

    public StorageLifecycleService(Path storageRoot, long quotaBytes, int cacheHours,
                                   CacheIndexService cacheIndex, RemoteStorageService remoteStorage) {
        this.storageRoot = storageRoot;
        this.cacheDir = storageRoot.resolve("cache");
        this.processedDir = storageRoot.resolve("processed");
        this.quotaBytes = quotaBytes;
        this.cacheHours = cacheHours;
        this.cacheIndex = cacheIndex;
        this.remoteStorage = remoteStorage;
        try {
            Files.createDirectories(cacheDir);
            Files.createDirectories(processedDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create storage directories under " + storageRoot, e);
        }
        logger.info("Storage initialized at {}: quota={} bytes, cache hours={}", storageRoot, quotaBytes, cacheHours);
    }

    public Path getCacheDir() {
        return cacheDir;
    }

    public Path getProcessedDir() {
        return processedDir;
    }

    public StorageStats getStorageStats() {
        long totalBytes = 0;
        int fileCount = 0;
        FileTime oldestTime = null;
        FileTime newestTime = null;
        String oldestFile = null;
        String newestFile = null;

        for (Path dir : List.of(cacheDir, processedDir)) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (Stream<Path> files = Files.walk(dir)) {
                for (Path file : (Iterable<Path>) files.filter(Files::isRegularFile)::iterator) {
                    long size;
                    FileTime modified;
                    try {
                        size = Files.size(file);
                        modified = Files.getLastModifiedTime(file);
                    } catch (IOException e) {
                        logger.debug("Skipping unreadable file {}: {}", file, e.getMessage());
                        continue;
                    }
                    fileCount++;
                    totalBytes += size;
                    if (oldestTime == null || modified.compareTo(oldestTime) < 0) {
                        oldestTime = modified;
                        oldestFile = file.toString();
                    }
                    if (newestTime == null || modified.compareTo(newestTime) > 0) {
                        newestTime = modified;
                        newestFile = file.toString();
                    }
                }
            } catch (IOException e) {
                logger.warn("Failed to scan {}: {}", dir, e.getMessage());
            }
        }

        return StorageStats.builder()
                .totalBytes(totalBytes)
                .fileCount(fileCount)
                .oldestFile(oldestFile)
                .newestFile(newestFile)
                .quotaUsedPercent(quotaBytes > 0 ? totalBytes * 100.0 / quotaBytes : 0.0)
                .build();
    }

    /**
     * Removes cache entries not accessed within the cache window, then orphaned processed
     * outputs older than the same cutoff.
     */
    public CleanupResult cleanupExpired() {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(cacheHours);
        int filesRemoved = 0;
        long bytesFreed = 0;

        for (CachedArtifact entry : cacheIndex.allEntries()) {
            if (entry.getLastAccessed() == null || entry.getLastAccessed().isBefore(cutoff)) {
                boolean fileExisted = entry.getFilePath() != null && Files.exists(Paths.get(entry.getFilePath()));
                long freed = evictUnlessLeased(entry.getCacheKey());
                if (freed < 0) {
                    continue;
                }
                bytesFreed += freed;
                if (fileExisted) {
                    filesRemoved++;
                    logger.info("Removed expired: {}", entry.getFilePath());
                }
            }
        }

        if (Files.isDirectory(processedDir)) {
            try (DirectoryStream<Path> orphans = Files.newDirectoryStream(processedDir, PROCESSED_GLOB)) {
                for (Path orphan : orphans) {
                    try {
                        LocalDateTime modified = LocalDateTime.ofInstant(
                                Files.getLastModifiedTime(orphan).toInstant(), ZoneId.systemDefault());
                        if (modified.isBefore(cutoff)) {
                            long size = Files.size(orphan);
                            Files.delete(orphan);
                            bytesFreed += size;
                            filesRemoved++;
                            logger.info("Removed orphan: {}", orphan.getFileName());
                        }
                    } catch (IOException e) {
                        logger.warn("Failed to remove orphan {}: {}", orphan, e.getMessage());
                    }
                }
            } catch (IOException e) {
                logger.warn("Failed to scan {} for orphans: {}", processedDir, e.getMessage());
            }
        }

        if (filesRemoved > 0) {
            logger.info("Expiry cleanup: removed {} files, freed {} bytes", filesRemoved, bytesFreed);
        }
        return new CleanupResult(filesRemoved, bytesFreed);
    }

    /**
     * Evicts least recently accessed cache entries until usage is at or below 80% of quota.
     * Does nothing while usage is within quota.
     */
    public CleanupResult cleanupToQuota() {
        long currentSize = getStorageStats().getTotalBytes();
        if (currentSize <= quotaBytes) {
            return CleanupResult.none();
        }

        long targetSize = (long) (quotaBytes * QUOTA_TARGET_RATIO);
        int filesRemoved = 0;
        long bytesFreed = 0;

        List<CachedArtifact> byAccess = cacheIndex.allEntries().stream()
                .sorted(Comparator.comparing(CachedArtifact::getLastAccessed,
                        Comparator.nullsFirst(Comparator.naturalOrder())))
                .toList();

        for (CachedArtifact entry : byAccess) {
            if (currentSize <= targetSize) {
                break;
            }
            long freed = evictUnlessLeased(entry.getCacheKey());
            if (freed > 0) {
                currentSize -= freed;
                bytesFreed += freed;
                filesRemoved++;
                logger.info("Quota cleanup: removed {}", entry.getFilePath());
            }
        }

        if (currentSize > targetSize) {
            logger.warn("Quota cleanup finished above target: {} bytes used, target {}", currentSize, targetSize);
        }
        logger.info("Quota cleanup: removed {} files, freed {} bytes", filesRemoved, bytesFreed);
        return new CleanupResult(filesRemoved, bytesFreed);
    }

    /**
     * Expiry cleanup followed by quota cleanup. Concurrent callers run one after another.
     */
    public MaintenanceReport runMaintenance() {
        maintenanceLock.lock();
        try {
            StorageStats before = getStorageStats();
            CleanupResult expired = cleanupExpired();
            CleanupResult quota = cleanupToQuota();
            StorageStats after = getStorageStats();

            MaintenanceReport report = MaintenanceReport.builder()
                    .timestamp(LocalDateTime.now())
                    .storageBefore(before)
                    .expiredCleanup(expired)
                    .quotaCleanup(quota)
                    .storageAfter(after)
                    .build();
            logger.info("Maintenance complete: {} -> {} bytes, {} files removed",
                    before.getTotalBytes(), after.getTotalBytes(),
                    expired.getFilesRemoved() + quota.getFilesRemoved());
            return report;
        } finally {
            maintenanceLock.unlock();
        }
    }

    /**
     * Marks the cache key as in use by a running task. Call before {@link #findCached} so an
     * entry found there cannot be evicted until the matching {@link #releaseCacheEntry}.
     */
    public void retainCacheEntry(String cacheKey) {
        synchronized (cacheLeases) {
            cacheLeases.merge(cacheKey, 1, Integer::sum);
        }
    }

    public void releaseCacheEntry(String cacheKey) {
        synchronized (cacheLeases) {
            cacheLeases.computeIfPresent(cacheKey, (key, count) -> count > 1 ? count - 1 : null);
        }
    }

    public boolean isCacheEntryInUse(String cacheKey) {
        synchronized (cacheLeases) {
            return cacheLeases.containsKey(cacheKey);
        }
    }

    /**
     * @return bytes freed, or -1 when a running task holds the entry
     */
    private long evictUnlessLeased(String cacheKey) {
        synchronized (cacheLeases) {
            if (cacheLeases.containsKey(cacheKey)) {
                logger.info("Keeping cache entry {}: in use by a running task", cacheKey);
                return -1L;
            }
            return cacheIndex.removeWithFiles(cacheKey);
        }
    }

    public Optional<CachedArtifact> findCached(String videoId, String sourceId, String formatId) {
        if (videoId == null || videoId.isBlank()) {
            return Optional.empty();
        }
        return cacheIndex.lookup(videoId, sourceId, formatId);
    }

    /**
     * Moves a fresh download (and its subtitle) into {@code cache/} and indexes it. When
     * another task cached the same key first, that entry is returned and the fresh files
     * are deleted. Empty when the move fails; the files are then left where they were.
     */
    public Optional<CachedArtifact> cacheDownload(String videoId, String sourceId, String formatId,
                                                  Path file, Path subtitle) {
        if (videoId == null || videoId.isBlank() || file == null) {
            return Optional.empty();
        }
        String key = CachedArtifact.cacheKey(videoId, sourceId, formatId);
        synchronized (cacheLeases) {
            Optional<CachedArtifact> existing = cacheIndex.lookup(videoId, sourceId, formatId);
            if (existing.isPresent()) {
                logger.info("Cache entry {} was stored by another task, dropping duplicate download {}", key, file);
                deleteQuietly(file);
                deleteQuietly(subtitle);
                return existing;
            }
            Path target = cacheDir.resolve(key + extensionOf(file));
            Path subtitleTarget = subtitle != null ? cacheDir.resolve(key + ".en" + extensionOf(subtitle)) : null;
            try {
                Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
                if (subtitle != null && Files.exists(subtitle)) {
                    Files.move(subtitle, subtitleTarget, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    subtitleTarget = null;
                }
            } catch (IOException e) {
                logger.warn("Could not move {} into the cache: {}", file, e.getMessage());
                return Optional.empty();
            }
            return Optional.of(cacheIndex.insert(videoId, sourceId, formatId, target, subtitleTarget != null, subtitleTarget));
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Failed to delete {}: {}", file, e.getMessage());
        }
    }

    public List<CachedArtifact> getCacheEntries() {
        return cacheIndex.allEntries();
    }

    public long getQuotaBytes() {
        return quotaBytes;
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }

    public Optional<String> syncToRemote(Path file) {
        return remoteStorage.upload(file);
    }

    public OptionalLong getRemoteUsage() {
        return remoteStorage.usedBytes();
    }

    public Path getStorageRoot() {
        return storageRoot;
    }
}

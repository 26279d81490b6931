package com.example.SmartNews.service;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.dto.CleanupResult;
import com.example.SmartNews.dto.MaintenanceReport;
import com.example.SmartNews.dto.StorageStats;
import com.example.SmartNews.entity.CachedArtifact;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StorageLifecycleServiceTest {

    @TempDir
    Path root;

    private ObjectMapper objectMapper;
    private RemoteStorageService remoteStorage;
    private final Map<String, CachedArtifact> seeded = new LinkedHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        remoteStorage = new RemoteStorageService(new AppProperties());
        Files.createDirectories(root.resolve("cache"));
        Files.createDirectories(root.resolve("processed"));
    }

    private Path seedEntry(String videoId, int size, LocalDateTime lastAccessed) throws IOException {
        Path file = Files.write(root.resolve("cache").resolve(videoId + ".mp4"), new byte[size]);
        CachedArtifact entry = CachedArtifact.builder()
                .videoId(videoId)
                .sourceId("bbc")
                .formatId("720p")
                .filePath(file.toString())
                .fileSize(size)
                .createdAt(lastAccessed)
                .lastAccessed(lastAccessed)
                .accessCount(1)
                .build();
        seeded.put(entry.getCacheKey(), entry);
        objectMapper.writeValue(root.resolve("cache_index.json").toFile(), seeded);
        return file;
    }

    private StorageLifecycleService newStorage(long quotaBytes) {
        CacheIndexService cacheIndex = new CacheIndexService(root, objectMapper);
        return new StorageLifecycleService(root, quotaBytes, 24, cacheIndex, remoteStorage);
    }

    @Test
    void statsCoverCacheAndProcessedDirectories() throws Exception {
        Files.write(root.resolve("cache").resolve("a.mp4"), new byte[300]);
        Files.write(root.resolve("processed").resolve("t1_processed.mp4"), new byte[200]);

        StorageStats stats = newStorage(1000).getStorageStats();

        assertThat(stats.getTotalBytes()).isEqualTo(500);
        assertThat(stats.getFileCount()).isEqualTo(2);
        assertThat(stats.getQuotaUsedPercent()).isEqualTo(50.0);
        assertThat(stats.getOldestFile()).isNotNull();
        assertThat(stats.getNewestFile()).isNotNull();
    }

    @Test
    void zeroQuotaReportsZeroPercent() throws Exception {
        Files.write(root.resolve("cache").resolve("a.mp4"), new byte[300]);

        assertThat(newStorage(0).getStorageStats().getQuotaUsedPercent()).isZero();
    }

    @Test
    void quotaCleanupIsNoOpWithinQuota() throws Exception {
        seedEntry("a", 400, LocalDateTime.now().minusHours(3));

        CleanupResult result = newStorage(1000).cleanupToQuota();

        assertThat(result.getFilesRemoved()).isZero();
        assertThat(result.getBytesFreed()).isZero();
    }

    @Test
    void quotaCleanupEvictsLeastRecentlyUsedDownToTarget() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        Path oldest = seedEntry("a", 400, now.minusHours(3));
        Path middle = seedEntry("b", 400, now.minusHours(2));
        Path newest = seedEntry("c", 400, now.minusHours(1));
        StorageLifecycleService storage = newStorage(1000);

        CleanupResult result = storage.cleanupToQuota();

        assertThat(result.getFilesRemoved()).isEqualTo(1);
        assertThat(result.getBytesFreed()).isEqualTo(400);
        assertThat(oldest).doesNotExist();
        assertThat(middle).exists();
        assertThat(newest).exists();
        assertThat(storage.getStorageStats().getTotalBytes()).isLessThanOrEqualTo(800);
        assertThat(storage.getCacheEntries()).extracting(CachedArtifact::getVideoId).containsExactlyInAnyOrder("b", "c");
    }

    @Test
    void expiryCleanupRemovesStaleEntriesAndOldOrphans() throws Exception {
        Path stale = seedEntry("old", 100, LocalDateTime.now().minusHours(48));
        Path fresh = seedEntry("new", 100, LocalDateTime.now().minusHours(1));
        Path oldOrphan = Files.write(root.resolve("processed").resolve("t1_processed.mp4"), new byte[50]);
        Files.setLastModifiedTime(oldOrphan, FileTime.from(Instant.now().minus(48, ChronoUnit.HOURS)));
        Path recentOutput = Files.write(root.resolve("processed").resolve("t2_processed.mp4"), new byte[50]);
        StorageLifecycleService storage = newStorage(10_000);

        CleanupResult result = storage.cleanupExpired();

        assertThat(result.getFilesRemoved()).isEqualTo(2);
        assertThat(result.getBytesFreed()).isEqualTo(150);
        assertThat(stale).doesNotExist();
        assertThat(oldOrphan).doesNotExist();
        assertThat(fresh).exists();
        assertThat(recentOutput).exists();
        assertThat(storage.getCacheEntries()).extracting(CachedArtifact::getVideoId).containsExactly("new");
    }

    @Test
    void maintenanceReportsBeforeAndAfter() throws Exception {
        seedEntry("old", 100, LocalDateTime.now().minusHours(48));
        seedEntry("new", 100, LocalDateTime.now());

        MaintenanceReport report = newStorage(10_000).runMaintenance();

        assertThat(report.getStorageBefore().getTotalBytes()).isEqualTo(200);
        assertThat(report.getStorageAfter().getTotalBytes()).isEqualTo(100);
        assertThat(report.getExpiredCleanup().getFilesRemoved()).isEqualTo(1);
        assertThat(report.getQuotaCleanup().getFilesRemoved()).isZero();
        assertThat(report.getTimestamp()).isNotNull();
    }

    @Test
    void downloadsAreMovedIntoCacheAndFoundAgain() throws Exception {
        Path temp = Files.createDirectories(root.resolve("temp"));
        Path video = Files.write(temp.resolve("vid9.mp4"), new byte[64]);
        Path subtitle = Files.writeString(temp.resolve("vid9.en.srt"), "1\n");
        StorageLifecycleService storage = newStorage(10_000);

        CachedArtifact entry = storage.cacheDownload("vid9", "bbc", "480p", video, subtitle).orElseThrow();

        assertThat(video).doesNotExist();
        assertThat(Path.of(entry.getFilePath())).exists().hasParent(storage.getCacheDir());
        assertThat(entry.isHasSubtitle()).isTrue();
        assertThat(Path.of(entry.getSubtitlePath()).getFileName().toString()).isEqualTo("bbc@vid9@480p.en.srt");
        assertThat(storage.findCached("vid9", "bbc", "480p")).isPresent();
        assertThat(storage.findCached("vid9", "bbc", "720p")).isEmpty();
        assertThat(storage.findCached("", "bbc", "480p")).isEmpty();
    }

    @Test
    void entriesInUseSurviveQuotaAndExpiryCleanup() throws Exception {
        LocalDateTime now = LocalDateTime.now();
        Path stale = seedEntry("a", 600, now.minusHours(48));
        Path recent = seedEntry("b", 600, now.minusHours(1));
        StorageLifecycleService storage = newStorage(1000);
        String staleKey = CachedArtifact.cacheKey("a", "bbc", "720p");
        String recentKey = CachedArtifact.cacheKey("b", "bbc", "720p");
        storage.retainCacheEntry(staleKey);
        storage.retainCacheEntry(recentKey);

        MaintenanceReport report = storage.runMaintenance();

        assertThat(stale).exists();
        assertThat(recent).exists();
        assertThat(report.getExpiredCleanup().getFilesRemoved()).isZero();
        assertThat(report.getQuotaCleanup().getFilesRemoved()).isZero();

        storage.releaseCacheEntry(staleKey);
        storage.releaseCacheEntry(recentKey);
        storage.runMaintenance();

        assertThat(stale).doesNotExist();
        assertThat(recent).exists();
    }

    @Test
    void leaseIsHeldUntilEveryHolderReleases() throws Exception {
        Path file = seedEntry("a", 100, LocalDateTime.now().minusHours(48));
        StorageLifecycleService storage = newStorage(10_000);
        String key = CachedArtifact.cacheKey("a", "bbc", "720p");
        storage.retainCacheEntry(key);
        storage.retainCacheEntry(key);

        storage.releaseCacheEntry(key);
        storage.cleanupExpired();

        assertThat(storage.isCacheEntryInUse(key)).isTrue();
        assertThat(file).exists();

        storage.releaseCacheEntry(key);
        storage.cleanupExpired();

        assertThat(storage.isCacheEntryInUse(key)).isFalse();
        assertThat(file).doesNotExist();
    }

    @Test
    void duplicateDownloadOfCachedKeyIsDropped() throws Exception {
        StorageLifecycleService storage = newStorage(10_000);
        Path first = Files.write(Files.createDirectories(root.resolve("temp/t1")).resolve("vid9.mp4"), new byte[64]);
        Path second = Files.write(Files.createDirectories(root.resolve("temp/t2")).resolve("vid9.mp4"), new byte[32]);
        CachedArtifact stored = storage.cacheDownload("vid9", "bbc", "480p", first, null).orElseThrow();

        CachedArtifact again = storage.cacheDownload("vid9", "bbc", "480p", second, null).orElseThrow();

        assertThat(again.getFilePath()).isEqualTo(stored.getFilePath());
        assertThat(again.getFileSize()).isEqualTo(64);
        assertThat(Files.size(Path.of(stored.getFilePath()))).isEqualTo(64);
        assertThat(second).doesNotExist();
        assertThat(storage.getCacheEntries()).hasSize(1);
    }

    @Test
    void remoteUsageIsEmptyWhenSyncDisabled() throws Exception {
        StorageLifecycleService storage = newStorage(1000);
        Path output = Files.write(storage.getProcessedDir().resolve("t1_processed.mp4"), new byte[1]);

        assertThat(storage.syncToRemote(output)).isEmpty();
        assertThat(storage.getRemoteUsage()).isEmpty();
    }
}

package com.example.SmartNews.worker;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.dto.DownloadResult;
import com.example.SmartNews.dto.TaskUpdate;
import com.example.SmartNews.dto.TaskUpdateResult;
import com.example.SmartNews.dto.TransformRequest;
import com.example.SmartNews.dto.TransformResult;
import com.example.SmartNews.entity.CachedArtifact;
import com.example.SmartNews.entity.LearningTask;
import com.example.SmartNews.enums.TaskStatus;
import com.example.SmartNews.service.QuotaLedgerService;
import com.example.SmartNews.service.StorageLifecycleService;
import com.example.SmartNews.service.TaskStoreService;
import com.example.SmartNews.service.media.FfmpegVideoTransformer;
import com.example.SmartNews.service.media.ProgressListener;
import com.example.SmartNews.service.media.TransformException;
import com.example.SmartNews.service.media.VideoDownloader;
import com.example.SmartNews.service.media.VideoTransformer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs accepted tasks in the background: download, transform, complete.
 * Downloads land in a per-task work directory under the temp dir, then move into the
 * storage cache where later tasks for the same source, video and format reuse them. A task
 * holds a lease on its cache key from lookup to completion so maintenance cannot evict
 * the input it is working on.
 * <p>
 * Each step after the first is written conditionally on the status the worker expects the
 * task to be in. When a step is rejected (the task was cancelled meanwhile) the worker
 * cleans up its files and stops without touching the record again.
 * Usage is charged to the owner only when the task reaches COMPLETED.
 */
@Component
public class TaskExecutionCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(TaskExecutionCoordinator.class);

    static final int PROGRESS_DOWNLOADING = 10;
    static final int PROGRESS_DOWNLOADED = 40;
    static final int PROGRESS_PROCESSING = 50;
    static final int PROGRESS_TRANSFORM_END = 90;
    static final int PROGRESS_FINALIZING = 95;

    private final TaskStoreService taskStore;
    private final QuotaLedgerService quotaLedger;
    private final VideoDownloader downloader;
    private final VideoTransformer transformer;
    private final TaskProcessingLock processingLock;
    private final StorageLifecycleService storage;
    private final String whisperModel;
    private final String defaultFormat;
    private final Path tempDir;
    private final ExecutorService executor;

    @Autowired
    public TaskExecutionCoordinator(TaskStoreService taskStore,
                                    QuotaLedgerService quotaLedger,
                                    VideoDownloader downloader,
                                    VideoTransformer transformer,
                                    TaskProcessingLock processingLock,
                                    StorageLifecycleService storage,
                                    AppProperties properties) {
        this.taskStore = taskStore;
        this.quotaLedger = quotaLedger;
        this.downloader = downloader;
        this.transformer = transformer;
        this.processingLock = processingLock;
        this.storage = storage;
        this.whisperModel = properties.getWhisperModel();
        this.defaultFormat = properties.getStorage().getDefaultFormat();
        this.tempDir = Paths.get(properties.getTempDir());

        int workers = Math.max(1, properties.getTasks().getMaxConcurrent());
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                workers,
                workers,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> {
                    Thread thread = new Thread(runnable, "task-worker-" + threadCount.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        logger.info("Task executor started with {} workers", workers);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedTasks() {
        taskStore.failInterruptedTasks();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Queues the task for background execution and returns immediately.
     */
    public void submit(String taskId) {
        executor.execute(() -> runTask(taskId));
        logger.info("Task [{}] queued for execution", taskId);
    }

    /**
     * Executes the task on the calling thread, holding a processing slot for the duration.
     */
    public void runTask(String taskId) {
        if (!processingLock.acquire(taskId)) {
            update(taskId, TaskUpdate.builder()
                    .status(TaskStatus.FAILED)
                    .errorMessage("Timed out waiting for a processing slot")
                    .build()
                    .expecting(TaskStatus.PENDING));
            return;
        }
        try {
            execute(taskId);
        } catch (RuntimeException e) {
            logger.error("[Task {}] Task failed: {}", taskId, e.getMessage(), e);
            update(taskId, TaskUpdate.builder()
                    .status(TaskStatus.FAILED)
                    .errorMessage(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build()
                    .expecting(TaskStatus.PENDING, TaskStatus.DOWNLOADING, TaskStatus.PROCESSING));
        } finally {
            processingLock.release(taskId);
        }
    }

    private void execute(String taskId) {
        Optional<LearningTask> found = taskStore.getTask(taskId);
        if (found.isEmpty()) {
            logger.warn("[Task {}] Not found, skipping", taskId);
            return;
        }
        LearningTask task = found.get();
        String owner = task.getUserId();

        // Step 1: download
        logger.info("[Task {}] Starting download", taskId);
        if (!update(taskId, TaskUpdate.builder()
                .status(TaskStatus.DOWNLOADING)
                .progress(PROGRESS_DOWNLOADING)
                .build()
                .expecting(TaskStatus.PENDING))) {
            return;
        }

        String format = formatOf(task);
        String cacheKey = CachedArtifact.cacheKey(task.getVideoId(), task.getSourceId(), format);
        Path workDir = tempDir.resolve(taskId);
        Path input = null;
        boolean fromCache = false;
        Path keep = null;
        storage.retainCacheEntry(cacheKey);
        try {
            Optional<CachedArtifact> cached = storage.findCached(task.getVideoId(), task.getSourceId(), format);
            if (cached.isPresent()) {
                input = Paths.get(cached.get().getFilePath());
                fromCache = true;
                logger.info("[Task {}] Using cached download: {}", taskId, input);
            } else {
                DownloadResult download = downloader.download(task.getVideoUrl(), format, workDir);
                if (download == null || !download.isSuccess() || download.getFilePath() == null) {
                    String error = download != null && download.getError() != null ? download.getError() : "Download failed";
                    logger.warn("[Task {}] Download failed: {}", taskId, error);
                    update(taskId, TaskUpdate.builder()
                            .status(TaskStatus.FAILED)
                            .errorMessage(error)
                            .build()
                            .expecting(TaskStatus.DOWNLOADING));
                    return;
                }
                logger.info("[Task {}] Download completed: {}", taskId, download.getFilePath());
                input = download.getFilePath();
                Optional<CachedArtifact> stored = storage.cacheDownload(task.getVideoId(), task.getSourceId(), format,
                        download.getFilePath(), download.getSubtitlePath());
                if (stored.isPresent()) {
                    input = Paths.get(stored.get().getFilePath());
                    fromCache = true;
                }
            }

            if (!update(taskId, TaskUpdate.progress(PROGRESS_DOWNLOADED).expecting(TaskStatus.DOWNLOADING))
                    || !update(taskId, TaskUpdate.builder()
                            .status(TaskStatus.PROCESSING)
                            .progress(PROGRESS_PROCESSING)
                            .build()
                            .expecting(TaskStatus.DOWNLOADING))) {
                discardInput(input, fromCache);
                return;
            }

            // Step 2: transform
            logger.info("[Task {}] Starting processing (mode: {})", taskId, task.getProcessingMode().getId());
            Path output = storage.getProcessedDir().resolve(taskId + "_processed.mp4");
            TransformRequest request = TransformRequest.builder()
                    .inputPath(input)
                    .outputPath(output)
                    .mode(task.getProcessingMode())
                    .sourceUrl(task.getVideoUrl())
                    .modelHint(whisperModel)
                    .build();

            TransformResult result;
            try {
                result = transformer.process(request, progressListener(taskId));
            } catch (IOException | TransformException e) {
                logger.error("[Task {}] Processing failed: {}", taskId, e.getMessage(), e);
                update(taskId, TaskUpdate.builder()
                        .status(TaskStatus.FAILED)
                        .errorMessage(e.getMessage())
                        .build()
                        .expecting(TaskStatus.PROCESSING));
                discardInput(input, fromCache);
                deleteQuietly(output);
                return;
            }
            Path processed = result != null && result.getOutputPath() != null ? result.getOutputPath() : output;
            Path subtitle = result != null ? result.getSubtitlePath() : null;
            logger.info("[Task {}] Processing completed: {}", taskId, processed);

            if (!update(taskId, TaskUpdate.progress(PROGRESS_FINALIZING).expecting(TaskStatus.PROCESSING))) {
                discardInput(input, fromCache);
                deleteQuietly(processed);
                deleteQuietly(subtitle);
                return;
            }

            if (!processed.equals(input)) {
                discardInput(input, fromCache);
            }
            // from here on the input is either gone or is the output itself
            input = null;
            keep = processed;

            // Step 3: complete and charge usage
            TaskUpdate completion = TaskUpdate.builder()
                    .status(TaskStatus.COMPLETED)
                    .progress(100)
                    .outputFile(processed.toString())
                    .subtitleFile(subtitle != null ? subtitle.toString() : null)
                    .build()
                    .expecting(TaskStatus.PROCESSING);
            if (!update(taskId, completion)) {
                deleteQuietly(processed);
                deleteQuietly(subtitle);
                return;
            }
            quotaLedger.recordTask(owner, sizeOf(processed));
            logger.info("[Task {}] Task completed successfully", taskId);

            storage.syncToRemote(processed).ifPresent(key ->
                    update(taskId, TaskUpdate.builder()
                            .metadata(Map.of(LearningTask.METADATA_REMOTE_KEY, key))
                            .build()));
        } catch (RuntimeException e) {
            if (input != null) {
                discardInput(input, fromCache);
            }
            throw e;
        } finally {
            storage.releaseCacheEntry(cacheKey);
            deleteWorkDir(workDir, keep);
        }
    }

    /**
     * Maps transform progress linearly onto 50..90.
     */
    static int mapTransformProgress(int current, int total) {
        double fraction = (double) current / Math.max(total, 1);
        return Math.min(PROGRESS_PROCESSING + (int) (fraction * (PROGRESS_TRANSFORM_END - PROGRESS_PROCESSING)),
                PROGRESS_TRANSFORM_END);
    }

    private ProgressListener progressListener(String taskId) {
        return (current, total) -> {
            if (total > 0) {
                update(taskId, TaskUpdate.progress(mapTransformProgress(current, total)).expecting(TaskStatus.PROCESSING));
            }
        };
    }

    private String formatOf(LearningTask task) {
        Map<String, String> metadata = task.getMetadata();
        String format = metadata != null ? metadata.get(LearningTask.METADATA_VIDEO_FORMAT) : null;
        return format != null ? format : defaultFormat;
    }

    /**
     * @return true when the update was applied
     */
    private boolean update(String taskId, TaskUpdate update) {
        TaskUpdateResult result = taskStore.updateTaskConditionally(taskId, update);
        if (!result.isApplied()) {
            TaskStatus current = result.getTask() != null ? result.getTask().getStatus() : null;
            logger.info("[Task {}] Stopping: update not applied ({}, status {})", taskId, result.getOutcome(), current);
        }
        return result.isApplied();
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            logger.warn("Cannot read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }

    // cached inputs stay for reuse; uncached downloads are temporary
    private static void discardInput(Path input, boolean fromCache) {
        if (!fromCache) {
            deleteQuietly(input);
            FfmpegVideoTransformer.findSubtitle(input).ifPresent(TaskExecutionCoordinator::deleteQuietly);
        }
    }

    /**
     * Removes whatever the downloader left in the task's work directory, except {@code keep}.
     */
    private static void deleteWorkDir(Path workDir, Path keep) {
        if (!Files.isDirectory(workDir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(workDir)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to scan work directory {}: {}", workDir, e.getMessage());
            return;
        }
        for (Path path : paths) {
            if (keep != null && keep.startsWith(path)) {
                continue;
            }
            deleteQuietly(path);
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
}

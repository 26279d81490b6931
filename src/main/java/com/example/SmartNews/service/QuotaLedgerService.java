package com.example.SmartNews.service;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.config.TierConfigProvider;
import com.example.SmartNews.dto.QuotaCheckResult;
import com.example.SmartNews.dto.UserStats;
import com.example.SmartNews.entity.TierLimits;
import com.example.SmartNews.entity.UserUsage;
import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.enums.UserTier;
import com.example.SmartNews.enums.VideoResolution;
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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-user usage counters and the tier gate in front of task creation.
 * <p>
 * The whole user map is rewritten to {@code user_usage.json} on every mutation. A failed
 * write is logged and the in-memory map stays authoritative until the next successful save.
 * <p>
 * Usage is recorded only when a task completes, so failed downloads never consume quota.
 */
@Service
public class QuotaLedgerService {
    private static final Logger logger = LoggerFactory.getLogger(QuotaLedgerService.class);
    private static final String USAGE_FILE = "user_usage.json";

    private final Path usageFile;
    private final ObjectMapper objectMapper;
    private final TierConfigProvider tierConfigProvider;
    private final Map<String, UserUsage> users;

    @Autowired
    public QuotaLedgerService(AppProperties properties, ObjectMapper objectMapper, TierConfigProvider tierConfigProvider) {
        this(Paths.get(properties.getDataDir()), objectMapper, tierConfigProvider);
    }

    public QuotaLedgerService(Path dataDir, ObjectMapper objectMapper, TierConfigProvider tierConfigProvider) {
        this.usageFile = dataDir.resolve(USAGE_FILE);
        this.objectMapper = objectMapper;
        this.tierConfigProvider = tierConfigProvider;
        this.users = loadUsage();
        logger.info("Quota ledger initialized with {} users", users.size());
    }

    /**
     * Checks whether the user may create a task with the given mode and resolution.
     * Order of checks: daily cap, processing mode, resolution.
     */
    public synchronized QuotaCheckResult checkQuota(String userId, ProcessingMode processingMode, String resolution) {
        UserUsage user = getOrCreate(userId);
        UserTier tier = UserTier.fromId(user.getTier());
        TierLimits limits = tierConfigProvider.current().getLimits(tier.getId());

        if (user.resetDailyIfNeeded(LocalDate.now())) {
            saveUsage();
        }

        boolean unlimited = limits.isUnlimited();
        int remaining = unlimited ? TierLimits.UNLIMITED : Math.max(0, limits.getDailyTasks() - user.getDailyTaskCount());

        if (!unlimited && user.getDailyTaskCount() >= limits.getDailyTasks()) {
            return QuotaCheckResult.builder()
                    .allowed(false)
                    .reason(String.format("Daily limit reached (%d tasks/day for %s tier). Upgrade to increase limit.",
                            limits.getDailyTasks(), tier.getId()))
                    .remainingToday(0)
                    .unlimited(false)
                    .tier(tier.getId())
                    .limits(limits)
                    .build();
        }

        String modeId = processingMode != null ? processingMode.getId() : null;
        if (modeId == null || !limits.getAllowedModes().contains(modeId)) {
            return QuotaCheckResult.builder()
                    .allowed(false)
                    .reason(String.format("Processing mode '%s' not available for %s tier. Upgrade to access this feature.",
                            modeId, tier.getId()))
                    .remainingToday(remaining)
                    .unlimited(unlimited)
                    .tier(tier.getId())
                    .limits(limits)
                    .build();
        }

        if (VideoResolution.rank(resolution) > VideoResolution.rank(limits.getMaxResolution())) {
            return QuotaCheckResult.builder()
                    .allowed(false)
                    .reason(String.format("Resolution '%s' not available for %s tier. Max: %s. Upgrade for higher quality.",
                            resolution, tier.getId(), limits.getMaxResolution()))
                    .remainingToday(remaining)
                    .unlimited(unlimited)
                    .tier(tier.getId())
                    .limits(limits)
                    .build();
        }

        return QuotaCheckResult.builder()
                .allowed(true)
                .remainingToday(remaining)
                .unlimited(unlimited)
                .tier(tier.getId())
                .limits(limits)
                .build();
    }

    /**
     * Counts one completed task against the user's daily and lifetime totals.
     */
    public synchronized UserUsage recordTask(String userId, long bytesProcessed) {
        UserUsage user = getOrCreate(userId);
        user.resetDailyIfNeeded(LocalDate.now());
        user.setDailyTaskCount(user.getDailyTaskCount() + 1);
        user.setTotalTasks(user.getTotalTasks() + 1);
        user.setTotalBytesProcessed(user.getTotalBytesProcessed() + Math.max(0L, bytesProcessed));
        user.setUpdatedAt(LocalDateTime.now());
        saveUsage();
        logger.info("Recorded task for {}: daily={}, total={}", userId, user.getDailyTaskCount(), user.getTotalTasks());
        return copyOf(user);
    }

    public synchronized UserUsage setTier(String userId, UserTier tier) {
        UserUsage user = getOrCreate(userId);
        String oldTier = user.getTier();
        user.setTier(tier.getId());
        user.setUpdatedAt(LocalDateTime.now());
        saveUsage();
        logger.info("User {} tier changed: {} -> {}", userId, oldTier, tier.getId());
        return copyOf(user);
    }

    /**
     * Display projection; does not create or modify the stored record.
     */
    public synchronized UserStats getUserStats(String userId) {
        UserUsage user = users.get(userId);
        if (user == null) {
            user = new UserUsage(userId);
        }
        return toStats(user);
    }

    public synchronized List<UserStats> getAllUserStats() {
        return users.values().stream().map(this::toStats).toList();
    }

    private UserStats toStats(UserUsage user) {
        TierLimits limits = tierConfigProvider.current().getLimits(UserTier.fromId(user.getTier()).getId());
        int dailyUsed = LocalDate.now().equals(user.getLastTaskDate()) ? user.getDailyTaskCount() : 0;
        boolean unlimited = limits.isUnlimited();

        return UserStats.builder()
                .userId(user.getUserId())
                .tier(user.getTier())
                .dailyTasksUsed(dailyUsed)
                .dailyTasksLimit(unlimited ? TierLimits.UNLIMITED : limits.getDailyTasks())
                .dailyTasksRemaining(unlimited ? TierLimits.UNLIMITED : Math.max(0, limits.getDailyTasks() - dailyUsed))
                .unlimited(unlimited)
                .totalTasks(user.getTotalTasks())
                .totalDataProcessedMb(user.getTotalBytesProcessed() / (1024.0 * 1024.0))
                .maxResolution(limits.getMaxResolution())
                .allowedModes(limits.getAllowedModes())
                .aiSubtitleEnabled(limits.isAiSubtitle())
                .memberSince(user.getCreatedAt())
                .build();
    }

    private UserUsage getOrCreate(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        UserUsage user = users.get(userId);
        if (user == null) {
            user = new UserUsage(userId);
            users.put(userId, user);
            saveUsage();
            logger.info("Created new user: {}", userId);
        }
        return user;
    }

    private Map<String, UserUsage> loadUsage() {
        if (Files.exists(usageFile)) {
            try {
                Map<String, UserUsage> loaded = objectMapper.readValue(usageFile.toFile(),
                        new TypeReference<LinkedHashMap<String, UserUsage>>() {});
                return new LinkedHashMap<>(loaded);
            } catch (IOException e) {
                logger.warn("Failed to load usage data from {}: {}", usageFile, e.getMessage());
            }
        }
        return new LinkedHashMap<>();
    }

    /**
     * @return false when the snapshot could not be written
     */
    boolean saveUsage() {
        try {
            Files.createDirectories(usageFile.getParent());
            Path tmp = usageFile.resolveSibling(USAGE_FILE + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), users);
            Files.move(tmp, usageFile, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            logger.error("Failed to save usage data to {}: {}", usageFile, e.getMessage(), e);
            return false;
        }
    }

    private static UserUsage copyOf(UserUsage source) {
        UserUsage copy = new UserUsage();
        copy.setUserId(source.getUserId());
        copy.setTier(source.getTier());
        copy.setDailyTaskCount(source.getDailyTaskCount());
        copy.setLastTaskDate(source.getLastTaskDate());
        copy.setTotalTasks(source.getTotalTasks());
        copy.setTotalBytesProcessed(source.getTotalBytesProcessed());
        copy.setCreatedAt(source.getCreatedAt());
        copy.setUpdatedAt(source.getUpdatedAt());
        return copy;
    }
}

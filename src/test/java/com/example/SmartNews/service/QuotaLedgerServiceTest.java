package com.example.SmartNews.service;

import com.example.SmartNews.config.JsonTierConfigProvider;
import com.example.SmartNews.config.TierConfigProvider;
import com.example.SmartNews.dto.QuotaCheckResult;
import com.example.SmartNews.dto.UserStats;
import com.example.SmartNews.entity.UserUsage;
import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.enums.UserTier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaLedgerServiceTest {

    @TempDir
    Path dataDir;

    private ObjectMapper objectMapper;
    private TierConfigProvider tiers;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().findAndRegisterModules();
        // no file: built-in tiers (free = 3/day, 480p, original + with_subtitle)
        tiers = new JsonTierConfigProvider(dataDir.resolve("missing.json"), objectMapper);
    }

    private QuotaLedgerService newLedger() {
        return new QuotaLedgerService(dataDir, objectMapper, tiers);
    }

    @Test
    void newUserIsAllowedOnFreeTier() {
        QuotaLedgerService ledger = newLedger();

        QuotaCheckResult result = ledger.checkQuota("alice", ProcessingMode.WITH_SUBTITLE, "480p");

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getTier()).isEqualTo("free");
        assertThat(result.getRemainingToday()).isEqualTo(3);
        assertThat(result.isUnlimited()).isFalse();
    }

    @Test
    void dailyCapIsCheckedBeforeModeAndResolution() {
        QuotaLedgerService ledger = newLedger();
        for (int i = 0; i < 3; i++) {
            ledger.recordTask("alice", 100);
        }

        QuotaCheckResult result = ledger.checkQuota("alice", ProcessingMode.SLOW, "1080p");

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).startsWith("Daily limit reached (3 tasks/day for free tier)");
        assertThat(result.getRemainingToday()).isZero();
    }

    @Test
    void modeNotInTierIsDenied() {
        QuotaLedgerService ledger = newLedger();

        QuotaCheckResult result = ledger.checkQuota("alice", ProcessingMode.REPEAT_TWICE, "360p");

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).contains("Processing mode 'repeat_twice' not available for free tier");
        assertThat(result.getRemainingToday()).isEqualTo(3);
    }

    @Test
    void resolutionAboveTierMaximumIsDenied() {
        QuotaLedgerService ledger = newLedger();

        QuotaCheckResult result = ledger.checkQuota("alice", ProcessingMode.ORIGINAL, "720p");

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getReason()).contains("Resolution '720p' not available").contains("Max: 480p");
    }

    @Test
    void audioOnlyIsNeverBlockedByResolution() {
        QuotaLedgerService ledger = newLedger();

        assertThat(ledger.checkQuota("alice", ProcessingMode.ORIGINAL, "audio_only").isAllowed()).isTrue();
    }

    @Test
    void premiumTierIsUnlimited() {
        QuotaLedgerService ledger = newLedger();
        ledger.setTier("bob", UserTier.PREMIUM);
        for (int i = 0; i < 20; i++) {
            ledger.recordTask("bob", 1);
        }

        QuotaCheckResult result = ledger.checkQuota("bob", ProcessingMode.SLOW, "1080p");

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.isUnlimited()).isTrue();
        assertThat(result.getRemainingToday()).isEqualTo(-1);
    }

    @Test
    void recordTaskAccumulatesCountersAndSurvivesRestart() {
        QuotaLedgerService ledger = newLedger();
        ledger.recordTask("alice", 1024);
        UserUsage usage = ledger.recordTask("alice", 2048);

        assertThat(usage.getDailyTaskCount()).isEqualTo(2);
        assertThat(usage.getTotalTasks()).isEqualTo(2);
        assertThat(usage.getTotalBytesProcessed()).isEqualTo(3072);

        UserStats reloaded = newLedger().getUserStats("alice");
        assertThat(reloaded.getDailyTasksUsed()).isEqualTo(2);
        assertThat(reloaded.getTotalTasks()).isEqualTo(2);
        assertThat(reloaded.getDailyTasksRemaining()).isEqualTo(1);
    }

    @Test
    void dailyCounterResetsOnNewDay() throws Exception {
        UserUsage stale = new UserUsage("carol");
        stale.setDailyTaskCount(3);
        stale.setTotalTasks(10);
        stale.setLastTaskDate(LocalDate.now().minusDays(1));
        stale.setCreatedAt(LocalDateTime.now().minusDays(30));
        Map<String, UserUsage> seeded = new LinkedHashMap<>();
        seeded.put("carol", stale);
        objectMapper.writeValue(dataDir.resolve("user_usage.json").toFile(), seeded);

        QuotaLedgerService ledger = newLedger();
        assertThat(ledger.getUserStats("carol").getDailyTasksUsed()).isZero();

        QuotaCheckResult result = ledger.checkQuota("carol", ProcessingMode.ORIGINAL, "360p");
        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getRemainingToday()).isEqualTo(3);
        assertThat(ledger.getUserStats("carol").getTotalTasks()).isEqualTo(10);
    }

    @Test
    void unknownStoredTierFallsBackToFree() throws Exception {
        UserUsage legacy = new UserUsage("dave");
        legacy.setTier("enterprise");
        objectMapper.writeValue(dataDir.resolve("user_usage.json").toFile(), Map.of("dave", legacy));

        QuotaCheckResult result = newLedger().checkQuota("dave", ProcessingMode.ORIGINAL, "360p");

        assertThat(result.getTier()).isEqualTo("free");
    }

    @Test
    void statsForUnknownUserDoNotCreateRecord() {
        QuotaLedgerService ledger = newLedger();

        UserStats stats = ledger.getUserStats("ghost");

        assertThat(stats.getTier()).isEqualTo("free");
        assertThat(stats.getDailyTasksLimit()).isEqualTo(3);
        assertThat(ledger.getAllUserStats()).isEmpty();
    }

    @Test
    void setTierChangesLimits() {
        QuotaLedgerService ledger = newLedger();

        ledger.setTier("erin", UserTier.BASIC);

        assertThat(ledger.checkQuota("erin", ProcessingMode.REPEAT_TWICE, "720p").isAllowed()).isTrue();
        assertThat(ledger.getUserStats("erin").getDailyTasksLimit()).isEqualTo(15);
    }

    @Test
    void blankUserIdIsRejected() {
        QuotaLedgerService ledger = newLedger();

        assertThatThrownBy(() -> ledger.recordTask(" ", 1)).isInstanceOf(IllegalArgumentException.class);
    }
}

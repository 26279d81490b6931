package com.example.SmartNews.config;

import com.example.SmartNews.entity.TierLimits;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonTierConfigProviderTest {

    @TempDir
    Path dir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void missingFileUsesBuiltInTiers() {
        TierConfigSnapshot snapshot = new JsonTierConfigProvider(dir.resolve("tiers.json"), objectMapper).current();

        assertThat(snapshot.isFromFile()).isFalse();
        assertThat(snapshot.getTiers()).containsKeys("free", "basic", "premium");
        assertThat(snapshot.getLimits("premium").isUnlimited()).isTrue();
    }

    @Test
    void fileIsAuthoritative() throws Exception {
        Path file = Files.writeString(dir.resolve("tiers.json"),
                "{\"tiers\": {\"free\": {\"daily_tasks\": 5, \"max_resolution\": \"720p\","
                        + " \"allowed_modes\": [\"original\"]}}, \"resolutions\": [\"360p\", \"720p\"]}");

        TierConfigSnapshot snapshot = new JsonTierConfigProvider(file, objectMapper).current();

        assertThat(snapshot.isFromFile()).isTrue();
        assertThat(snapshot.getTiers()).containsOnlyKeys("free");
        TierLimits free = snapshot.getLimits("free");
        assertThat(free.getDailyTasks()).isEqualTo(5);
        assertThat(free.getName()).isEqualTo("Free");
        assertThat(snapshot.getResolutions()).containsExactly("360p", "720p");
    }

    @Test
    void unknownTierResolvesToFree() throws Exception {
        Path file = Files.writeString(dir.resolve("tiers.json"),
                "{\"tiers\": {\"free\": {\"daily_tasks\": 2}}}");

        TierConfigSnapshot snapshot = new JsonTierConfigProvider(file, objectMapper).current();

        assertThat(snapshot.getLimits("gold").getDailyTasks()).isEqualTo(2);
    }

    @Test
    void reloadPicksUpChangesAndKeepsOldSnapshotIntact() throws Exception {
        Path file = Files.writeString(dir.resolve("tiers.json"), "{\"tiers\": {\"free\": {\"daily_tasks\": 2}}}");
        JsonTierConfigProvider provider = new JsonTierConfigProvider(file, objectMapper);
        TierConfigSnapshot before = provider.current();

        Files.writeString(file, "{\"tiers\": {\"free\": {\"daily_tasks\": 7}}}");
        TierConfigSnapshot after = provider.reload();

        assertThat(before.getLimits("free").getDailyTasks()).isEqualTo(2);
        assertThat(after.getLimits("free").getDailyTasks()).isEqualTo(7);
        assertThat(provider.current()).isSameAs(after);
    }

    @Test
    void malformedFileFallsBackToDefaults() throws Exception {
        Path file = Files.writeString(dir.resolve("tiers.json"), "{not json");

        TierConfigSnapshot snapshot = new JsonTierConfigProvider(file, objectMapper).current();

        assertThat(snapshot.isFromFile()).isFalse();
        assertThat(snapshot.getLimits("free").getDailyTasks()).isEqualTo(3);
    }
}

package com.example.SmartNews.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class StartupConfigurationCheckTest {

    @TempDir
    Path dir;

    @Test
    void warnsAboutRiskySettings() {
        AppProperties properties = new AppProperties();
        properties.setApiKey("");
        properties.getTasks().setMaxConcurrent(8);
        properties.setFfmpegPath(dir.resolve("bin/ffmpeg").toString());
        properties.setTiersConfig(dir.resolve("tiers.json").toString());
        properties.getStorage().setQuotaGb(0);

        assertThat(new StartupConfigurationCheck(properties).collectWarnings())
                .hasSize(5)
                .anyMatch(warning -> warning.startsWith("API key is not set"))
                .anyMatch(warning -> warning.contains("max-concurrent=8"))
                .anyMatch(warning -> warning.startsWith("ffmpeg not found"));
    }

    @Test
    void productionLikeSettingsPass() throws Exception {
        AppProperties properties = new AppProperties();
        properties.setApiKey("secret");
        properties.setFfmpegPath("ffmpeg");
        properties.setTiersConfig(Files.writeString(dir.resolve("tiers.json"), "{}").toString());

        assertThat(new StartupConfigurationCheck(properties).collectWarnings()).isEmpty();
    }
}

package com.example.SmartNews.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Logs configuration that is acceptable in development but risky in production.
 */
@Component
public class StartupConfigurationCheck {
    private static final Logger logger = LoggerFactory.getLogger(StartupConfigurationCheck.class);

    static final int HIGH_CONCURRENCY = 5;

    private final AppProperties properties;

    public StartupConfigurationCheck(AppProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void logWarnings() {
        List<String> warnings = collectWarnings();
        if (warnings.isEmpty()) {
            logger.info("Configuration check passed");
            return;
        }
        warnings.forEach(warning -> logger.warn("Configuration warning: {}", warning));
    }

    List<String> collectWarnings() {
        List<String> warnings = new ArrayList<>();
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            warnings.add("API key is not set; all API endpoints are open");
        }
        if (properties.getTasks().getMaxConcurrent() > HIGH_CONCURRENCY) {
            warnings.add("app.tasks.max-concurrent=" + properties.getTasks().getMaxConcurrent()
                    + " may exhaust memory and CPU");
        }
        String ffmpeg = properties.getFfmpegPath();
        if (ffmpeg == null || ffmpeg.isBlank()) {
            warnings.add("app.ffmpeg-path is not set");
        } else if (ffmpeg.contains("/") && !Files.isExecutable(Paths.get(ffmpeg))) {
            warnings.add("ffmpeg not found at " + ffmpeg);
        }
        if (!Files.exists(Path.of(properties.getTiersConfig()))) {
            warnings.add("Tier file " + properties.getTiersConfig() + " not found; using built-in tier defaults");
        }
        if (properties.getStorage().getQuotaGb() <= 0) {
            warnings.add("Storage quota is zero; quota cleanup will evict every cached file");
        }
        return warnings;
    }
}

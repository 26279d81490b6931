package com.example.SmartNews.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Application settings bound from the {@code app.*} keys.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private String dataDir = "./data";

    private String tempDir = "./data/temp";

    /**
     * Shared secret expected in the X-API-Key header. Blank disables the check.
     */
    private String apiKey;

    private String tiersConfig = "./config/tiers.json";

    private String sourcesConfig = "./config/sources.json";

    private String ytdlpPath = "yt-dlp";

    private String ffmpegPath = "ffmpeg";

    private String whisperModel = "base";

    private List<String> corsOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    private Tasks tasks = new Tasks();

    private Storage storage = new Storage();

    private Remote remote = new Remote();

    @Data
    public static class Tasks {
        private int maxConcurrent = 2;

        /**
         * Soft queue-depth cap as a multiple of maxConcurrent.
         */
        private int queueDepthMultiplier = 2;

        private int retentionHours = 24;

        private int lockTimeoutMinutes = 30;

        private String cleanupCron = "0 30 * * * *";
    }

    @Data
    public static class Storage {
        private String localPath = "./data/storage";

        private double quotaGb = 10.0;

        private int cacheHours = 24;

        private String defaultFormat = "720p";

        private String maintenanceCron = "0 0 * * * *";

        public long getQuotaBytes() {
            return (long) (quotaGb * 1024 * 1024 * 1024);
        }
    }

    @Data
    public static class Remote {
        private boolean enabled = false;
        private String endpoint;
        private String region = "auto";
        private String bucket;
        private String prefix = "videos";
        private String accessKeyId;
        private String secretAccessKey;
        private int timeoutSeconds = 300;
    }
}

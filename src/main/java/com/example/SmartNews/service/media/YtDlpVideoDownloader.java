package com.example.SmartNews.service.media;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.dto.DownloadResult;
import com.example.SmartNews.dto.VideoInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Fetches videos with the yt-dlp executable into the caller's work directory. English
 * subtitles (manual or automatic) are written next to the video as {@code <id>.en.srt}
 * when the site provides them.
 */
@Component
public class YtDlpVideoDownloader implements VideoDownloader {
    private static final Logger logger = LoggerFactory.getLogger(YtDlpVideoDownloader.class);

    private static final long INFO_TIMEOUT_SECONDS = 60;
    private static final long DOWNLOAD_TIMEOUT_MINUTES = 30;
    private static final List<String> VIDEO_EXTENSIONS = List.of(".mp4", ".webm", ".mkv", ".m4a", ".mp3");

    private final String ytDlpPath;
    private final ObjectMapper objectMapper;

    public YtDlpVideoDownloader(AppProperties properties, ObjectMapper objectMapper) {
        this.ytDlpPath = properties.getYtdlpPath();
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<VideoInfo> getVideoInfo(String url) {
        List<String> command = List.of(ytDlpPath, "--dump-single-json", "--skip-download",
                "--no-playlist", "--no-warnings", url);
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
            Process process = pb.start();

            String json;
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                json = String.join("\n", reader.lines().toList());
            }
            if (!process.waitFor(INFO_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                logger.error("yt-dlp info timed out for {}", url);
                return Optional.empty();
            }
            if (process.exitValue() != 0 || json.isBlank()) {
                logger.error("yt-dlp info failed for {} with exit code {}", url, process.exitValue());
                return Optional.empty();
            }

            JsonNode info = objectMapper.readTree(json);
            return Optional.of(VideoInfo.builder()
                    .id(info.path("id").asText(""))
                    .title(info.path("title").asText(""))
                    .url(info.path("webpage_url").asText(url))
                    .duration(info.path("duration").asLong(0))
                    .thumbnail(info.path("thumbnail").asText(null))
                    .uploader(info.path("uploader").asText(null))
                    .uploadDate(info.path("upload_date").asText(null))
                    .build());
        } catch (IOException e) {
            logger.error("Failed to get video info for {}: {}", url, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while reading video info for {}", url);
            return Optional.empty();
        }
    }

    @Override
    public DownloadResult download(String url, String formatId, Path workDir) {
        Optional<VideoInfo> info = getVideoInfo(url);
        if (info.isEmpty()) {
            return DownloadResult.failure("Failed to get video info");
        }
        VideoInfo video = info.get();

        List<String> command = new ArrayList<>();
        command.add(ytDlpPath);
        command.add("-f");
        command.add(VideoFormats.selectorFor(formatId));
        command.add("--write-subs");
        command.add("--write-auto-subs");
        command.add("--sub-langs");
        command.add("en");
        command.add("--convert-subs");
        command.add("srt");
        command.add("--no-playlist");
        command.add("--no-progress");
        command.add("--force-overwrites");
        command.add("--output");
        command.add(workDir.resolve("%(id)s.%(ext)s").toString());
        command.add(url);

        try {
            Files.createDirectories(workDir);
            logger.info("Executing command: {}", String.join(" ", command));

            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            Process process = pb.start();

            List<String> outputLines = new ArrayList<>();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    outputLines.add(line);
                    logger.debug("yt-dlp: {}", line);
                }
            }

            if (!process.waitFor(DOWNLOAD_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                return failureFor(video, "yt-dlp timed out");
            }
            if (process.exitValue() != 0) {
                logger.error("yt-dlp failed. Output:\n{}", String.join("\n", outputLines));
                return failureFor(video, "yt-dlp exited with code " + process.exitValue());
            }

            Optional<Path> downloaded = findDownloadedFile(workDir, video.getId());
            if (downloaded.isEmpty()) {
                return failureFor(video, "Downloaded file not found");
            }
            Path file = downloaded.get();
            return DownloadResult.builder()
                    .success(true)
                    .videoId(video.getId())
                    .title(video.getTitle())
                    .filePath(file)
                    .subtitlePath(FfmpegVideoTransformer.findSubtitle(file).orElse(null))
                    .fileSize(Files.size(file))
                    .build();
        } catch (IOException e) {
            logger.error("Download failed for {}: {}", url, e.getMessage());
            return failureFor(video, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failureFor(video, "Download interrupted");
        }
    }

    static Optional<Path> findDownloadedFile(Path workDir, String videoId) {
        for (String ext : VIDEO_EXTENSIONS) {
            Path candidate = workDir.resolve(videoId + ext);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static DownloadResult failureFor(VideoInfo video, String error) {
        return DownloadResult.builder()
                .success(false)
                .videoId(video.getId())
                .title(video.getTitle())
                .error(error)
                .build();
    }
}

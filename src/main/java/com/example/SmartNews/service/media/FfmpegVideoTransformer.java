package com.example.SmartNews.service.media;

import com.example.SmartNews.config.AppProperties;
import com.example.SmartNews.dto.TransformRequest;
import com.example.SmartNews.dto.TransformResult;
import com.example.SmartNews.enums.ProcessingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a learning mode to a downloaded video with ffmpeg.
 * <ul>
 *     <li>ORIGINAL: copy, or re-encode to mp4 when the container differs</li>
 *     <li>WITH_SUBTITLE: burn the sidecar subtitle into the picture</li>
 *     <li>REPEAT_TWICE: plain pass followed by a subtitled pass</li>
 *     <li>SLOW: 0.75x playback with the subtitle burned in before slowing</li>
 * </ul>
 * Modes that need a subtitle fall back to their subtitle-free variant when none was
 * downloaded. Speech-to-text generation is not done here.
 */
@Component
public class FfmpegVideoTransformer implements VideoTransformer {
    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoTransformer.class);

    static final double SLOW_SPEED = 0.75;
    private static final List<String> SUBTITLE_SUFFIXES = List.of(".en.srt", ".en.vtt", ".srt", ".vtt");
    private static final String SUBTITLE_STYLE = "FontSize=20,PrimaryColour=&H00FFFFFF,OutlineColour=&H00000000,Alignment=2,MarginV=30";
    private static final String SECOND_PASS_STYLE = "FontSize=20,PrimaryColour=&H0000FFFF,OutlineColour=&H00000000,Alignment=2,MarginV=30";
    private static final Pattern DURATION_PATTERN = Pattern.compile("Duration: (\\d+):(\\d{2}):(\\d{2})\\.(\\d+)");

    private final String ffmpegPath;

    public FfmpegVideoTransformer(AppProperties properties) {
        this.ffmpegPath = properties.getFfmpegPath();
    }

    @Override
    public TransformResult process(TransformRequest request, ProgressListener listener) throws IOException, TransformException {
        Path input = request.getInputPath();
        Path output = request.getOutputPath();
        ProgressListener progress = listener != null ? listener : ProgressListener.none();
        if (input == null || !Files.isRegularFile(input)) {
            throw new TransformException("Input video not found: " + input);
        }
        if (request.getMode() == null) {
            throw new TransformException("Processing mode is required");
        }
        Files.createDirectories(output.toAbsolutePath().getParent());

        Optional<Path> sidecar = findSubtitle(input);
        if (sidecar.isEmpty() && request.getMode() != ProcessingMode.ORIGINAL) {
            logger.warn("No subtitle found for {} (model hint: {}), using subtitle-free variant",
                    input.getFileName(), request.getModelHint());
        }
        logger.info("Processing {} with mode {}", input.getFileName(), request.getMode().getId());

        switch (request.getMode()) {
            case ORIGINAL -> processOriginal(input, output, progress);
            case WITH_SUBTITLE -> {
                if (sidecar.isPresent()) {
                    runFfmpeg(List.of("-i", input.toString(),
                            "-vf", subtitlesFilter(sidecar.get(), SUBTITLE_STYLE),
                            "-c:v", "libx264", "-preset", "fast", "-c:a", "aac"), output, progress);
                } else {
                    processOriginal(input, output, progress);
                }
            }
            case REPEAT_TWICE -> {
                String secondPass = sidecar.map(s -> "[v2]" + subtitlesFilter(s, SECOND_PASS_STYLE) + "[v2s];")
                        .orElse("[v2]null[v2s];");
                String graph = "[0:v]split[v1][v2];" + secondPass
                        + "[0:a]asplit[a1][a2];[v1][a1][v2s][a2]concat=n=2:v=1:a=1[v][a]";
                runFfmpeg(List.of("-i", input.toString(),
                        "-filter_complex", graph, "-map", "[v]", "-map", "[a]",
                        "-c:v", "libx264", "-preset", "fast", "-c:a", "aac"), output, progress);
            }
            case SLOW -> {
                String slow = String.format("setpts=%.6f*PTS", 1.0 / SLOW_SPEED);
                String videoFilter = sidecar.map(s -> subtitlesFilter(s, SUBTITLE_STYLE) + "," + slow).orElse(slow);
                runFfmpeg(List.of("-i", input.toString(),
                        "-filter:v", videoFilter,
                        "-filter:a", String.format("atempo=%.6f", SLOW_SPEED),
                        "-c:v", "libx264", "-preset", "fast", "-c:a", "aac"), output, progress);
            }
        }

        Path subtitleOut = null;
        if (sidecar.isPresent()) {
            Path source = sidecar.get();
            String name = source.getFileName().toString();
            String ext = name.substring(name.lastIndexOf('.'));
            subtitleOut = output.resolveSibling(stem(output) + ext);
            // copied: the source may be a cached artifact
            Files.copy(source, subtitleOut, StandardCopyOption.REPLACE_EXISTING);
        }
        return new TransformResult(output, subtitleOut);
    }

    private void processOriginal(Path input, Path output, ProgressListener progress) throws IOException, TransformException {
        if (extension(input).equalsIgnoreCase(extension(output))) {
            Files.copy(input, output, StandardCopyOption.REPLACE_EXISTING);
            progress.onProgress(1, 1);
            return;
        }
        runFfmpeg(List.of("-i", input.toString(), "-c:v", "libx264", "-preset", "fast", "-c:a", "aac"), output, progress);
    }

    private void runFfmpeg(List<String> args, Path output, ProgressListener progress) throws IOException, TransformException {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        command.addAll(args);
        command.add("-progress");
        command.add("pipe:1");
        command.add("-y");
        command.add(output.toString());

        logger.info("Executing FFmpeg command: {}", String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        long totalMs = 0;
        List<String> tail = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (tail.size() >= 20) {
                    tail.remove(0);
                }
                tail.add(line);
                Matcher matcher = DURATION_PATTERN.matcher(line);
                if (totalMs == 0 && matcher.find()) {
                    totalMs = toMillis(matcher);
                } else if (line.startsWith("out_time_ms=") && totalMs > 0) {
                    // ffmpeg reports out_time_ms in microseconds
                    long doneMs = parseLong(line.substring("out_time_ms=".length())) / 1000;
                    progress.onProgress((int) Math.min(doneMs / 1000, totalMs / 1000), (int) Math.max(1, totalMs / 1000));
                }
            }
        }

        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new TransformException("FFmpeg interrupted", e);
        }
        if (exitCode != 0) {
            logger.error("FFmpeg failed with exit code {}. Output tail:\n{}", exitCode, String.join("\n", tail));
            throw new TransformException("FFmpeg process failed with exit code: " + exitCode);
        }
        progress.onProgress(1, 1);
    }

    public static Optional<Path> findSubtitle(Path video) {
        Path dir = video.toAbsolutePath().getParent();
        String stem = stem(video);
        for (String suffix : SUBTITLE_SUFFIXES) {
            Path candidate = dir.resolve(stem + suffix);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    static String subtitlesFilter(Path subtitle, String style) {
        String escaped = subtitle.toAbsolutePath().toString()
                .replace("\\", "/")
                .replace(":", "\\:")
                .replace("'", "\\'");
        return "subtitles='" + escaped + "':force_style='" + style + "'";
    }

    private static long toMillis(Matcher matcher) {
        long hours = Long.parseLong(matcher.group(1));
        long minutes = Long.parseLong(matcher.group(2));
        long seconds = Long.parseLong(matcher.group(3));
        String fraction = (matcher.group(4) + "00").substring(0, 3);
        return ((hours * 60 + minutes) * 60 + seconds) * 1000 + Long.parseLong(fraction);
    }

    private static long parseLong(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.indexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }
}

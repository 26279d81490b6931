package com.example.SmartNews.service.media;

import com.example.SmartNews.dto.VideoFormat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Download format presets and their yt-dlp selectors.
 */
public final class VideoFormats {

    public static final String DEFAULT_FORMAT = "720p";

    private static final Map<String, VideoFormat> FORMATS = new LinkedHashMap<>();

    static {
        register(new VideoFormat("360p", "best[height<=360][ext=mp4]/best[height<=360]",
                "Low quality (360p) - ~15MB/10min", 1.5));
        register(new VideoFormat("480p", "best[height<=480][ext=mp4]/best[height<=480]",
                "Medium quality (480p) - ~25MB/10min", 2.5));
        register(new VideoFormat("720p", "best[height<=720][ext=mp4]/best[height<=720]",
                "HD quality (720p) - ~50MB/10min", 5.0));
        register(new VideoFormat("1080p", "best[height<=1080][ext=mp4]/best[height<=1080]",
                "Full HD (1080p) - ~100MB/10min", 10.0));
        register(new VideoFormat("audio_only", "bestaudio",
                "Audio only (MP3) - ~10MB/10min", 1.0));
    }

    private VideoFormats() {
    }

    private static void register(VideoFormat format) {
        FORMATS.put(format.getId(), format);
    }

    public static List<VideoFormat> all() {
        return List.copyOf(FORMATS.values());
    }

    public static boolean isKnown(String formatId) {
        return formatId != null && FORMATS.containsKey(formatId);
    }

    /**
     * yt-dlp selector for the format id; unknown ids get the 720p selector.
     */
    public static String selectorFor(String formatId) {
        VideoFormat format = formatId != null ? FORMATS.get(formatId) : null;
        return (format != null ? format : FORMATS.get(DEFAULT_FORMAT)).getSelector();
    }
}

package com.example.SmartNews.service.media;

import com.example.SmartNews.dto.DownloadResult;
import com.example.SmartNews.dto.VideoInfo;

import java.nio.file.Path;
import java.util.Optional;

public interface VideoDownloader {

    /**
     * Downloads the video at {@code url} in the given format into {@code workDir}, which
     * belongs to the calling task alone. Never throws for download problems; they are
     * reported through {@link DownloadResult#getError()}.
     */
    DownloadResult download(String url, String formatId, Path workDir);

    Optional<VideoInfo> getVideoInfo(String url);
}

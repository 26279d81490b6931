package com.example.SmartNews.dto;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class DownloadResult {
    private boolean success;
    private String videoId;
    private String title;
    private Path filePath;
    // sidecar subtitle, null when the site had none
    private Path subtitlePath;
    private String error;
    private long fileSize;

    public static DownloadResult failure(String error) {
        return DownloadResult.builder().success(false).error(error).build();
    }
}

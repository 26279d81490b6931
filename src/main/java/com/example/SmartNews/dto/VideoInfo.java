package com.example.SmartNews.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class VideoInfo {
    private String id;
    private String title;
    private String url;
    private long duration;
    private String thumbnail;
    private String uploader;
    private String uploadDate;
}

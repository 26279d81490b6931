package com.example.SmartNews.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class VideoFormat {
    private String id;
    private String selector;
    private String description;
    private double estimatedSizeMbPerMin;
}

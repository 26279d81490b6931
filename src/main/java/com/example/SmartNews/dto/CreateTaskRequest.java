package com.example.SmartNews.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreateTaskRequest {
    @NotBlank
    private String videoUrl;

    @NotBlank
    private String sourceId;

    private String processingMode = "with_subtitle";

    private String videoFormat = "720p";
}

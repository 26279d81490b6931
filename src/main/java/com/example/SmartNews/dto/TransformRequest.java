package com.example.SmartNews.dto;

import com.example.SmartNews.enums.ProcessingMode;
import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

@Data
@Builder
public class TransformRequest {
    private Path inputPath;
    private Path outputPath;
    private ProcessingMode mode;
    private String sourceUrl;
    // speech-to-text model size, passed through for subtitle generation
    private String modelHint;
}

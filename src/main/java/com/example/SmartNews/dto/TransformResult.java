package com.example.SmartNews.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

@Data
@AllArgsConstructor
public class TransformResult {
    private Path outputPath;
    private Path subtitlePath;
}

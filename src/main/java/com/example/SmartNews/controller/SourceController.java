package com.example.SmartNews.controller;

import com.example.SmartNews.config.SourceConfigProvider;
import com.example.SmartNews.entity.VideoSource;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class SourceController {

    private final SourceConfigProvider sourceConfigProvider;

    @GetMapping
    public ResponseEntity<?> listSources(@RequestParam(name = "enabled_only", defaultValue = "true") boolean enabledOnly) {
        List<VideoSource> sources = sourceConfigProvider.current().getSources(enabledOnly);
        return ResponseEntity.ok(Map.of("sources", sources, "total", sources.size()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getSource(@PathVariable String id) {
        return sourceConfigProvider.current().getSource(id)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Source not found: " + id)));
    }
}

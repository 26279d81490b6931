package com.example.SmartNews.config;

import com.example.SmartNews.entity.VideoSource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class JsonSourceConfigProvider implements SourceConfigProvider {
    private static final Logger logger = LoggerFactory.getLogger(JsonSourceConfigProvider.class);

    private final Path configPath;
    private final ObjectMapper objectMapper;
    private final AtomicReference<SourceConfigSnapshot> snapshot = new AtomicReference<>();

    @Autowired
    public JsonSourceConfigProvider(AppProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getSourcesConfig()), objectMapper);
    }

    public JsonSourceConfigProvider(Path configPath, ObjectMapper objectMapper) {
        this.configPath = configPath;
        this.objectMapper = objectMapper;
        this.snapshot.set(load());
    }

    @Override
    public SourceConfigSnapshot current() {
        return snapshot.get();
    }

    @Override
    public SourceConfigSnapshot reload() {
        SourceConfigSnapshot loaded = load();
        snapshot.set(loaded);
        return loaded;
    }

    private SourceConfigSnapshot load() {
        if (!Files.exists(configPath)) {
            logger.info("Source config not found at {}", configPath);
            return new SourceConfigSnapshot(Map.of(), false);
        }
        try {
            JsonNode root = objectMapper.readTree(configPath.toFile());
            Map<String, VideoSource> sources = new LinkedHashMap<>();
            root.path("sources").fields().forEachRemaining(entry -> {
                try {
                    VideoSource source = objectMapper.treeToValue(entry.getValue(), VideoSource.class);
                    source.setId(entry.getKey());
                    if (source.getName() == null) {
                        source.setName(entry.getKey());
                    }
                    sources.put(entry.getKey(), source);
                } catch (IOException e) {
                    logger.warn("Skipping malformed source {}: {}", entry.getKey(), e.getMessage());
                }
            });
            logger.info("Loaded source config from {}: {} sources", configPath, sources.size());
            return new SourceConfigSnapshot(sources, true);
        } catch (IOException e) {
            logger.warn("Failed to load source config {}: {}", configPath, e.getMessage());
            return new SourceConfigSnapshot(Map.of(), false);
        }
    }
}

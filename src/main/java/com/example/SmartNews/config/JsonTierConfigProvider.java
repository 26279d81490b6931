package com.example.SmartNews.config;

import com.example.SmartNews.entity.TierLimits;
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
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads tiers.json. The file is authoritative; the built-in table is a fallback for a
 * missing or unreadable file only.
 */
@Component
public class JsonTierConfigProvider implements TierConfigProvider {
    private static final Logger logger = LoggerFactory.getLogger(JsonTierConfigProvider.class);

    private final Path configPath;
    private final ObjectMapper objectMapper;
    private final AtomicReference<TierConfigSnapshot> snapshot = new AtomicReference<>();

    @Autowired
    public JsonTierConfigProvider(AppProperties properties, ObjectMapper objectMapper) {
        this(Paths.get(properties.getTiersConfig()), objectMapper);
    }

    public JsonTierConfigProvider(Path configPath, ObjectMapper objectMapper) {
        this.configPath = configPath;
        this.objectMapper = objectMapper;
        this.snapshot.set(load());
    }

    @Override
    public TierConfigSnapshot current() {
        return snapshot.get();
    }

    @Override
    public TierConfigSnapshot reload() {
        TierConfigSnapshot loaded = load();
        snapshot.set(loaded);
        return loaded;
    }

    private TierConfigSnapshot load() {
        if (!Files.exists(configPath)) {
            logger.info("Tier config not found at {}, using defaults", configPath);
            return fallback();
        }
        try {
            JsonNode root = objectMapper.readTree(configPath.toFile());
            Map<String, TierLimits> tiers = new LinkedHashMap<>();
            JsonNode tiersNode = root.path("tiers");
            Iterator<Map.Entry<String, JsonNode>> fields = tiersNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                TierLimits limits = objectMapper.treeToValue(entry.getValue(), TierLimits.class);
                if (limits.getName() == null || limits.getName().isBlank()) {
                    limits.setName(capitalize(entry.getKey()));
                }
                tiers.put(entry.getKey().toLowerCase(), limits);
            }
            if (tiers.isEmpty()) {
                logger.warn("Tier config {} defines no tiers, using defaults", configPath);
                return fallback();
            }

            Map<String, Map<String, Object>> modes = new LinkedHashMap<>();
            JsonNode modesNode = root.path("processing_modes");
            if (modesNode.isObject()) {
                modesNode.fields().forEachRemaining(entry ->
                        modes.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Map.class)));
            }

            List<String> resolutions = new ArrayList<>();
            root.path("resolutions").forEach(node -> resolutions.add(node.asText()));
            if (resolutions.isEmpty()) {
                resolutions.addAll(DefaultTiers.resolutions());
            }

            logger.info("Loaded tier config from {}: {} tiers", configPath, tiers.size());
            return new TierConfigSnapshot(tiers, modes, resolutions, true);
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Failed to load tier config {}: {}, using defaults", configPath, e.getMessage());
            return fallback();
        }
    }

    private TierConfigSnapshot fallback() {
        return new TierConfigSnapshot(DefaultTiers.defaults(), Map.of(), DefaultTiers.resolutions(), false);
    }

    private static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}

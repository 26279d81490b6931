package com.example.SmartNews.controller.admin;

import com.example.SmartNews.config.SourceConfigProvider;
import com.example.SmartNews.config.SourceConfigSnapshot;
import com.example.SmartNews.config.TierConfigProvider;
import com.example.SmartNews.config.TierConfigSnapshot;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Inspects and reloads the JSON-backed tier and source configuration without a restart.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminConfigController {

    private static final Logger logger = LoggerFactory.getLogger(AdminConfigController.class);

    private final TierConfigProvider tierConfigProvider;
    private final SourceConfigProvider sourceConfigProvider;

    @GetMapping("/tiers")
    public ResponseEntity<?> getTierConfig() {
        return ResponseEntity.ok(createSuccessResponse("Tier configuration", tierData(tierConfigProvider.current())));
    }

    @PostMapping("/tiers/reload")
    public ResponseEntity<?> reloadTierConfig() {
        TierConfigSnapshot snapshot = tierConfigProvider.reload();
        logger.info("Tier configuration reloaded: {} tiers (from file: {})", snapshot.getTiers().size(), snapshot.isFromFile());
        return ResponseEntity.ok(createSuccessResponse("Tier configuration reloaded", tierData(snapshot)));
    }

    @GetMapping("/sources")
    public ResponseEntity<?> getSourceConfig() {
        return ResponseEntity.ok(createSuccessResponse("Source configuration", sourceData(sourceConfigProvider.current())));
    }

    @PostMapping("/sources/reload")
    public ResponseEntity<?> reloadSourceConfig() {
        SourceConfigSnapshot snapshot = sourceConfigProvider.reload();
        logger.info("Source configuration reloaded: {} sources", snapshot.getSources(false).size());
        return ResponseEntity.ok(createSuccessResponse("Source configuration reloaded", sourceData(snapshot)));
    }

    private Map<String, Object> tierData(TierConfigSnapshot snapshot) {
        Map<String, Object> data = new HashMap<>();
        data.put("tiers", snapshot.getTiers());
        data.put("processingModes", snapshot.getProcessingModes());
        data.put("resolutions", snapshot.getResolutions());
        data.put("loadedAt", snapshot.getLoadedAt());
        data.put("fromFile", snapshot.isFromFile());
        return data;
    }

    private Map<String, Object> sourceData(SourceConfigSnapshot snapshot) {
        Map<String, Object> data = new HashMap<>();
        data.put("sources", snapshot.getSources(false));
        data.put("loadedAt", snapshot.getLoadedAt());
        data.put("fromFile", snapshot.isFromFile());
        return data;
    }

    private Map<String, Object> createSuccessResponse(String message, Map<String, Object> data) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("message", message);
        response.put("data", data);
        return response;
    }
}

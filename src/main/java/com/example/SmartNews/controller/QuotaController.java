package com.example.SmartNews.controller;

import com.example.SmartNews.config.TierConfigProvider;
import com.example.SmartNews.config.TierConfigSnapshot;
import com.example.SmartNews.dto.QuotaCheckResult;
import com.example.SmartNews.dto.UpgradeTierRequest;
import com.example.SmartNews.dto.UserStats;
import com.example.SmartNews.entity.UserUsage;
import com.example.SmartNews.enums.ProcessingMode;
import com.example.SmartNews.enums.UserTier;
import com.example.SmartNews.security.ApiKeyFilter;
import com.example.SmartNews.service.QuotaLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/quota")
@RequiredArgsConstructor
public class QuotaController {
    private static final Logger logger = LoggerFactory.getLogger(QuotaController.class);

    private final QuotaLedgerService quotaLedgerService;
    private final TierConfigProvider tierConfigProvider;

    @GetMapping("/tiers")
    public ResponseEntity<?> getTiers() {
        TierConfigSnapshot snapshot = tierConfigProvider.current();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tiers", snapshot.getTiers());
        body.put("processingModes", snapshot.getProcessingModes());
        body.put("resolutions", snapshot.getResolutions());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/me")
    public ResponseEntity<UserStats> getMyQuota(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId) {
        return ResponseEntity.ok(quotaLedgerService.getUserStats(userId));
    }

    @GetMapping("/check")
    public ResponseEntity<?> checkQuota(
            @RequestHeader(value = ApiKeyFilter.USER_ID_HEADER, defaultValue = ApiKeyFilter.DEFAULT_USER) String userId,
            @RequestParam(name = "processing_mode", defaultValue = "with_subtitle") String processingMode,
            @RequestParam(name = "video_format", defaultValue = "720p") String videoFormat) {
        Optional<ProcessingMode> mode = ProcessingMode.fromId(processingMode);
        if (mode.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown processing mode: " + processingMode));
        }
        QuotaCheckResult result = quotaLedgerService.checkQuota(userId, mode.get(), videoFormat);
        return ResponseEntity.ok(result);
    }

    /**
     * Changes a user's tier. There is no payment flow; callers are trusted by API key.
     */
    @PostMapping("/upgrade")
    public ResponseEntity<?> upgradeTier(@Valid @RequestBody UpgradeTierRequest request) {
        Optional<UserTier> tier = UserTier.parse(request.getTier());
        if (tier.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid tier: " + request.getTier()));
        }
        UserUsage updated = quotaLedgerService.setTier(request.getUserId(), tier.get());
        logger.info("Tier of {} set to {}", request.getUserId(), updated.getTier());
        return ResponseEntity.ok(Map.of(
                "message", "User " + request.getUserId() + " upgraded to " + updated.getTier(),
                "stats", quotaLedgerService.getUserStats(request.getUserId())));
    }

    @GetMapping("/users")
    public ResponseEntity<?> listUsers() {
        List<UserStats> users = quotaLedgerService.getAllUserStats();
        return ResponseEntity.ok(Map.of("users", users, "total", users.size()));
    }
}

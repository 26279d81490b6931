package com.example.SmartNews.controller;

import com.example.SmartNews.service.TaskStoreService;
import com.example.SmartNews.worker.TaskProcessingLock;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final TaskStoreService taskStoreService;
    private final TaskProcessingLock processingLock;

    @Value("${spring.application.name:SmartNews}")
    private String applicationName;

    @GetMapping("/")
    public ResponseEntity<?> root() {
        return ResponseEntity.ok(Map.of("name", applicationName, "health", "/health"));
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("activeTasks", taskStoreService.countActiveTasks());
        body.put("freeSlots", processingLock.getAvailablePermits());
        body.put("waitingTasks", processingLock.getQueueLength());
        return ResponseEntity.ok(body);
    }
}

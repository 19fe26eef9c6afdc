package com.marketloop.api.controller;

import com.marketloop.api.dto.response.HealthDetailedResponse;
import com.marketloop.config.LoopProperties;
import com.marketloop.reflection.ReasoningClient;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.scheduler.TaskGuard;
import com.marketloop.settings.SettingsService;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints.
 * <ul>
 *   <li>GET /api/health -- shallow liveness, no subsystem checks</li>
 *   <li>GET /api/health/detailed -- store, loop, breaker and per-task status</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final SettingsService settingsService;
    private final DailyLossBreaker dailyLossBreaker;
    private final TaskGuard taskGuard;
    private final ReasoningClient reasoningClient;
    private final LoopProperties loopProperties;

    public HealthController(
            SettingsService settingsService,
            DailyLossBreaker dailyLossBreaker,
            TaskGuard taskGuard,
            ReasoningClient reasoningClient,
            LoopProperties loopProperties) {
        this.settingsService = settingsService;
        this.dailyLossBreaker = dailyLossBreaker;
        this.taskGuard = taskGuard;
        this.reasoningClient = reasoningClient;
        this.loopProperties = loopProperties;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthDetailedResponse> detailedHealth() {
        boolean storeUp;
        boolean loopEnabled = false;
        try {
            loopEnabled = settingsService.snapshot().isLoopEnabled();
            storeUp = true;
        } catch (DataAccessException e) {
            log.warn("Health check: store unreachable: {}", e.getMessage());
            storeUp = false;
        }

        HealthDetailedResponse response = HealthDetailedResponse.builder()
                .status(storeUp ? "UP" : "DEGRADED")
                .store(storeUp ? "UP" : "DOWN")
                .loopEnabled(loopEnabled)
                .breakerLatched(dailyLossBreaker.isLatched())
                .paperTrade(loopProperties.isPaperTrade())
                .reasoningEnabled(reasoningClient.isEnabled())
                .tasks(taskGuard.status())
                .build();
        return ResponseEntity.ok(response);
    }
}

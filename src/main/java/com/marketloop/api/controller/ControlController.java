package com.marketloop.api.controller;

import com.marketloop.api.dto.request.StrategyToggleRequest;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.exception.BusinessException;
import com.marketloop.exception.ErrorCode;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.settings.SettingKey;
import com.marketloop.settings.SettingsService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator controls.
 * <ul>
 *   <li>POST /api/controls/pause, /resume -- writes bot_enabled</li>
 *   <li>POST /api/controls/strategies/{strategy}/enabled -- toggles one scanner</li>
 *   <li>POST /api/controls/breaker/reset -- clears the daily loss latch</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/controls")
public class ControlController {

    private static final Logger log = LoggerFactory.getLogger(ControlController.class);

    private final SettingsService settingsService;
    private final DailyLossBreaker dailyLossBreaker;

    public ControlController(SettingsService settingsService, DailyLossBreaker dailyLossBreaker) {
        this.settingsService = settingsService;
        this.dailyLossBreaker = dailyLossBreaker;
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause() {
        settingsService.write(SettingKey.BOT_ENABLED, "false", SettingsService.CHANGED_BY_API, "Paused via API");
        log.warn("Trading loop paused via API");
        return ResponseEntity.ok(Map.of("botEnabled", false));
    }

    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        settingsService.write(SettingKey.BOT_ENABLED, "true", SettingsService.CHANGED_BY_API, "Resumed via API");
        log.info("Trading loop resumed via API");
        return ResponseEntity.ok(Map.of("botEnabled", true));
    }

    @PostMapping("/strategies/{strategy}/enabled")
    public ResponseEntity<Map<String, Object>> toggleStrategy(
            @PathVariable String strategy, @Valid @RequestBody StrategyToggleRequest request) {
        StrategyType type;
        try {
            type = StrategyType.fromId(strategy);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, e.getMessage(), Map.of("strategy", strategy));
        }
        settingsService.write(
                type.getEnabledKey(),
                request.getEnabled().toString(),
                SettingsService.CHANGED_BY_API,
                "Strategy toggled via API");
        log.info("Strategy {} {} via API", type.getId(), request.getEnabled() ? "enabled" : "disabled");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("strategy", type.getId());
        body.put("enabled", request.getEnabled());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/breaker/reset")
    public ResponseEntity<Map<String, Object>> resetBreaker() {
        dailyLossBreaker.reset(SettingsService.CHANGED_BY_API);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("latched", dailyLossBreaker.isLatched());
        body.put("dailyRealizedPnl", dailyLossBreaker.getDailyRealizedPnl());
        return ResponseEntity.ok(body);
    }
}

package com.marketloop.api.controller;

import com.marketloop.domain.model.SettingChange;
import com.marketloop.settings.SettingsService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Control-plane settings. Unknown keys are rejected with 400; tunable keys outside
 * their guardrail with 422.
 */
@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> getAll() {
        return ResponseEntity.ok(settingsService.getAll());
    }

    @PutMapping
    public ResponseEntity<Map<String, String>> update(@RequestBody Map<String, String> changes) {
        return ResponseEntity.ok(settingsService.update(changes, SettingsService.CHANGED_BY_API, "Updated via API"));
    }

    @GetMapping("/history")
    public ResponseEntity<List<SettingChange>> history() {
        return ResponseEntity.ok(settingsService.getHistory());
    }
}

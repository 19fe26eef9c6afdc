package com.marketloop.unit.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marketloop.api.controller.HealthController;
import com.marketloop.config.ApiResponseAdvice;
import com.marketloop.config.LoopProperties;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.reflection.ReasoningClient;
import com.marketloop.risk.DailyLossBreaker;
import com.marketloop.scheduler.TaskGuard;
import com.marketloop.settings.SettingsService;
import com.marketloop.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SettingsService settingsService;

    @Mock
    private DailyLossBreaker dailyLossBreaker;

    @Mock
    private ReasoningClient reasoningClient;

    @BeforeEach
    void setUp() {
        HealthController controller = new HealthController(
                settingsService,
                dailyLossBreaker,
                new TaskGuard(MutableClock.at("2026-03-10T12:00:00Z")),
                reasoningClient,
                new LoopProperties());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("GET /api/health is a shallow UP")
    void shallow() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UP"));
    }

    @Test
    @DisplayName("Detailed health reports loop, breaker and tasks")
    void detailed() throws Exception {
        when(settingsService.snapshot()).thenReturn(ConfigSnapshot.defaults());
        when(dailyLossBreaker.isLatched()).thenReturn(true);
        when(reasoningClient.isEnabled()).thenReturn(false);

        mockMvc.perform(get("/api/health/detailed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("UP"))
                .andExpect(jsonPath("$.data.loopEnabled").value(true))
                .andExpect(jsonPath("$.data.breakerLatched").value(true))
                .andExpect(jsonPath("$.data.paperTrade").value(true))
                .andExpect(jsonPath("$.data.tasks.scan_and_trade.inProgress").value(false));
    }

    @Test
    @DisplayName("Unreachable store degrades the detailed view instead of failing")
    void storeDown() throws Exception {
        when(settingsService.snapshot()).thenThrow(new DataAccessResourceFailureException("db locked"));

        mockMvc.perform(get("/api/health/detailed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("DEGRADED"))
                .andExpect(jsonPath("$.data.store").value("DOWN"));
    }
}

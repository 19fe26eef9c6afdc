package com.marketloop.unit.controller;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.marketloop.api.controller.RecommendationController;
import com.marketloop.config.ApiResponseAdvice;
import com.marketloop.domain.enums.RecommendationStatus;
import com.marketloop.domain.enums.RecommendationTrigger;
import com.marketloop.domain.model.Recommendation;
import com.marketloop.exception.BusinessException;
import com.marketloop.exception.ErrorCode;
import com.marketloop.exception.GlobalExceptionHandler;
import com.marketloop.exception.GuardrailViolationException;
import com.marketloop.exception.ResourceNotFoundException;
import com.marketloop.recommendation.RecommendationService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private RecommendationService recommendationService;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RecommendationController(recommendationService))
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static Recommendation recommendation(RecommendationStatus status) {
        return Recommendation.builder()
                .id("rec-1")
                .settingKey("max_position_pct")
                .currentValue("0.15")
                .proposedValue("0.12")
                .trigger(RecommendationTrigger.CONSECUTIVE_LOSSES)
                .status(status)
                .build();
    }

    @Test
    @DisplayName("GET /api/recommendations defaults to pending")
    void listPending() throws Exception {
        when(recommendationService.list("pending")).thenReturn(List.of(recommendation(RecommendationStatus.PENDING)));

        mockMvc.perform(get("/api/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("rec-1"))
                .andExpect(jsonPath("$.data[0].status").value("PENDING"));
    }

    @Test
    @DisplayName("Approve returns the approved recommendation")
    void approve() throws Exception {
        when(recommendationService.approve("rec-1")).thenReturn(recommendation(RecommendationStatus.APPROVED));

        mockMvc.perform(post("/api/recommendations/rec-1/approve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("APPROVED"));
    }

    @Test
    @DisplayName("Approving a resolved recommendation is a 409")
    void approveConflict() throws Exception {
        when(recommendationService.approve("rec-1"))
                .thenThrow(new BusinessException(ErrorCode.INVALID_STATE, "Recommendation rec-1 is already denied"));

        mockMvc.perform(post("/api/recommendations/rec-1/approve"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("INVALID_STATE"));
    }

    @Test
    @DisplayName("Approving an out-of-bounds value is a 422")
    void approveGuardrail() throws Exception {
        when(recommendationService.approve("rec-1"))
                .thenThrow(new GuardrailViolationException("max_position_pct", "0.90", "out of range"));

        mockMvc.perform(post("/api/recommendations/rec-1/approve"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("GUARDRAIL_VIOLATION"));
    }

    @Test
    @DisplayName("Unknown id is a 404")
    void unknown() throws Exception {
        when(recommendationService.approve("nope")).thenThrow(new ResourceNotFoundException("Recommendation", "nope"));

        mockMvc.perform(post("/api/recommendations/nope/approve")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Deny requires a reason")
    void denyWithoutReason() throws Exception {
        mockMvc.perform(post("/api/recommendations/rec-1/deny")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"\"}"))
                .andExpect(status().isBadRequest());

        verify(recommendationService, never()).deny(anyString(), anyString());
    }

    @Test
    @DisplayName("Deny passes the reason through")
    void deny() throws Exception {
        Recommendation denied = recommendation(RecommendationStatus.DENIED);
        denied.setDenialReason("not yet");
        when(recommendationService.deny("rec-1", "not yet")).thenReturn(denied);

        mockMvc.perform(post("/api/recommendations/rec-1/deny")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\": \"not yet\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.denialReason").value("not yet"));
    }
}

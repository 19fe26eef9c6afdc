package com.marketloop.domain.model;

import com.marketloop.domain.enums.RecommendationStatus;
import com.marketloop.domain.enums.RecommendationTrigger;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recommendation {

    private String id;
    private String settingKey;
    private String currentValue;
    private String proposedValue;
    private String reasoning;
    private RecommendationTrigger trigger;
    private RecommendationStatus status;
    private String denialReason;
    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
}

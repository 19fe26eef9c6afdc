package com.marketloop.entity;

import com.marketloop.domain.enums.RecommendationStatus;
import com.marketloop.domain.enums.RecommendationTrigger;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for parameter-change proposals awaiting or past human review.
 */
@Entity
@Table(name = "recommendations", indexes = @Index(name = "idx_recommendations_status", columnList = "status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecommendationEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "setting_key", length = 64, nullable = false)
    private String settingKey;

    @Column(name = "current_value", length = 64)
    private String currentValue;

    @Column(name = "proposed_value", length = 64)
    private String proposedValue;

    @Column(length = 2000)
    private String reasoning;

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", columnDefinition = "varchar(24)")
    private RecommendationTrigger trigger;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(12)")
    private RecommendationStatus status;

    @Column(name = "denial_reason", length = 500)
    private String denialReason;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}

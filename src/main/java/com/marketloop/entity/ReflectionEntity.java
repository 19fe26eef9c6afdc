package com.marketloop.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for post-trade reflections. At most one row per trade. */
@Entity
@Table(name = "reflections", uniqueConstraints = @UniqueConstraint(name = "uk_reflections_trade", columnNames = "trade_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReflectionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trade_id", length = 36, nullable = false)
    private String tradeId;

    @Column(length = 2000)
    private String summary;

    @Column(name = "what_worked", length = 2000)
    private String whatWorked;

    @Column(name = "what_failed", length = 2000)
    private String whatFailed;

    @Column(name = "confidence_score")
    private int confidenceScore;

    @Column(name = "strategy_suggestion", length = 2000)
    private String strategySuggestion;

    private boolean fallback;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}

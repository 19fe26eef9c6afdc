package com.marketloop.repository.jpa;

import com.marketloop.domain.enums.RecommendationStatus;
import com.marketloop.domain.enums.RecommendationTrigger;
import com.marketloop.entity.RecommendationEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for recommendations.
 * Trigger de-duplication relies on {@link #existsByTriggerAndCreatedAtAfter}.
 */
@Repository
public interface RecommendationJpaRepository extends JpaRepository<RecommendationEntity, String> {

    List<RecommendationEntity> findByStatusOrderByCreatedAtDesc(RecommendationStatus status);

    List<RecommendationEntity> findAllByOrderByCreatedAtDesc();

    boolean existsBySettingKeyAndStatus(String settingKey, RecommendationStatus status);

    boolean existsByTriggerAndCreatedAtAfter(RecommendationTrigger trigger, LocalDateTime since);

    List<RecommendationEntity> findByStatusAndCreatedAtBefore(RecommendationStatus status, LocalDateTime cutoff);
}

package com.marketloop.repository.jpa;

import com.marketloop.entity.ReflectionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReflectionJpaRepository extends JpaRepository<ReflectionEntity, Long> {

    boolean existsByTradeId(String tradeId);

    List<ReflectionEntity> findAllByOrderByCreatedAtDesc();

    /** Latest non-fallback suggestions, fed back into prompts as recent learnings. */
    List<ReflectionEntity> findTop5ByFallbackFalseAndStrategySuggestionIsNotNullOrderByCreatedAtDesc();
}

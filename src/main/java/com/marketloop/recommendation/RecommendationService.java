package com.marketloop.recommendation;

import com.marketloop.domain.enums.RecommendationStatus;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.Recommendation;
import com.marketloop.entity.RecommendationEntity;
import com.marketloop.exception.BusinessException;
import com.marketloop.exception.ErrorCode;
import com.marketloop.exception.ResourceNotFoundException;
import com.marketloop.mapper.RecommendationMapper;
import com.marketloop.repository.jpa.RecommendationJpaRepository;
import com.marketloop.settings.ParamGuardrails;
import com.marketloop.settings.SettingKey;
import com.marketloop.settings.SettingsService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Human-gated transitions of a recommendation: PENDING to APPROVED or DENIED, plus
 * daily auto-expiry of stale PENDING rows. Approval re-checks the guardrail and writes
 * exactly one setting.
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final RecommendationJpaRepository recommendationJpaRepository;
    private final RecommendationMapper recommendationMapper;
    private final ParamGuardrails paramGuardrails;
    private final SettingsService settingsService;
    private final Clock clock;

    public RecommendationService(
            RecommendationJpaRepository recommendationJpaRepository,
            RecommendationMapper recommendationMapper,
            ParamGuardrails paramGuardrails,
            SettingsService settingsService,
            Clock clock) {
        this.recommendationJpaRepository = recommendationJpaRepository;
        this.recommendationMapper = recommendationMapper;
        this.paramGuardrails = paramGuardrails;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    /**
     * @param status pending, approved, denied or all; null means pending
     */
    @Transactional(readOnly = true)
    public List<Recommendation> list(String status) {
        if (status != null && status.equalsIgnoreCase("all")) {
            return recommendationMapper.toDomainList(recommendationJpaRepository.findAllByOrderByCreatedAtDesc());
        }
        RecommendationStatus filter;
        try {
            filter = status == null || status.isBlank()
                    ? RecommendationStatus.PENDING
                    : RecommendationStatus.valueOf(status.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Invalid status filter: " + status + " (expected pending, approved, denied or all)");
        }
        return recommendationMapper.toDomainList(recommendationJpaRepository.findByStatusOrderByCreatedAtDesc(filter));
    }

    @Transactional
    public Recommendation approve(String id) {
        RecommendationEntity entity = requirePending(id);
        paramGuardrails.requireTunable(entity.getSettingKey(), entity.getProposedValue());

        SettingKey key = SettingKey.fromKey(entity.getSettingKey()).orElseThrow();
        settingsService.write(key, entity.getProposedValue(), SettingsService.CHANGED_BY_API,
                "Recommendation " + id + " approved");

        entity.setStatus(RecommendationStatus.APPROVED);
        entity.setResolvedAt(LocalDateTime.now(clock));
        recommendationJpaRepository.save(entity);
        log.info("Recommendation {} approved: {} = {}", id, entity.getSettingKey(), entity.getProposedValue());
        return recommendationMapper.toDomain(entity);
    }

    @Transactional
    public Recommendation deny(String id, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "A denial reason is required");
        }
        RecommendationEntity entity = requirePending(id);
        entity.setStatus(RecommendationStatus.DENIED);
        entity.setDenialReason(reason.trim());
        entity.setResolvedAt(LocalDateTime.now(clock));
        recommendationJpaRepository.save(entity);
        log.info("Recommendation {} denied: {}", id, reason.trim());
        return recommendationMapper.toDomain(entity);
    }

    /** Denies PENDING rows older than {@code recommendation_expiry_days}. */
    @Transactional
    public int expireStale(ConfigSnapshot config) {
        int days = config.getInt(SettingKey.RECOMMENDATION_EXPIRY_DAYS);
        LocalDateTime now = LocalDateTime.now(clock);
        List<RecommendationEntity> stale =
                recommendationJpaRepository.findByStatusAndCreatedAtBefore(RecommendationStatus.PENDING, now.minusDays(days));
        for (RecommendationEntity entity : stale) {
            entity.setStatus(RecommendationStatus.DENIED);
            entity.setDenialReason("Auto-expired after " + days + " days");
            entity.setResolvedAt(now);
        }
        recommendationJpaRepository.saveAll(stale);
        if (!stale.isEmpty()) {
            log.info("Auto-expired {} pending recommendations older than {} days", stale.size(), days);
        }
        return stale.size();
    }

    private RecommendationEntity requirePending(String id) {
        RecommendationEntity entity = recommendationJpaRepository
                .findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Recommendation", id));
        if (entity.getStatus() != RecommendationStatus.PENDING) {
            throw new BusinessException(
                    ErrorCode.INVALID_STATE,
                    "Recommendation " + id + " is already " + entity.getStatus().name().toLowerCase(),
                    Map.of("status", entity.getStatus().name()));
        }
        return entity;
    }
}

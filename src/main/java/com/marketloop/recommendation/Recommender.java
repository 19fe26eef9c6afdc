package com.marketloop.recommendation;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.domain.enums.RecommendationStatus;
import com.marketloop.domain.enums.RecommendationTrigger;
import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.Recommendation;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.domain.model.WeeklyReport;
import com.marketloop.event.TradeClosedEvent;
import com.marketloop.mapper.RecommendationMapper;
import com.marketloop.mapper.TradeMapper;
import com.marketloop.reflection.ReasoningClient;
import com.marketloop.reflection.ReflectionService;
import com.marketloop.reporting.PerformanceCalculator;
import com.marketloop.reporting.PerformanceStats;
import com.marketloop.repository.jpa.RecommendationJpaRepository;
import com.marketloop.repository.jpa.TradeJpaRepository;
import com.marketloop.settings.ParamGuardrails;
import com.marketloop.settings.SettingKey;
import com.marketloop.settings.SettingsService;
import com.marketloop.settings.TunableParameter;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Detects underperformance and files parameter-change proposals for human review.
 *
 * <p>Triggers:
 * <ul>
 *   <li>CONSECUTIVE_LOSSES: the last {@code consecutive_loss_trigger} closed trades all lost</li>
 *   <li>CUMULATIVE_LOSSES: {@code cumulative_loss_trigger} losing trades within
 *       {@code cumulative_loss_window_days}</li>
 *   <li>WEEKLY_REPORT: after each weekly report</li>
 * </ul>
 *
 * <p>Proposals come from the reasoning service and must pass {@link ParamGuardrails}.
 * When none survive after a loss trigger, or after a losing week, the deterministic
 * fallback tightens {@code max_position_pct} (or {@code daily_loss_limit_pct} once the
 * former is at its floor) by 20%. Recommendations are only ever created PENDING;
 * nothing here writes settings.
 */
@Service
public class Recommender {

    private static final Logger log = LoggerFactory.getLogger(Recommender.class);

    static final BigDecimal FALLBACK_REDUCTION = new BigDecimal("0.80");
    static final String SYSTEM_PROMPT = "You tune risk parameters for a prediction market trading bot. "
            + "Propose conservative changes only within the stated bounds. Return JSON only.";

    private final TradeJpaRepository tradeJpaRepository;
    private final RecommendationJpaRepository recommendationJpaRepository;
    private final TradeMapper tradeMapper;
    private final RecommendationMapper recommendationMapper;
    private final PerformanceCalculator performanceCalculator;
    private final ReasoningClient reasoningClient;
    private final ReflectionService reflectionService;
    private final ParamGuardrails paramGuardrails;
    private final SettingsService settingsService;
    private final Clock clock;

    public Recommender(
            TradeJpaRepository tradeJpaRepository,
            RecommendationJpaRepository recommendationJpaRepository,
            TradeMapper tradeMapper,
            RecommendationMapper recommendationMapper,
            PerformanceCalculator performanceCalculator,
            ReasoningClient reasoningClient,
            ReflectionService reflectionService,
            ParamGuardrails paramGuardrails,
            SettingsService settingsService,
            Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.recommendationJpaRepository = recommendationJpaRepository;
        this.tradeMapper = tradeMapper;
        this.recommendationMapper = recommendationMapper;
        this.performanceCalculator = performanceCalculator;
        this.reasoningClient = reasoningClient;
        this.reflectionService = reflectionService;
        this.paramGuardrails = paramGuardrails;
        this.settingsService = settingsService;
        this.clock = clock;
    }

    /** Loss triggers are checked after every losing close, off the monitor thread. */
    @Async("eventExecutor")
    @EventListener
    public void onTradeClosed(TradeClosedEvent event) {
        if (event.getTrade().isLoss()) {
            evaluateLossTriggers(settingsService.snapshot());
        }
    }

    /** @return recommendations created by whichever loss triggers fired */
    public synchronized List<Recommendation> evaluateLossTriggers(ConfigSnapshot config) {
        List<Recommendation> created = new ArrayList<>();
        LocalDateTime now = LocalDateTime.now(clock);

        int streak = config.getInt(SettingKey.CONSECUTIVE_LOSS_TRIGGER);
        if (streak > 0) {
            List<TradeRecord> recent = tradeMapper.toDomainList(
                    tradeJpaRepository.findByStatusOrderByResolvedAtDesc(TradeStatus.CLOSED, PageRequest.of(0, streak)));
            if (recent.size() == streak && recent.stream().allMatch(TradeRecord::isLoss)) {
                LocalDateTime oldest = recent.get(recent.size() - 1).getResolvedAt();
                if (!recommendationJpaRepository.existsByTriggerAndCreatedAtAfter(
                        RecommendationTrigger.CONSECUTIVE_LOSSES, oldest)) {
                    log.warn("{} consecutive losing trades, generating recommendations", streak);
                    created.addAll(runTrigger(
                            RecommendationTrigger.CONSECUTIVE_LOSSES, performanceCalculator.calculate(recent), config));
                }
            }
        }

        int cumulative = config.getInt(SettingKey.CUMULATIVE_LOSS_TRIGGER);
        LocalDateTime windowStart = now.minusDays(config.getInt(SettingKey.CUMULATIVE_LOSS_WINDOW_DAYS));
        if (cumulative > 0 && tradeJpaRepository.countLossesSince(windowStart) >= cumulative
                && !recommendationJpaRepository.existsByTriggerAndCreatedAtAfter(
                        RecommendationTrigger.CUMULATIVE_LOSSES, windowStart)) {
            List<TradeRecord> window =
                    tradeMapper.toDomainList(tradeJpaRepository.findClosedBetween(windowStart, now.plusSeconds(1)));
            log.warn("{} or more losing trades since {}, generating recommendations", cumulative, windowStart);
            created.addAll(runTrigger(
                    RecommendationTrigger.CUMULATIVE_LOSSES, performanceCalculator.calculate(window), config));
        }
        return created;
    }

    public synchronized List<Recommendation> onWeeklyReport(WeeklyReport report, ConfigSnapshot config) {
        PerformanceStats stats = PerformanceStats.builder()
                .totalTrades(report.getTotalTrades())
                .winRate(report.getWinRate())
                .netPnl(report.getNetPnl())
                .bestStrategy(report.getBestStrategy())
                .worstStrategy(report.getWorstStrategy())
                .strategyBreakdown(report.getStrategyBreakdown())
                .build();
        return runTrigger(RecommendationTrigger.WEEKLY_REPORT, stats, config);
    }

    List<Recommendation> runTrigger(RecommendationTrigger trigger, PerformanceStats stats, ConfigSnapshot config) {
        List<Proposal> valid = new ArrayList<>();
        for (Proposal proposal : advisoryProposals(trigger, stats, config)) {
            Optional<String> violation = paramGuardrails.findTunableViolation(proposal.getSettingKey(),
                    proposal.getProposedValue());
            if (violation.isPresent()) {
                log.info("Discarding proposal {}={}: {}", proposal.getSettingKey(), proposal.getProposedValue(),
                        violation.get());
                continue;
            }
            valid.add(proposal);
        }

        boolean needsFallback = trigger.isLossTrigger() || stats.getNetPnl().signum() < 0;
        if (valid.isEmpty() && needsFallback) {
            fallbackProposal(trigger, config).ifPresent(valid::add);
        }
        return emit(trigger, valid, config);
    }

    /** Tightens max_position_pct by 20%, or daily_loss_limit_pct once the former is at its minimum. */
    Optional<Proposal> fallbackProposal(RecommendationTrigger trigger, ConfigSnapshot config) {
        for (TunableParameter parameter : List.of(TunableParameter.MAX_POSITION_PCT, TunableParameter.DAILY_LOSS_LIMIT_PCT)) {
            BigDecimal current = config.getDecimal(parameter.getSettingKey());
            if (current.compareTo(parameter.getMin()) <= 0) {
                continue;
            }
            BigDecimal reduced = paramGuardrails.clamp(
                    parameter, current.multiply(FALLBACK_REDUCTION).setScale(4, RoundingMode.HALF_UP));
            return Optional.of(new Proposal(
                    parameter.getKey(),
                    format(reduced),
                    String.format("%s trigger fired with no usable advisory proposal; reducing %s by 20%% from %s",
                            trigger.name().toLowerCase(), parameter.getKey(), format(current))));
        }
        log.warn("Fallback recommendation skipped: max_position_pct and daily_loss_limit_pct already at their minimum");
        return Optional.empty();
    }

    private List<Recommendation> emit(RecommendationTrigger trigger, List<Proposal> proposals, ConfigSnapshot config) {
        List<Recommendation> created = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        LocalDateTime now = LocalDateTime.now(clock);
        for (Proposal proposal : proposals) {
            String key = proposal.getSettingKey();
            if (!seen.add(key)) {
                continue;
            }
            if (recommendationJpaRepository.existsBySettingKeyAndStatus(key, RecommendationStatus.PENDING)) {
                log.info("Skipping proposal for {}: a pending recommendation already exists", key);
                continue;
            }
            SettingKey settingKey = SettingKey.fromKey(key).orElseThrow();
            String current = config.getString(settingKey);
            if (config.getDecimal(settingKey).compareTo(new BigDecimal(proposal.getProposedValue().trim())) == 0) {
                continue;
            }

            Recommendation recommendation = Recommendation.builder()
                    .id(UUID.randomUUID().toString())
                    .settingKey(key)
                    .currentValue(current)
                    .proposedValue(proposal.getProposedValue().trim())
                    .reasoning(proposal.getReasoning())
                    .trigger(trigger)
                    .status(RecommendationStatus.PENDING)
                    .createdAt(now)
                    .build();
            recommendationJpaRepository.save(recommendationMapper.toEntity(recommendation));
            log.info("Recommendation {} created: {} {} -> {} ({})", recommendation.getId(), key, current,
                    recommendation.getProposedValue(), trigger);
            created.add(recommendation);
        }
        return created;
    }

    private List<Proposal> advisoryProposals(RecommendationTrigger trigger, PerformanceStats stats, ConfigSnapshot config) {
        Optional<JsonNode> reply = reasoningClient.completeJson(SYSTEM_PROMPT, buildPrompt(trigger, stats, config), 800);
        if (reply.isEmpty()) {
            return List.of();
        }
        JsonNode items = reply.get().isArray() ? reply.get() : reply.get().path("recommendations");
        List<Proposal> proposals = new ArrayList<>();
        for (JsonNode item : items) {
            String key = item.path("setting_key").asText("");
            String value = item.path("proposed_value").asText("");
            if (!key.isBlank() && !value.isBlank()) {
                proposals.add(new Proposal(key, value, item.path("reasoning").asText("")));
            }
        }
        return proposals;
    }

    String buildPrompt(RecommendationTrigger trigger, PerformanceStats stats, ConfigSnapshot config) {
        StringBuilder parameters = new StringBuilder();
        for (TunableParameter parameter : TunableParameter.values()) {
            parameters.append(String.format(
                    "- %s = %s (min %s, max %s): %s%n",
                    parameter.getKey(),
                    config.getString(parameter.getSettingKey()),
                    parameter.getMin(),
                    parameter.getMax(),
                    parameter.getDescription()));
        }
        return String.format(
                "Trigger: %s%n"
                        + "Trades: %d, win rate %s%%, net PnL $%s%n"
                        + "Best strategy: %s, worst strategy: %s%n"
                        + "Per-strategy net PnL: %s%n%n"
                        + "Tunable parameters:%n%s%n"
                        + "Recent learnings:%n%s%n%n"
                        + "Propose at most 3 changes. Return a JSON array: "
                        + "[{\"setting_key\": \"...\", \"proposed_value\": \"...\", \"reasoning\": \"...\"}]",
                trigger.name().toLowerCase(),
                stats.getTotalTrades(),
                stats.getWinRate(),
                stats.getNetPnl(),
                stats.getBestStrategy(),
                stats.getWorstStrategy(),
                stats.getStrategyBreakdown(),
                parameters,
                reflectionService.recentLearnings());
    }

    private static String format(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}

package com.marketloop.reflection;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.domain.enums.TradeStatus;
import com.marketloop.domain.model.Reflection;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.entity.ReflectionEntity;
import com.marketloop.mapper.ReflectionMapper;
import com.marketloop.mapper.TradeMapper;
import com.marketloop.repository.jpa.ReflectionJpaRepository;
import com.marketloop.repository.jpa.TradeJpaRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Writes the post-mortem for a closed trade. The reasoning service drafts it; when
 * the reply is missing or malformed a deterministic fallback is stored instead.
 *
 * <p>At most one reflection per trade: an existence check here, backed by the unique
 * constraint on {@code reflections.trade_id}.
 */
@Service
public class ReflectionService {

    private static final Logger log = LoggerFactory.getLogger(ReflectionService.class);

    static final String SYSTEM_PROMPT = "You are a trading journal for a prediction market bot. "
            + "Analyze trades honestly and give actionable insights. Return JSON only.";

    private static final int MAX_TOKENS = 500;

    private final ReasoningClient reasoningClient;
    private final ReflectionJpaRepository reflectionJpaRepository;
    private final TradeJpaRepository tradeJpaRepository;
    private final ReflectionMapper reflectionMapper;
    private final TradeMapper tradeMapper;
    private final Clock clock;

    public ReflectionService(
            ReasoningClient reasoningClient,
            ReflectionJpaRepository reflectionJpaRepository,
            TradeJpaRepository tradeJpaRepository,
            ReflectionMapper reflectionMapper,
            TradeMapper tradeMapper,
            Clock clock) {
        this.reasoningClient = reasoningClient;
        this.reflectionJpaRepository = reflectionJpaRepository;
        this.tradeJpaRepository = tradeJpaRepository;
        this.reflectionMapper = reflectionMapper;
        this.tradeMapper = tradeMapper;
        this.clock = clock;
    }

    /** @return the stored reflection, or empty when the trade is unknown, not closed, or already reflected */
    public Optional<Reflection> reflect(String tradeId) {
        if (reflectionJpaRepository.existsByTradeId(tradeId)) {
            log.debug("Trade {} already reflected", tradeId);
            return Optional.empty();
        }
        Optional<TradeRecord> found = tradeJpaRepository.findById(tradeId).map(tradeMapper::toDomain);
        if (found.isEmpty() || found.get().getStatus() != TradeStatus.CLOSED) {
            log.warn("Trade {} not found or not closed, no reflection written", tradeId);
            return Optional.empty();
        }
        TradeRecord trade = found.get();

        Reflection reflection = reasoningClient
                .completeJson(SYSTEM_PROMPT, buildPrompt(trade), MAX_TOKENS)
                .flatMap(json -> fromReply(trade, json))
                .orElseGet(() -> fallback(trade));
        reflection.setCreatedAt(LocalDateTime.now(clock));

        ReflectionEntity saved;
        try {
            saved = reflectionJpaRepository.saveAndFlush(reflectionMapper.toEntity(reflection));
        } catch (DataIntegrityViolationException e) {
            log.info("Reflection for trade {} written concurrently, keeping the existing one", tradeId);
            return Optional.empty();
        }

        tradeJpaRepository.findById(tradeId).ifPresent(entity -> {
            entity.setReflected(true);
            tradeJpaRepository.save(entity);
        });
        log.info("Reflection saved for trade {} (fallback={})", tradeId, reflection.isFallback());
        return Optional.of(reflectionMapper.toDomain(saved));
    }

    public List<Reflection> getAll() {
        return reflectionMapper.toDomainList(reflectionJpaRepository.findAllByOrderByCreatedAtDesc());
    }

    /** The latest improvement suggestions, one per line, for use in later prompts. */
    public String recentLearnings() {
        List<ReflectionEntity> recent =
                reflectionJpaRepository.findTop5ByFallbackFalseAndStrategySuggestionIsNotNullOrderByCreatedAtDesc();
        if (recent.isEmpty()) {
            return "No reflections yet.";
        }
        StringBuilder learnings = new StringBuilder();
        for (ReflectionEntity entity : recent) {
            learnings.append("- ").append(entity.getSummary()).append('\n');
            learnings.append("  Suggestion: ").append(entity.getStrategySuggestion()).append('\n');
        }
        return learnings.toString().trim();
    }

    String buildPrompt(TradeRecord trade) {
        double hoursHeld = trade.getCreatedAt() != null && trade.getResolvedAt() != null
                ? Duration.between(trade.getCreatedAt(), trade.getResolvedAt()).toMinutes() / 60.0
                : 0.0;
        return String.format(
                "Analyze this completed trade:%n"
                        + "Market: %s%n"
                        + "Strategy: %s%n"
                        + "Side: %s%n"
                        + "Entry price: %s%n"
                        + "Exit price: %s%n"
                        + "Net PnL: $%s%n"
                        + "Result: %s%n"
                        + "Exit reason: %s%n"
                        + "Original reasoning: %s%n"
                        + "Time held: %.1f hours%n%n"
                        + "Return JSON: {\"summary\": \"2 sentence summary\", \"what_worked\": \"what went right or null\", "
                        + "\"what_failed\": \"what went wrong or null\", \"confidence_score\": 1-10, "
                        + "\"strategy_suggestion\": \"one actionable improvement for next time\"}",
                trade.getMarketTitle() != null ? trade.getMarketTitle() : trade.getMarketId(),
                trade.getStrategy().getId(),
                trade.getSide().wireValue(),
                trade.getEntryPrice(),
                trade.getExitPrice(),
                trade.getNetPnl(),
                trade.isLoss() ? "LOSS" : "WIN",
                trade.getExitReason(),
                trade.getEntryRationale() != null ? trade.getEntryRationale() : "No reasoning provided",
                hoursHeld);
    }

    /** Empty when the reply lacks a summary or the confidence score is outside 1..10. */
    Optional<Reflection> fromReply(TradeRecord trade, JsonNode json) {
        String summary = textOrNull(json, "summary");
        JsonNode confidence = json.path("confidence_score");
        if (summary == null || !confidence.canConvertToInt()) {
            log.warn("Reflection reply for trade {} is incomplete, using fallback", trade.getId());
            return Optional.empty();
        }
        int score = confidence.asInt();
        if (score < 1 || score > 10) {
            log.warn("Reflection reply for trade {} has confidence {} outside 1..10, using fallback", trade.getId(), score);
            return Optional.empty();
        }
        return Optional.of(Reflection.builder()
                .tradeId(trade.getId())
                .summary(summary)
                .whatWorked(textOrNull(json, "what_worked"))
                .whatFailed(textOrNull(json, "what_failed"))
                .confidenceScore(score)
                .strategySuggestion(textOrNull(json, "strategy_suggestion"))
                .fallback(false)
                .build());
    }

    Reflection fallback(TradeRecord trade) {
        BigDecimal net = trade.getNetPnl() != null ? trade.getNetPnl() : BigDecimal.ZERO;
        return Reflection.builder()
                .tradeId(trade.getId())
                .summary(String.format("Trade %s $%s.", net.signum() > 0 ? "won" : "lost", net.abs().toPlainString()))
                .whatFailed("Reflection generation failed.")
                .confidenceScore(5)
                .strategySuggestion("Review trade manually.")
                .fallback(true)
                .build();
    }

    private static String textOrNull(JsonNode json, String field) {
        JsonNode node = json.path(field);
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() || "null".equalsIgnoreCase(text) ? null : text;
    }
}

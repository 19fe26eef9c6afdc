package com.marketloop.reporting;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketloop.domain.model.TradeRecord;
import com.marketloop.domain.model.WeeklyReport;
import com.marketloop.entity.WeeklyReportEntity;
import com.marketloop.mapper.TradeMapper;
import com.marketloop.mapper.WeeklyReportMapper;
import com.marketloop.reflection.ReasoningClient;
import com.marketloop.reflection.ReflectionService;
import com.marketloop.repository.jpa.TradeJpaRepository;
import com.marketloop.repository.jpa.WeeklyReportJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Builds the weekly performance report over the seven days ending today (UTC). At most
 * one report per week start; weeks without closed trades produce none.
 */
@Service
public class WeeklyReportService {

    private static final Logger log = LoggerFactory.getLogger(WeeklyReportService.class);

    static final String SYSTEM_PROMPT = "You are a trading performance analyst for a prediction market bot. "
            + "Give honest, data-driven weekly summaries. Return JSON only.";

    private final TradeJpaRepository tradeJpaRepository;
    private final WeeklyReportJpaRepository weeklyReportJpaRepository;
    private final TradeMapper tradeMapper;
    private final WeeklyReportMapper weeklyReportMapper;
    private final PerformanceCalculator performanceCalculator;
    private final ReasoningClient reasoningClient;
    private final ReflectionService reflectionService;
    private final Clock clock;

    public WeeklyReportService(
            TradeJpaRepository tradeJpaRepository,
            WeeklyReportJpaRepository weeklyReportJpaRepository,
            TradeMapper tradeMapper,
            WeeklyReportMapper weeklyReportMapper,
            PerformanceCalculator performanceCalculator,
            ReasoningClient reasoningClient,
            ReflectionService reflectionService,
            Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.weeklyReportJpaRepository = weeklyReportJpaRepository;
        this.tradeMapper = tradeMapper;
        this.weeklyReportMapper = weeklyReportMapper;
        this.performanceCalculator = performanceCalculator;
        this.reasoningClient = reasoningClient;
        this.reflectionService = reflectionService;
        this.clock = clock;
    }

    public Optional<WeeklyReport> generate() {
        LocalDate weekEnd = LocalDate.now(clock);
        LocalDate weekStart = weekEnd.minusDays(7);
        if (weeklyReportJpaRepository.existsByWeekStart(weekStart)) {
            log.info("Weekly report for {} already exists", weekStart);
            return Optional.empty();
        }

        List<TradeRecord> trades = closedTradesBetween(weekStart, weekEnd);
        if (trades.isEmpty()) {
            log.info("No closed trades between {} and {}, skipping weekly report", weekStart, weekEnd);
            return Optional.empty();
        }
        PerformanceStats stats = performanceCalculator.calculate(trades);

        String summary = reasoningClient
                .completeJson(SYSTEM_PROMPT, buildPrompt(weekStart, weekEnd, stats), 600)
                .map(json -> json.path("summary"))
                .filter(JsonNode::isTextual)
                .map(JsonNode::asText)
                .filter(text -> !text.isBlank())
                .orElseGet(() -> fallbackSummary(weekStart, stats));

        WeeklyReport report = WeeklyReport.builder()
                .weekStart(weekStart)
                .weekEnd(weekEnd)
                .totalTrades(stats.getTotalTrades())
                .winRate(stats.getWinRate())
                .netPnl(stats.getNetPnl())
                .bestStrategy(stats.getBestStrategy())
                .worstStrategy(stats.getWorstStrategy())
                .strategyBreakdown(stats.getStrategyBreakdown())
                .summary(summary)
                .createdAt(LocalDateTime.now(clock))
                .build();

        WeeklyReportEntity saved;
        try {
            saved = weeklyReportJpaRepository.saveAndFlush(weeklyReportMapper.toEntity(report));
        } catch (DataIntegrityViolationException e) {
            log.info("Weekly report for {} written concurrently", weekStart);
            return Optional.empty();
        }
        log.info("Weekly report saved for {} to {}: {} trades, net {}", weekStart, weekEnd, stats.getTotalTrades(),
                stats.getNetPnl());
        return Optional.of(weeklyReportMapper.toDomain(saved));
    }

    public List<WeeklyReport> getAll() {
        return weeklyReportMapper.toDomainList(weeklyReportJpaRepository.findAllByOrderByWeekStartDesc());
    }

    public List<TradeRecord> closedTradesBetween(LocalDate from, LocalDate to) {
        return tradeMapper.toDomainList(
                tradeJpaRepository.findClosedBetween(from.atStartOfDay(), to.plusDays(1).atStartOfDay()));
    }

    private String buildPrompt(LocalDate weekStart, LocalDate weekEnd, PerformanceStats stats) {
        return String.format(
                "Weekly trading performance summary:%n"
                        + "Period: %s to %s%n"
                        + "Total trades: %d%n"
                        + "Win rate: %s%%%n"
                        + "Net PnL: $%s%n"
                        + "Best strategy: %s%n"
                        + "Worst strategy: %s%n"
                        + "Strategy breakdown: %s%n%n"
                        + "Recent trade reflections:%n%s%n%n"
                        + "Return JSON: {\"summary\": \"3-4 sentence overview\"}",
                weekStart,
                weekEnd,
                stats.getTotalTrades(),
                stats.getWinRate(),
                stats.getNetPnl(),
                stats.getBestStrategy(),
                stats.getWorstStrategy(),
                stats.getStrategyBreakdown(),
                reflectionService.recentLearnings());
    }

    private static String fallbackSummary(LocalDate weekStart, PerformanceStats stats) {
        return String.format(
                "Week of %s: %d trades, %s%% win rate, $%s net PnL. Manual review recommended.",
                weekStart, stats.getTotalTrades(), stats.getWinRate(), stats.getNetPnl());
    }
}

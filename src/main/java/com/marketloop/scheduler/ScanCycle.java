package com.marketloop.scheduler;

import com.marketloop.config.LoopProperties;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.ExchangeOrder;
import com.marketloop.domain.model.Position;
import com.marketloop.domain.model.TradeDecision;
import com.marketloop.exception.ExchangeException;
import com.marketloop.execution.ExecutionEngine;
import com.marketloop.execution.TradeLedgerService;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.observability.LoopMetrics;
import com.marketloop.risk.RiskGate;
import com.marketloop.scoring.ScoredSignal;
import com.marketloop.scoring.SignalScorer;
import com.marketloop.settings.SettingKey;
import com.marketloop.strategy.OpportunityScanner;
import com.marketloop.strategy.ScanContext;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One scan-and-trade pass: scan, filter by edge, rank, keep the top N with one per
 * market, then gate and execute each in order. Open positions are re-read after every
 * fill so later candidates see the exposure just taken. Advisory candidates enter
 * through {@link #trade} and pass the same gate.
 *
 * <p>A failing scanner degrades to no candidates. Storage failures propagate and end
 * the cycle.
 */
@Component
public class ScanCycle {

    private static final Logger log = LoggerFactory.getLogger(ScanCycle.class);

    static final Duration ENTRY_LOOKBACK = Duration.ofDays(1);

    private final List<OpportunityScanner> scanners;
    private final ExchangeGateway exchangeGateway;
    private final SignalScorer signalScorer;
    private final RiskGate riskGate;
    private final ExecutionEngine executionEngine;
    private final TradeLedgerService tradeLedgerService;
    private final LoopMetrics loopMetrics;
    private final LoopProperties loopProperties;
    private final Clock clock;

    public ScanCycle(
            List<OpportunityScanner> scanners,
            ExchangeGateway exchangeGateway,
            SignalScorer signalScorer,
            RiskGate riskGate,
            ExecutionEngine executionEngine,
            TradeLedgerService tradeLedgerService,
            LoopMetrics loopMetrics,
            LoopProperties loopProperties,
            Clock clock) {
        this.scanners = scanners;
        this.exchangeGateway = exchangeGateway;
        this.signalScorer = signalScorer;
        this.riskGate = riskGate;
        this.executionEngine = executionEngine;
        this.tradeLedgerService = tradeLedgerService;
        this.loopMetrics = loopMetrics;
        this.loopProperties = loopProperties;
        this.clock = clock;
    }

    /** @return the number of positions opened */
    public int run(ConfigSnapshot config) {
        if (!config.isLoopEnabled()) {
            log.debug("Loop paused (bot_enabled=false), skipping scan");
            return 0;
        }
        long started = System.nanoTime();
        ScanContext context = context(config);

        List<CandidateSignal> candidates = new ArrayList<>();
        for (OpportunityScanner scanner : scanners) {
            if (!config.isStrategyEnabled(scanner.getType())) {
                continue;
            }
            try {
                List<CandidateSignal> found = scanner.scan(exchangeGateway, context);
                log.debug("Scanner {} produced {} candidates", scanner.getType().getId(), found.size());
                candidates.addAll(found);
            } catch (RuntimeException e) {
                log.error("Scanner {} failed, continuing without it: {}", scanner.getType().getId(), e.getMessage(), e);
            }
        }

        int opened = trade(candidates, config);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        loopMetrics.recordScanCycle(elapsed);
        log.info("Scan cycle: {} candidates, {} opened in {} ms", candidates.size(), opened, elapsed.toMillis());
        return opened;
    }

    /** Read-only scanner inputs as of now. */
    public ScanContext context(ConfigSnapshot config) {
        LocalDateTime now = LocalDateTime.now(clock);
        return ScanContext.builder()
                .openPositions(byMarket(tradeLedgerService.getOpenPositions()))
                .restingOrders(restingOrders())
                .lastEntryByMarket(tradeLedgerService.lastEntriesSince(now.minus(ENTRY_LOOKBACK)))
                .config(config)
                .now(now)
                .marketFetchLimit(loopProperties.getMarketFetchLimit())
                .build();
    }

    /**
     * Selects, gates and executes candidates from any producer. Serialized so the scan
     * cycle and the advisory listener never gate against the same stale exposure.
     *
     * @return the number of positions opened
     */
    public synchronized int trade(List<CandidateSignal> candidates, ConfigSnapshot config) {
        List<CandidateSignal> selected = select(candidates, config);
        if (selected.isEmpty()) {
            return 0;
        }
        List<Position> openPositions = tradeLedgerService.getOpenPositions();
        int opened = 0;
        for (CandidateSignal candidate : selected) {
            TradeDecision decision =
                    riskGate.checkTrade(candidate, config.getBankroll(), openPositions, config);
            if (!decision.isApproved()) {
                continue;
            }
            loopMetrics.recordApproval();
            if (executionEngine.execute(decision, candidate)) {
                opened++;
                openPositions = tradeLedgerService.getOpenPositions();
            }
        }
        log.debug("{} of {} selected candidates opened", opened, selected.size());
        return opened;
    }

    /** Edge filter, rank, one per market id, top {@code max_signals_per_cycle}. */
    List<CandidateSignal> select(List<CandidateSignal> candidates, ConfigSnapshot config) {
        List<CandidateSignal> withEdge =
                signalScorer.filterMinimumEdge(candidates, config.getDecimal(SettingKey.MIN_EDGE));
        List<ScoredSignal> ranked = signalScorer.rank(withEdge, config.getInt(SettingKey.SCORE_HORIZON_HOURS));

        int limit = config.getInt(SettingKey.MAX_SIGNALS_PER_CYCLE);
        Set<String> markets = new HashSet<>();
        List<CandidateSignal> selected = new ArrayList<>();
        for (ScoredSignal scored : ranked) {
            if (selected.size() >= limit) {
                break;
            }
            if (markets.add(scored.getSignal().getMarketId())) {
                selected.add(scored.getSignal());
            }
        }
        return selected;
    }

    private List<ExchangeOrder> restingOrders() {
        if (loopProperties.isPaperTrade()) {
            return List.of();
        }
        try {
            return exchangeGateway.openOrders();
        } catch (ExchangeException e) {
            log.warn("Could not fetch resting orders, scanning without them: {}", e.getMessage());
            return List.of();
        }
    }

    private static Map<String, Position> byMarket(List<Position> positions) {
        return positions.stream().collect(Collectors.toMap(Position::getMarketId, Function.identity(), (a, b) -> a));
    }
}

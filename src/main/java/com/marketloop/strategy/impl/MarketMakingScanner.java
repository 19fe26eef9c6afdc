package com.marketloop.strategy.impl;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.OrderBook;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.strategy.OpportunityScanner;
import com.marketloop.strategy.ScanContext;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Quotes one cent inside the best bid on both sides of liquid, wide markets to earn the
 * spread. Emits a YES and a NO candidate per qualifying market; the scan cycle keeps at
 * most one candidate per market.
 */
@Component
public class MarketMakingScanner implements OpportunityScanner {

    private static final Logger log = LoggerFactory.getLogger(MarketMakingScanner.class);

    static final BigDecimal MIN_SPREAD = new BigDecimal("0.02");
    static final BigDecimal MIN_VOLUME = BigDecimal.valueOf(5000);
    static final double MIN_HOURS_TO_RESOLUTION = 4.0;
    static final int CONTRACT_SIZE = 15;
    static final BigDecimal CONFIDENCE = new BigDecimal("0.70");
    static final BigDecimal TICK = new BigDecimal("0.01");

    @Override
    public StrategyType getType() {
        return StrategyType.MARKET_MAKING;
    }

    @Override
    public List<CandidateSignal> scan(ExchangeGateway exchange, ScanContext context) {
        List<MarketSnapshot> markets = exchange.listMarkets("open", null, context.getMarketFetchLimit());
        List<CandidateSignal> signals = new ArrayList<>();
        for (MarketSnapshot market : markets) {
            try {
                signals.addAll(evaluate(exchange, market, context));
            } catch (RuntimeException e) {
                log.warn("Market-making scanner skipped {}: {}", market.getTicker(), e.getMessage());
            }
        }
        log.info("Market-making scanner: {} markets scanned, {} candidates", markets.size(), signals.size());
        return signals;
    }

    List<CandidateSignal> evaluate(ExchangeGateway exchange, MarketSnapshot market, ScanContext context) {
        String ticker = market.getTicker();
        if (ticker == null || context.isHeld(ticker) || context.hasRestingOrders(ticker)) {
            return List.of();
        }
        if (market.volumeOrZero().compareTo(MIN_VOLUME) < 0) {
            return List.of();
        }
        double hours = market.hoursToClose(context.getNow());
        if (Double.isNaN(hours) || hours < MIN_HOURS_TO_RESOLUTION) {
            return List.of();
        }

        OrderBook book = exchange.orderbook(ticker);
        Optional<BigDecimal> yesBid = book.bestBid(Side.YES);
        Optional<BigDecimal> noBid = book.bestBid(Side.NO);
        Optional<BigDecimal> yesAsk = book.bestAsk(Side.YES);
        Optional<BigDecimal> noAsk = book.bestAsk(Side.NO);
        if (yesBid.isEmpty() || noBid.isEmpty() || yesAsk.isEmpty() || noAsk.isEmpty()) {
            return List.of();
        }

        BigDecimal spread = yesAsk.get().add(noAsk.get()).subtract(BigDecimal.ONE);
        if (spread.compareTo(MIN_SPREAD) < 0) {
            return List.of();
        }

        BigDecimal halfSpread = spread.divide(BigDecimal.valueOf(2), 6, RoundingMode.HALF_UP);
        BigDecimal annualized = halfSpread
                .multiply(BigDecimal.valueOf(8760))
                .divide(BigDecimal.valueOf(Math.max(hours, 1)), 6, RoundingMode.HALF_UP);

        return List.of(
                quote(market, Side.YES, yesBid.get().add(TICK), spread, hours, annualized),
                quote(market, Side.NO, noBid.get().add(TICK), spread, hours, annualized));
    }

    private CandidateSignal quote(
            MarketSnapshot market, Side side, BigDecimal price, BigDecimal spread, double hours, BigDecimal annualized) {
        return CandidateSignal.builder()
                .strategy(StrategyType.MARKET_MAKING)
                .marketId(market.getTicker())
                .marketTitle(market.getTitle() != null ? market.getTitle() : market.getTicker())
                .category(market.getCategory())
                .side(side)
                .proposedSize(CONTRACT_SIZE)
                .entryPrice(price)
                .modelProbability(price.add(TICK))
                .hoursToResolution(hours)
                .annualizedReturn(annualized)
                .marketVolume(market.volumeOrZero())
                .confidence(CONFIDENCE)
                .rationale(String.format(
                        "Market making: placing %s at %s, spread is %s", side.wireValue(), price, spread))
                .expiresAt(market.getCloseTime())
                .build();
    }
}

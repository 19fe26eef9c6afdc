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
 * Buys the near-certain side of a market shortly before resolution and collects the
 * remaining premium.
 *
 * <p>A side qualifies when its implied price is at least 0.88, read
 * either directly from its ask or from a cheap ask on the opposite side. The model
 * probability is a flat 0.97 to leave room for black-swan outcomes.
 */
@Component
public class BondScanner implements OpportunityScanner {

    private static final Logger log = LoggerFactory.getLogger(BondScanner.class);

    static final BigDecimal MIN_PRICE = new BigDecimal("0.88");
    static final BigDecimal MODEL_PROBABILITY = new BigDecimal("0.97");
    static final BigDecimal CONFIDENCE = new BigDecimal("0.85");
    static final BigDecimal MIN_VOLUME = BigDecimal.valueOf(5000);
    static final double MAX_HOURS_TO_RESOLUTION = 8760;
    static final int DEFAULT_SIZE = 10;

    @Override
    public StrategyType getType() {
        return StrategyType.BOND;
    }

    @Override
    public List<CandidateSignal> scan(ExchangeGateway exchange, ScanContext context) {
        List<MarketSnapshot> markets = exchange.listMarkets("open", null, context.getMarketFetchLimit());
        List<CandidateSignal> signals = new ArrayList<>();
        for (MarketSnapshot market : markets) {
            try {
                evaluate(exchange, market, context).ifPresent(signals::add);
            } catch (RuntimeException e) {
                log.warn("Bond scanner skipped {}: {}", market.getTicker(), e.getMessage());
            }
        }
        log.info("Bond scanner: {} markets scanned, {} candidates", markets.size(), signals.size());
        return signals;
    }

    Optional<CandidateSignal> evaluate(ExchangeGateway exchange, MarketSnapshot market, ScanContext context) {
        String ticker = market.getTicker();
        if (ticker == null || context.isHeld(ticker)) {
            return Optional.empty();
        }
        if (market.volumeOrZero().compareTo(MIN_VOLUME) < 0) {
            return Optional.empty();
        }
        double hours = market.hoursToClose(context.getNow());
        if (Double.isNaN(hours) || hours <= 0 || hours > MAX_HOURS_TO_RESOLUTION) {
            return Optional.empty();
        }

        OrderBook book = exchange.orderbook(ticker);
        Optional<BigDecimal> yesAsk = book.bestAsk(Side.YES);
        Optional<BigDecimal> noAsk = book.bestAsk(Side.NO);
        BigDecimal cheapCeiling = BigDecimal.ONE.subtract(MIN_PRICE);

        Side side;
        BigDecimal entryPrice;
        if (noAsk.isPresent() && noAsk.get().compareTo(cheapCeiling) <= 0) {
            side = Side.YES;
            entryPrice = BigDecimal.ONE.subtract(noAsk.get());
        } else if (yesAsk.isPresent() && yesAsk.get().compareTo(MIN_PRICE) >= 0) {
            side = Side.YES;
            entryPrice = yesAsk.get();
        } else if (yesAsk.isPresent() && yesAsk.get().compareTo(cheapCeiling) <= 0) {
            side = Side.NO;
            entryPrice = BigDecimal.ONE.subtract(yesAsk.get());
        } else if (noAsk.isPresent() && noAsk.get().compareTo(MIN_PRICE) >= 0) {
            side = Side.NO;
            entryPrice = noAsk.get();
        } else {
            return Optional.empty();
        }

        if (entryPrice.signum() <= 0 || entryPrice.compareTo(BigDecimal.ONE) >= 0) {
            return Optional.empty();
        }
        if (MODEL_PROBABILITY.subtract(entryPrice).signum() < 0) {
            return Optional.empty();
        }

        BigDecimal expectedReturn = BigDecimal.ONE.subtract(entryPrice).divide(entryPrice, 6, RoundingMode.HALF_UP);
        BigDecimal annualized = expectedReturn
                .multiply(BigDecimal.valueOf(8760))
                .divide(BigDecimal.valueOf(Math.max(hours, 1)), 6, RoundingMode.HALF_UP);

        return Optional.of(CandidateSignal.builder()
                .strategy(StrategyType.BOND)
                .marketId(ticker)
                .marketTitle(market.getTitle() != null ? market.getTitle() : ticker)
                .category(market.getCategory())
                .side(side)
                .proposedSize(DEFAULT_SIZE)
                .entryPrice(entryPrice)
                .modelProbability(MODEL_PROBABILITY)
                .hoursToResolution(hours)
                .annualizedReturn(annualized)
                .marketVolume(market.volumeOrZero())
                .confidence(CONFIDENCE)
                .rationale(String.format(
                        "Bond play: %s at %s with %.1fh to resolution", side.wireValue(), entryPrice, hours))
                .expiresAt(market.getCloseTime())
                .build());
    }
}

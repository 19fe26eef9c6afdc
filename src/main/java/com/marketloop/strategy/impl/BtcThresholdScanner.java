package com.marketloop.strategy.impl;

import com.marketloop.config.ExchangeProperties;
import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.strategy.OpportunityScanner;
import com.marketloop.strategy.ScanContext;
import com.marketloop.strategy.btc.BtcProbabilityModel;
import com.marketloop.strategy.btc.StrikeParser;
import com.marketloop.strategy.spot.SpotPriceFeed;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Trades short-dated "BTC above strike" markets where the lognormal model disagrees
 * with the market price.
 *
 * <p>NO is preferred when its edge clears 0.025 and beats YES, or when YES misses its own
 * 0.05 bar. Entries are restricted to YES at 0.70 or more and NO at 0.25 or more. A
 * market is skipped for 10 minutes after any entry.
 */
@Component
public class BtcThresholdScanner implements OpportunityScanner {

    private static final Logger log = LoggerFactory.getLogger(BtcThresholdScanner.class);

    static final double NO_MIN_EDGE = 0.025;
    static final double YES_MIN_EDGE = 0.05;
    static final double YES_MIN_ENTRY = 0.70;
    static final double NO_MIN_ENTRY = 0.25;
    static final double MIN_HOURS = 0.1;
    static final double MAX_HOURS = 8.0;
    static final BigDecimal MIN_VOLUME = BigDecimal.ONE;
    static final BigDecimal CONFIDENCE = new BigDecimal("0.60");
    static final Duration COOLDOWN = Duration.ofMinutes(10);
    static final int DEFAULT_SIZE = 10;

    private final SpotPriceFeed spotPriceFeed;
    private final ExchangeProperties exchangeProperties;
    private final BtcProbabilityModel probabilityModel = new BtcProbabilityModel();

    public BtcThresholdScanner(SpotPriceFeed spotPriceFeed, ExchangeProperties exchangeProperties) {
        this.spotPriceFeed = spotPriceFeed;
        this.exchangeProperties = exchangeProperties;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.BTC_THRESHOLD;
    }

    @Override
    public List<CandidateSignal> scan(ExchangeGateway exchange, ScanContext context) {
        Optional<BigDecimal> spot = spotPriceFeed.currentBtcPrice();
        if (spot.isEmpty()) {
            log.warn("BTC scanner skipped: no spot price available");
            return List.of();
        }

        List<MarketSnapshot> markets =
                exchange.listMarkets("open", exchangeProperties.getBtcSeriesTicker(), context.getMarketFetchLimit());
        List<CandidateSignal> signals = new ArrayList<>();
        for (MarketSnapshot market : markets) {
            String ticker = market.getTicker();
            if (ticker == null || context.isHeld(ticker) || context.enteredWithin(ticker, COOLDOWN)) {
                continue;
            }
            try {
                evaluate(market, spot.get().doubleValue(), context).ifPresent(signals::add);
            } catch (RuntimeException e) {
                log.warn("BTC scanner skipped {}: {}", ticker, e.getMessage());
            }
        }
        log.info("BTC scanner: {} markets scanned, {} candidates (spot={})", markets.size(), signals.size(), spot.get());
        return signals;
    }

    Optional<CandidateSignal> evaluate(MarketSnapshot market, double spot, ScanContext context) {
        double hours = market.hoursToClose(context.getNow());
        if (Double.isNaN(hours) || hours < MIN_HOURS || hours > MAX_HOURS) {
            return Optional.empty();
        }
        if (market.volumeOrZero().compareTo(MIN_VOLUME) < 0) {
            return Optional.empty();
        }

        Optional<Double> strike = StrikeParser.parse(market.getTitle());
        if (strike.isEmpty()) {
            strike = StrikeParser.parse(market.getTicker());
        }
        if (strike.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal yesQuote = market.getYesAsk() != null ? market.getYesAsk() : market.getLastPrice();
        if (yesQuote == null) {
            return Optional.empty();
        }
        double marketYes = yesQuote.doubleValue();
        double marketNo = 1.0 - marketYes;

        double probYes = probabilityModel.probabilityAbove(spot, strike.get(), hours);
        double probNo = 1.0 - probYes;
        double yesEdge = probYes - marketYes;
        double noEdge = probNo - marketNo;

        Side side;
        double entry;
        double probability;
        if (noEdge >= NO_MIN_EDGE && (noEdge >= yesEdge || yesEdge < YES_MIN_EDGE)) {
            side = Side.NO;
            entry = marketNo;
            probability = probNo;
        } else if (yesEdge >= YES_MIN_EDGE) {
            side = Side.YES;
            entry = marketYes;
            probability = probYes;
        } else {
            return Optional.empty();
        }

        if (entry <= 0.0 || entry >= 1.0) {
            return Optional.empty();
        }
        double minEntry = side == Side.YES ? YES_MIN_ENTRY : NO_MIN_ENTRY;
        if (entry < minEntry) {
            return Optional.empty();
        }

        BigDecimal entryPrice = BigDecimal.valueOf(entry).setScale(4, RoundingMode.HALF_UP);
        double expectedReturn = (1.0 - entry) / entry;
        double annualized = expectedReturn * (8760.0 / Math.max(hours, 0.25));

        return Optional.of(CandidateSignal.builder()
                .strategy(StrategyType.BTC_THRESHOLD)
                .marketId(market.getTicker())
                .marketTitle(market.getTitle() != null ? market.getTitle() : market.getTicker())
                .category(market.getCategory())
                .side(side)
                .proposedSize(DEFAULT_SIZE)
                .entryPrice(entryPrice)
                .modelProbability(BigDecimal.valueOf(probability).setScale(4, RoundingMode.HALF_UP))
                .hoursToResolution(hours)
                .annualizedReturn(BigDecimal.valueOf(annualized).setScale(6, RoundingMode.HALF_UP))
                .marketVolume(market.volumeOrZero())
                .confidence(CONFIDENCE)
                .rationale(String.format(
                        "BTC=%.0f vs strike=%.0f (%.2fh to close): model_prob=%.2f market_yes=%.2f edge=%.3f side=%s",
                        spot,
                        strike.get(),
                        hours,
                        probability,
                        marketYes,
                        probability - entry,
                        side.wireValue()))
                .expiresAt(market.getCloseTime())
                .build());
    }
}

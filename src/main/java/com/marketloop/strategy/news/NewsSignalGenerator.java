package com.marketloop.strategy.news;

import com.marketloop.advisory.HeadlineClassification;
import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.strategy.ScanContext;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a classified headline into candidates on the open markets it names, before
 * their prices adjust.
 *
 * <p>A market qualifies when its category is one the headline affects, its title
 * shares at least two significant words with the headline, it closes at least two
 * hours out, and the ask on the favoured side is still within five cents of the last
 * traded price. The model probability assumes an eight-cent mispricing.
 */
@Component
public class NewsSignalGenerator {

    private static final Logger log = LoggerFactory.getLogger(NewsSignalGenerator.class);

    public static final BigDecimal MIN_CONFIDENCE = new BigDecimal("0.6");
    static final BigDecimal ASSUMED_MISPRICING = new BigDecimal("0.08");
    static final BigDecimal MAX_MODEL_PROBABILITY = new BigDecimal("0.99");
    static final BigDecimal CONFIDENCE_DISCOUNT = new BigDecimal("0.80");
    static final BigDecimal MAX_PRICE_MOVE = new BigDecimal("0.05");
    static final BigDecimal DEFAULT_MID = new BigDecimal("0.50");
    static final double MIN_HOURS_TO_RESOLUTION = 2.0;
    static final int MIN_SHARED_WORDS = 2;
    static final int DEFAULT_SIZE = 10;

    private static final Pattern WORD = Pattern.compile("[a-zA-Z]+");

    public List<CandidateSignal> generate(
            HeadlineClassification classification,
            List<MarketSnapshot> markets,
            ExchangeGateway exchange,
            ScanContext context) {
        if (!classification.isActionable(MIN_CONFIDENCE)) {
            return List.of();
        }
        List<CandidateSignal> signals = new ArrayList<>();
        for (MarketSnapshot market : markets) {
            try {
                evaluate(classification, market, exchange, context).ifPresent(signals::add);
            } catch (RuntimeException e) {
                log.warn("News generator skipped {}: {}", market.getTicker(), e.getMessage());
            }
        }
        log.info("News generator: '{}' -> {} candidates", abbreviate(classification.getHeadline().getTitle(), 60),
                signals.size());
        return signals;
    }

    Optional<CandidateSignal> evaluate(
            HeadlineClassification classification, MarketSnapshot market, ExchangeGateway exchange, ScanContext context) {
        String ticker = market.getTicker();
        if (ticker == null || context.isHeld(ticker)) {
            return Optional.empty();
        }
        String category = market.getCategory() != null ? market.getCategory().toLowerCase(Locale.ROOT) : "";
        if (!classification.getAffectedCategories().contains(category)) {
            return Optional.empty();
        }
        String headline = classification.getHeadline().getTitle();
        String title = market.getTitle() != null ? market.getTitle() : ticker;
        if (!keywordMatch(headline, title)) {
            return Optional.empty();
        }
        double hours = market.hoursToClose(context.getNow());
        if (Double.isNaN(hours) || hours < MIN_HOURS_TO_RESOLUTION) {
            return Optional.empty();
        }

        Side side = classification.getDirection();
        Optional<BigDecimal> ask = exchange.orderbook(ticker).bestAsk(side);
        if (ask.isEmpty() || ask.get().signum() <= 0 || ask.get().compareTo(BigDecimal.ONE) >= 0) {
            return Optional.empty();
        }
        BigDecimal entryPrice = ask.get();

        BigDecimal mid = market.getLastPrice() != null && market.getLastPrice().signum() > 0
                ? market.getLastPrice()
                : DEFAULT_MID;
        BigDecimal move = side.fromYesPrice(entryPrice).subtract(mid).abs();
        if (move.compareTo(MAX_PRICE_MOVE) > 0) {
            log.debug("News generator: {} already moved {}", ticker, move);
            return Optional.empty();
        }

        BigDecimal modelProbability = entryPrice.add(ASSUMED_MISPRICING).min(MAX_MODEL_PROBABILITY);
        BigDecimal confidence = classification.getConfidence()
                .multiply(CONFIDENCE_DISCOUNT)
                .setScale(4, RoundingMode.HALF_UP);
        BigDecimal expectedReturn = BigDecimal.ONE.subtract(entryPrice).divide(entryPrice, 6, RoundingMode.HALF_UP);
        BigDecimal annualized = expectedReturn
                .multiply(BigDecimal.valueOf(8760))
                .divide(BigDecimal.valueOf(Math.max(hours, 1)), 6, RoundingMode.HALF_UP);

        return Optional.of(CandidateSignal.builder()
                .strategy(StrategyType.NEWS_ARBITRAGE)
                .marketId(ticker)
                .marketTitle(title)
                .category(market.getCategory())
                .side(side)
                .proposedSize(DEFAULT_SIZE)
                .entryPrice(entryPrice)
                .modelProbability(modelProbability)
                .hoursToResolution(hours)
                .annualizedReturn(annualized)
                .marketVolume(market.volumeOrZero())
                .confidence(confidence)
                .rationale(String.format("News: '%s', expect %s to move up. %s",
                        abbreviate(headline, 80), side.wireValue(), classification.getReasoning()).trim())
                .expiresAt(market.getCloseTime())
                .build());
    }

    /** True when the two texts share at least two words longer than four letters. */
    static boolean keywordMatch(String headline, String marketTitle) {
        Set<String> shared = significantWords(headline);
        shared.retainAll(significantWords(marketTitle));
        return shared.size() >= MIN_SHARED_WORDS;
    }

    private static Set<String> significantWords(String text) {
        Set<String> words = new HashSet<>();
        if (text == null) {
            return words;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            if (matcher.group().length() > 4) {
                words.add(matcher.group());
            }
        }
        return words;
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}

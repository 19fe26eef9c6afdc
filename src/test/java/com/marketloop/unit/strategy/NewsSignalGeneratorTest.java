package com.marketloop.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketloop.advisory.Headline;
import com.marketloop.advisory.HeadlineClassification;
import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.strategy.news.NewsSignalGenerator;
import com.marketloop.support.Fixtures;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for NewsSignalGenerator: market matching, the already-moved filter and
 * the candidate's pricing.
 */
@ExtendWith(MockitoExtension.class)
class NewsSignalGeneratorTest {

    @Mock
    private ExchangeGateway exchangeGateway;

    private NewsSignalGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new NewsSignalGenerator();
    }

    private static HeadlineClassification verdict(Side direction, String confidence) {
        return HeadlineClassification.builder()
                .headline(Headline.builder().id("h1").title("Senate passes budget resolution overnight").build())
                .relevant(true)
                .affectedCategories(List.of("politics"))
                .direction(direction)
                .confidence(new BigDecimal(confidence))
                .reasoning("Passage makes the deal likely.")
                .build();
    }

    private static MarketSnapshot.MarketSnapshotBuilder budgetMarket() {
        return Fixtures.market("KXBUDGET")
                .title("Will the Senate pass the budget resolution?")
                .lastPrice(new BigDecimal("0.50"))
                .closeTime(ScannerTestSupport.NOW.plusHours(24));
    }

    @Test
    @DisplayName("YES headline buys the YES ask with an eight-cent assumed edge")
    void yesCandidate() {
        // NO bid 48 -> YES ask 0.52, within five cents of last 0.50
        when(exchangeGateway.orderbook("KXBUDGET")).thenReturn(ScannerTestSupport.book("KXBUDGET", 47, 48));

        List<CandidateSignal> signals = generator.generate(
                verdict(Side.YES, "0.75"), List.of(budgetMarket().build()), exchangeGateway,
                ScannerTestSupport.emptyContext());

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.getStrategy()).isEqualTo(StrategyType.NEWS_ARBITRAGE);
            assertThat(signal.getSide()).isEqualTo(Side.YES);
            assertThat(signal.getEntryPrice()).isEqualByComparingTo("0.52");
            assertThat(signal.getModelProbability()).isEqualByComparingTo("0.60");
            assertThat(signal.getConfidence()).isEqualByComparingTo("0.60");
            assertThat(signal.getProposedSize()).isEqualTo(10);
            assertThat(signal.getRationale()).contains("Senate passes budget").contains("Passage makes");
        });
    }

    @Test
    @DisplayName("NO headline measures the move on the YES scale")
    void noCandidate() {
        // YES bid 52 -> NO ask 0.48, i.e. YES at 0.52 against last 0.50
        when(exchangeGateway.orderbook("KXBUDGET")).thenReturn(ScannerTestSupport.book("KXBUDGET", 52, 47));

        List<CandidateSignal> signals = generator.generate(
                verdict(Side.NO, "0.9"), List.of(budgetMarket().build()), exchangeGateway,
                ScannerTestSupport.emptyContext());

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.getSide()).isEqualTo(Side.NO);
            assertThat(signal.getEntryPrice()).isEqualByComparingTo("0.48");
            assertThat(signal.getModelProbability()).isEqualByComparingTo("0.56");
        });
    }

    @Test
    @DisplayName("Price that already moved more than five cents is skipped")
    void alreadyMoved() {
        // NO bid 40 -> YES ask 0.60
        when(exchangeGateway.orderbook("KXBUDGET")).thenReturn(ScannerTestSupport.book("KXBUDGET", 58, 40));

        assertThat(generator.generate(verdict(Side.YES, "0.9"), List.of(budgetMarket().build()), exchangeGateway,
                ScannerTestSupport.emptyContext())).isEmpty();
    }

    @Test
    @DisplayName("Model probability is capped at 0.99")
    void probabilityCapped() {
        // NO bid 4 -> YES ask 0.96, last 0.95
        when(exchangeGateway.orderbook("KXBUDGET")).thenReturn(ScannerTestSupport.book("KXBUDGET", 94, 4));

        List<CandidateSignal> signals = generator.generate(
                verdict(Side.YES, "0.9"), List.of(budgetMarket().lastPrice(new BigDecimal("0.95")).build()),
                exchangeGateway, ScannerTestSupport.emptyContext());

        assertThat(signals).singleElement()
                .satisfies(signal -> assertThat(signal.getModelProbability()).isEqualByComparingTo("0.99"));
    }

    @Test
    @DisplayName("Unrelated category, weak title overlap, near close or held markets are not touched")
    void marketFilters() {
        List<MarketSnapshot> markets = List.of(
                budgetMarket().ticker("KXCAT").category("Sports").build(),
                budgetMarket().ticker("KXWORDS").title("Will the House adjourn early?").build(),
                budgetMarket().ticker("KXSOON").closeTime(ScannerTestSupport.NOW.plusMinutes(90)).build(),
                budgetMarket().ticker("KXHELD").build());

        List<CandidateSignal> signals = generator.generate(verdict(Side.YES, "0.9"), markets, exchangeGateway,
                ScannerTestSupport.context(Map.of("KXHELD", Fixtures.position("KXHELD").build()), List.of(), Map.of()));

        assertThat(signals).isEmpty();
        verify(exchangeGateway, never()).orderbook(anyString());
    }

    @Test
    @DisplayName("Confidence below 0.6 or a neutral direction generates nothing")
    void notActionable() {
        List<MarketSnapshot> markets = List.of(budgetMarket().build());

        assertThat(generator.generate(verdict(Side.YES, "0.55"), markets, exchangeGateway,
                ScannerTestSupport.emptyContext())).isEmpty();
        assertThat(generator.generate(verdict(null, "0.9"), markets, exchangeGateway,
                ScannerTestSupport.emptyContext())).isEmpty();
        verify(exchangeGateway, never()).orderbook(anyString());
    }
}

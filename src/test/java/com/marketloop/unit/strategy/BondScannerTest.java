package com.marketloop.unit.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.exchange.ExchangeGateway;
import com.marketloop.exception.ExchangeException;
import com.marketloop.strategy.ScanContext;
import com.marketloop.strategy.impl.BondScanner;
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
 * Unit tests for BondScanner: side selection from the implied book, filters, and
 * exclusion of held markets.
 */
@ExtendWith(MockitoExtension.class)
class BondScannerTest {

    @Mock
    private ExchangeGateway exchangeGateway;

    private BondScanner bondScanner;

    @BeforeEach
    void setUp() {
        bondScanner = new BondScanner();
    }

    private MarketSnapshot market(String ticker) {
        return Fixtures.market(ticker).closeTime(ScannerTestSupport.NOW.plusHours(12)).build();
    }

    @Test
    @DisplayName("Cheap NO ask implies a YES bond at 1 - noAsk")
    void cheapNoAskYieldsYesBond() {
        when(exchangeGateway.listMarkets("open", null, 200)).thenReturn(List.of(market("KXBOND")));
        // NO bid 4 -> YES ask 0.96; YES bid 94 -> NO ask 0.06
        when(exchangeGateway.orderbook("KXBOND")).thenReturn(ScannerTestSupport.book("KXBOND", 94, 4));

        List<CandidateSignal> signals = bondScanner.scan(exchangeGateway, ScannerTestSupport.emptyContext());

        assertThat(signals).hasSize(1);
        CandidateSignal signal = signals.get(0);
        assertThat(signal.getStrategy()).isEqualTo(StrategyType.BOND);
        assertThat(signal.getSide()).isEqualTo(Side.YES);
        assertThat(signal.getEntryPrice()).isEqualByComparingTo("0.94");
        assertThat(signal.getModelProbability()).isEqualByComparingTo("0.97");
        assertThat(signal.getHoursToResolution()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Cheap YES ask implies a NO bond")
    void cheapYesAskYieldsNoBond() {
        when(exchangeGateway.listMarkets("open", null, 200)).thenReturn(List.of(market("KXNO")));
        // NO bid 92 -> YES ask 0.08; YES bid 5 -> NO ask 0.95
        when(exchangeGateway.orderbook("KXNO")).thenReturn(ScannerTestSupport.book("KXNO", 5, 92));

        List<CandidateSignal> signals = bondScanner.scan(exchangeGateway, ScannerTestSupport.emptyContext());

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.getSide()).isEqualTo(Side.NO);
            assertThat(signal.getEntryPrice()).isEqualByComparingTo("0.92");
        });
    }

    @Test
    @DisplayName("Held markets yield no candidate and the book is never read")
    void heldMarketSkipped() {
        when(exchangeGateway.listMarkets("open", null, 200)).thenReturn(List.of(market("KXBOND")));
        ScanContext context = ScannerTestSupport.context(
                Map.of("KXBOND", Fixtures.position("KXBOND").build()), List.of(), Map.of());

        assertThat(bondScanner.scan(exchangeGateway, context)).isEmpty();
        assertThat(bondScanner.scan(exchangeGateway, context)).isEmpty();
        verify(exchangeGateway, never()).orderbook(anyString());
    }

    @Test
    @DisplayName("Low-volume and mid-priced markets are skipped")
    void filters() {
        MarketSnapshot thin = Fixtures.market("KXTHIN")
                .volume(new BigDecimal("10"))
                .closeTime(ScannerTestSupport.NOW.plusHours(12))
                .build();
        when(exchangeGateway.listMarkets("open", null, 200)).thenReturn(List.of(thin, market("KXMID")));
        when(exchangeGateway.orderbook("KXMID")).thenReturn(ScannerTestSupport.book("KXMID", 50, 48));

        assertThat(bondScanner.scan(exchangeGateway, ScannerTestSupport.emptyContext())).isEmpty();
        verify(exchangeGateway, never()).orderbook("KXTHIN");
    }

    @Test
    @DisplayName("A failing order book read skips only that market")
    void orderBookFailureSkipsMarket() {
        when(exchangeGateway.listMarkets("open", null, 200)).thenReturn(List.of(market("KXBAD"), market("KXGOOD")));
        when(exchangeGateway.orderbook("KXBAD")).thenThrow(new ExchangeException("boom"));
        when(exchangeGateway.orderbook("KXGOOD")).thenReturn(ScannerTestSupport.book("KXGOOD", 94, 4));

        List<CandidateSignal> signals = bondScanner.scan(exchangeGateway, ScannerTestSupport.emptyContext());

        assertThat(signals).extracting(CandidateSignal::getMarketId).containsExactly("KXGOOD");
    }
}

package com.marketloop.support;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.MarketSnapshot;
import com.marketloop.domain.model.Position;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/** Builders for the domain objects most tests need. */
public final class Fixtures {

    private Fixtures() {}

    public static CandidateSignal.CandidateSignalBuilder bondCandidate(String marketId) {
        return CandidateSignal.builder()
                .strategy(StrategyType.BOND)
                .marketId(marketId)
                .marketTitle("Will " + marketId + " happen?")
                .category("Politics")
                .side(Side.YES)
                .proposedSize(0)
                .entryPrice(new BigDecimal("0.95"))
                .modelProbability(new BigDecimal("0.98"))
                .hoursToResolution(12)
                .annualizedReturn(new BigDecimal("0.50"))
                .marketVolume(new BigDecimal("20000"))
                .confidence(new BigDecimal("0.90"))
                .rationale("High-probability bond")
                .expiresAt(LocalDateTime.of(2026, 3, 11, 0, 0));
    }

    public static Position.PositionBuilder position(String marketId) {
        return Position.builder()
                .marketId(marketId)
                .marketTitle("Will " + marketId + " happen?")
                .category("Politics")
                .strategy(StrategyType.BOND)
                .side(Side.YES)
                .size(10)
                .entryPrice(new BigDecimal("0.95"))
                .currentPrice(new BigDecimal("0.95"))
                .unrealizedPnl(BigDecimal.ZERO)
                .tradeId("trade-" + marketId)
                .openedAt(LocalDateTime.of(2026, 3, 10, 9, 0))
                .expiresAt(LocalDateTime.of(2026, 3, 11, 0, 0));
    }

    public static MarketSnapshot.MarketSnapshotBuilder market(String ticker) {
        return MarketSnapshot.builder()
                .ticker(ticker)
                .title("Will " + ticker + " happen?")
                .category("Politics")
                .status("open")
                .result("")
                .yesBid(new BigDecimal("0.94"))
                .yesAsk(new BigDecimal("0.95"))
                .noBid(new BigDecimal("0.04"))
                .noAsk(new BigDecimal("0.06"))
                .lastPrice(new BigDecimal("0.95"))
                .volume(new BigDecimal("20000"))
                .closeTime(LocalDateTime.of(2026, 3, 11, 0, 0));
    }
}

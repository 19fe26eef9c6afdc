package com.marketloop.reporting;

import com.marketloop.domain.model.TradeRecord;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Win rate, net PnL and per-strategy breakdown over closed trades. */
@Component
public class PerformanceCalculator {

    public PerformanceStats calculate(List<TradeRecord> trades) {
        if (trades.isEmpty()) {
            return PerformanceStats.empty();
        }

        int wins = 0;
        int losses = 0;
        BigDecimal net = BigDecimal.ZERO;
        Map<String, BigDecimal> byStrategy = new HashMap<>();
        for (TradeRecord trade : trades) {
            BigDecimal pnl = trade.getNetPnl() != null ? trade.getNetPnl() : BigDecimal.ZERO;
            if (pnl.signum() > 0) {
                wins++;
            } else if (pnl.signum() < 0) {
                losses++;
            }
            net = net.add(pnl);
            byStrategy.merge(trade.getStrategy().getId(), pnl, BigDecimal::add);
        }

        Map<String, BigDecimal> breakdown = new LinkedHashMap<>();
        byStrategy.entrySet().stream()
                .sorted(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder()))
                .forEach(e -> breakdown.put(e.getKey(), e.getValue()));
        List<String> ordered = List.copyOf(breakdown.keySet());

        BigDecimal winRate = BigDecimal.valueOf(wins)
                .divide(BigDecimal.valueOf(trades.size()), 4, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100))
                .setScale(2, RoundingMode.HALF_UP);

        return PerformanceStats.builder()
                .totalTrades(trades.size())
                .wins(wins)
                .losses(losses)
                .winRate(winRate)
                .netPnl(net)
                .bestStrategy(ordered.get(0))
                .worstStrategy(ordered.get(ordered.size() - 1))
                .strategyBreakdown(breakdown)
                .build();
    }
}

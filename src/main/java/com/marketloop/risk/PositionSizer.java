package com.marketloop.risk;

import com.marketloop.domain.enums.SizingMode;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.settings.SettingKey;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Pure contract-count arithmetic. The active {@link SizingMode} comes from the snapshot;
 * exactly one mode applies per call.
 *
 * <ul>
 *   <li>KELLY: {@code floor(k * ((p - q) / (1 - q)) * B / q)}, q being the entry price
 *   <li>FIXED_DOLLAR: {@code floor(fixed_trade_amount / q)}
 * </ul>
 *
 * Both are floored at zero. The position ceiling is applied by {@link RiskGate}, not here.
 */
@Component
public class PositionSizer {

    private static final int SCALE = 10;

    public SizingResult size(CandidateSignal candidate, BigDecimal bankroll, ConfigSnapshot config) {
        BigDecimal price = candidate.getEntryPrice();
        if (price == null || price.signum() <= 0 || price.compareTo(BigDecimal.ONE) >= 0) {
            return SizingResult.none();
        }
        SizingMode mode = config.getSizingMode();
        if (mode == SizingMode.FIXED_DOLLAR) {
            return fixedDollar(price, bankroll, config.getDecimal(SettingKey.FIXED_TRADE_AMOUNT));
        }
        return kelly(candidate.getModelProbability(), price, bankroll, config.getDecimal(SettingKey.KELLY_FRACTION));
    }

    SizingResult kelly(BigDecimal probability, BigDecimal price, BigDecimal bankroll, BigDecimal kellyFraction) {
        BigDecimal fullKelly = probability
                .subtract(price)
                .divide(BigDecimal.ONE.subtract(price), SCALE, RoundingMode.HALF_UP);
        BigDecimal fraction = kellyFraction.multiply(fullKelly);
        if (fraction.signum() <= 0 || bankroll.signum() <= 0) {
            return SizingResult.none();
        }
        BigDecimal contracts = fraction.multiply(bankroll).divide(price, SCALE, RoundingMode.HALF_UP);
        return new SizingResult(floorToInt(contracts), fraction.setScale(6, RoundingMode.HALF_UP));
    }

    SizingResult fixedDollar(BigDecimal price, BigDecimal bankroll, BigDecimal amount) {
        if (amount.signum() <= 0) {
            return SizingResult.none();
        }
        int contracts = floorToInt(amount.divide(price, SCALE, RoundingMode.HALF_UP));
        BigDecimal fraction = bankroll.signum() > 0
                ? amount.divide(bankroll, 6, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        return new SizingResult(contracts, fraction);
    }

    static int floorToInt(BigDecimal value) {
        BigDecimal floored = value.setScale(0, RoundingMode.FLOOR);
        if (floored.signum() <= 0) {
            return 0;
        }
        return floored.min(BigDecimal.valueOf(Integer.MAX_VALUE)).intValueExact();
    }
}

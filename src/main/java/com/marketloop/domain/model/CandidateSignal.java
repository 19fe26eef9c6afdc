package com.marketloop.domain.model;

import com.marketloop.domain.enums.Side;
import com.marketloop.domain.enums.StrategyType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A trade proposed by a scanner for the current cycle. Never persisted.
 *
 * <p>Prices and probabilities are fractions in [0,1] for the signal's side.
 */
@Value
@Builder(toBuilder = true)
public class CandidateSignal {

    StrategyType strategy;
    String marketId;
    String marketTitle;
    String category;
    Side side;
    int proposedSize;
    BigDecimal entryPrice;
    BigDecimal modelProbability;
    double hoursToResolution;
    BigDecimal annualizedReturn;
    BigDecimal marketVolume;
    BigDecimal confidence;
    String rationale;
    LocalDateTime expiresAt;

    /** Model probability minus market price for this side. */
    public BigDecimal getEdge() {
        return modelProbability.subtract(entryPrice);
    }

    public String dedupeKey() {
        return marketId + ":" + side.wireValue();
    }
}

package com.marketloop.strategy;

import com.marketloop.domain.enums.StrategyType;
import com.marketloop.domain.model.CandidateSignal;
import com.marketloop.exchange.ExchangeGateway;
import java.util.List;

/**
 * Contract for a candidate-trade producer.
 *
 * <p>Scanners only read: they never place orders and never write storage. Markets
 * already held in {@link ScanContext#getOpenPositions()} are always excluded, which
 * makes scanning idempotent across cycles. A scanner may throw; the scan cycle logs the
 * failure and continues with the other scanners.
 */
public interface OpportunityScanner {

    StrategyType getType();

    List<CandidateSignal> scan(ExchangeGateway exchange, ScanContext context);
}

package com.marketloop.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Exchange-side holding. Positive contracts are YES, negative are NO. */
@Value
@Builder
public class ExchangePosition {

    String marketId;
    int contracts;
    BigDecimal marketExposure;
    BigDecimal realizedPnl;
}

package com.marketloop.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Value;

@Value
public class AccountBalance {

    /** Available cash in dollars. */
    BigDecimal available;

    LocalDateTime fetchedAt;
}

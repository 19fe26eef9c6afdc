package com.marketloop.scoring;

import com.marketloop.domain.model.CandidateSignal;
import java.math.BigDecimal;
import lombok.Value;

@Value
public class ScoredSignal {

    CandidateSignal signal;
    BigDecimal score;
}

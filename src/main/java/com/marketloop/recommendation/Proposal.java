package com.marketloop.recommendation;

import lombok.Value;

/** A candidate parameter change before guardrail filtering and de-duplication. */
@Value
public class Proposal {

    String settingKey;
    String proposedValue;
    String reasoning;
}

package com.marketloop.advisory;

import com.marketloop.domain.enums.Side;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Validated classifier verdict for one headline. */
@Value
@Builder
public class HeadlineClassification {

    Headline headline;
    boolean relevant;

    /** Lower-cased exchange categories the headline bears on. */
    List<String> affectedCategories;

    /** Side expected to gain, or null for a neutral headline. */
    Side direction;

    BigDecimal confidence;
    String reasoning;

    public boolean isActionable(BigDecimal minConfidence) {
        return relevant
                && direction != null
                && !affectedCategories.isEmpty()
                && confidence.compareTo(minConfidence) >= 0;
    }
}

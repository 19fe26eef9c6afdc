package com.marketloop.advisory;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** One item from the headline feed. */
@Value
@Builder(toBuilder = true)
public class Headline {

    /** Link, else guid, else title. Used for de-duplication. */
    String id;

    String title;
    String summary;
    String source;
    LocalDateTime publishedAt;
}

package com.marketloop.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reflection {

    private Long id;
    private String tradeId;
    private String summary;
    private String whatWorked;
    private String whatFailed;

    /** 1 to 10. */
    private int confidenceScore;

    private String strategySuggestion;
    private boolean fallback;
    private LocalDateTime createdAt;
}

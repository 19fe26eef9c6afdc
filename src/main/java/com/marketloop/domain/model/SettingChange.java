package com.marketloop.domain.model;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Audit trail entry for one write to the control plane. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingChange {

    private Long id;
    private String settingKey;
    private String oldValue;
    private String newValue;
    private String changedBy;
    private String reason;
    private LocalDateTime changedAt;
}

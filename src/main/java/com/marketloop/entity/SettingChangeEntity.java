package com.marketloop.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the settings audit trail.
 * Append-only: one row per write, whether from the control API, an approved
 * recommendation or a bankroll update.
 */
@Entity
@Table(name = "setting_changes")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SettingChangeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "setting_key", length = 64, nullable = false)
    private String settingKey;

    @Column(name = "old_value", length = 256)
    private String oldValue;

    @Column(name = "new_value", length = 256)
    private String newValue;

    @Column(name = "changed_by", length = 64)
    private String changedBy;

    @Column(length = 500)
    private String reason;

    @Column(name = "changed_at")
    private LocalDateTime changedAt;
}

package com.marketloop.settings;

import com.marketloop.domain.model.ConfigSnapshot;
import com.marketloop.domain.model.SettingChange;
import com.marketloop.entity.SettingChangeEntity;
import com.marketloop.entity.SettingEntity;
import com.marketloop.exception.BusinessException;
import com.marketloop.exception.ErrorCode;
import com.marketloop.mapper.SettingChangeMapper;
import com.marketloop.repository.jpa.SettingChangeJpaRepository;
import com.marketloop.repository.jpa.SettingJpaRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and writes the control plane.
 *
 * <p>Every write goes through here so that it is validated by {@link ParamGuardrails}
 * and leaves a {@code setting_changes} audit row. Tasks call {@link #snapshot()} once
 * at the start of each invocation.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    public static final String CHANGED_BY_API = "api";
    public static final String CHANGED_BY_SYSTEM = "system";

    private final SettingJpaRepository settingJpaRepository;
    private final SettingChangeJpaRepository settingChangeJpaRepository;
    private final SettingChangeMapper settingChangeMapper;
    private final ParamGuardrails paramGuardrails;
    private final Clock clock;

    public SettingsService(
            SettingJpaRepository settingJpaRepository,
            SettingChangeJpaRepository settingChangeJpaRepository,
            SettingChangeMapper settingChangeMapper,
            ParamGuardrails paramGuardrails,
            Clock clock) {
        this.settingJpaRepository = settingJpaRepository;
        this.settingChangeJpaRepository = settingChangeJpaRepository;
        this.settingChangeMapper = settingChangeMapper;
        this.paramGuardrails = paramGuardrails;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ConfigSnapshot snapshot() {
        Map<String, String> values = new HashMap<>();
        for (SettingEntity entity : settingJpaRepository.findAll()) {
            values.put(entity.getKey(), entity.getValue());
        }
        return new ConfigSnapshot(values, LocalDateTime.now(clock));
    }

    /** All known keys with their effective value, defaults filled in, sorted by key. */
    @Transactional(readOnly = true)
    public Map<String, String> getAll() {
        ConfigSnapshot snapshot = snapshot();
        Map<String, String> all = new TreeMap<>();
        for (SettingKey key : SettingKey.values()) {
            all.put(key.getKey(), snapshot.getString(key));
        }
        return all;
    }

    /**
     * Validates and applies a batch of writes. Nothing is written unless every entry is
     * valid.
     *
     * @return the effective values of the written keys
     */
    @Transactional
    public Map<String, String> update(Map<String, String> changes, String changedBy, String reason) {
        if (changes == null || changes.isEmpty()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "No settings supplied");
        }
        for (Map.Entry<String, String> change : changes.entrySet()) {
            if (SettingKey.fromKey(change.getKey()).isEmpty()) {
                throw new BusinessException(
                        ErrorCode.VALIDATION_ERROR,
                        "Unknown parameter: " + change.getKey(),
                        Map.of("key", change.getKey()));
            }
            paramGuardrails.requireValid(change.getKey(), change.getValue());
        }

        Map<String, String> written = new LinkedHashMap<>();
        for (Map.Entry<String, String> change : changes.entrySet()) {
            SettingKey key = SettingKey.fromKey(change.getKey()).orElseThrow();
            written.put(key.getKey(), write(key, change.getValue().trim(), changedBy, reason));
        }
        return written;
    }

    /**
     * Writes one already-validated value and records the change.
     *
     * @return the value now stored
     */
    @Transactional
    public String write(SettingKey key, String value, String changedBy, String reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        SettingEntity entity = settingJpaRepository
                .findById(key.getKey())
                .orElseGet(() -> SettingEntity.builder().key(key.getKey()).build());
        String oldValue = entity.getValue();

        entity.setValue(value);
        entity.setUpdatedAt(now);
        settingJpaRepository.save(entity);
        recordChange(key.getKey(), oldValue, value, changedBy, reason, now);
        return value;
    }

    /** Inserts a default row for every missing key. Existing rows are left alone. */
    @Transactional
    public int seedDefaults() {
        int seeded = 0;
        LocalDateTime now = LocalDateTime.now(clock);
        for (SettingKey key : SettingKey.values()) {
            if (!settingJpaRepository.existsById(key.getKey())) {
                settingJpaRepository.save(SettingEntity.builder()
                        .key(key.getKey())
                        .value(key.getDefaultValue())
                        .updatedAt(now)
                        .build());
                seeded++;
            }
        }
        if (seeded > 0) {
            log.info("Seeded {} settings with defaults", seeded);
        }
        return seeded;
    }

    @Transactional(readOnly = true)
    public List<SettingChange> getHistory() {
        return settingChangeMapper.toDomainList(settingChangeJpaRepository.findAllByOrderByChangedAtDesc());
    }

    private void recordChange(
            String key, String oldValue, String newValue, String changedBy, String reason, LocalDateTime now) {
        if (Objects.equals(oldValue, newValue)) {
            return;
        }
        settingChangeJpaRepository.save(SettingChangeEntity.builder()
                .settingKey(key)
                .oldValue(oldValue)
                .newValue(newValue)
                .changedBy(changedBy)
                .reason(reason)
                .changedAt(now)
                .build());
        log.info("Setting changed: {} = {} -> {} (by {})", key, oldValue, newValue, changedBy);
    }
}

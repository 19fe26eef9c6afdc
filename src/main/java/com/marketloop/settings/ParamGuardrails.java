package com.marketloop.settings;

import com.marketloop.domain.enums.ParamType;
import com.marketloop.domain.enums.SizingMode;
import com.marketloop.exception.GuardrailViolationException;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Validates values written to the control plane.
 *
 * <p>Every known key is type-checked. Keys listed in {@link TunableParameter} are also
 * bounds-checked, which is the guardrail applied to recommender proposals and
 * re-applied when a human approves one.
 */
@Component
public class ParamGuardrails {

    /**
     * Returns a human-readable violation, or empty when the value is acceptable.
     */
    public Optional<String> findViolation(String key, String rawValue) {
        Optional<SettingKey> settingKey = SettingKey.fromKey(key);
        if (settingKey.isEmpty()) {
            return Optional.of("Unknown parameter: " + key);
        }
        if (rawValue == null || rawValue.isBlank()) {
            return Optional.of("Value for " + key + " must not be blank");
        }

        ParamType type = settingKey.get().getType();
        String value = rawValue.trim();
        switch (type) {
            case BOOLEAN:
                if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                    return Optional.of("Invalid value for " + key + ": expected true or false");
                }
                return Optional.empty();
            case TEXT:
                if (settingKey.get() == SettingKey.SIZING_MODE) {
                    try {
                        SizingMode.fromSetting(value);
                    } catch (IllegalArgumentException e) {
                        return Optional.of("Invalid value for " + key + ": expected kelly or fixed_dollar");
                    }
                }
                return Optional.empty();
            default:
                return checkNumeric(key, value, type);
        }
    }

    /**
     * Like {@link #findViolation} but restricted to tunable keys, which are the only
     * targets a recommendation may have.
     */
    public Optional<String> findTunableViolation(String key, String rawValue) {
        if (TunableParameter.fromKey(key).isEmpty()) {
            return Optional.of("Parameter is not tunable: " + key);
        }
        return findViolation(key, rawValue);
    }

    public void requireValid(String key, String rawValue) {
        findViolation(key, rawValue).ifPresent(message -> {
            throw new GuardrailViolationException(key, rawValue, message);
        });
    }

    public void requireTunable(String key, String rawValue) {
        findTunableViolation(key, rawValue).ifPresent(message -> {
            throw new GuardrailViolationException(key, rawValue, message);
        });
    }

    /**
     * Clamps a candidate value into the guardrail range of a tunable parameter.
     */
    public BigDecimal clamp(TunableParameter parameter, BigDecimal value) {
        return value.max(parameter.getMin()).min(parameter.getMax());
    }

    private Optional<String> checkNumeric(String key, String value, ParamType type) {
        BigDecimal parsed;
        try {
            parsed = new BigDecimal(value);
        } catch (NumberFormatException e) {
            return Optional.of("Invalid value for " + key + ": cannot convert '" + value + "' to " + type);
        }
        if (type == ParamType.INT && parsed.stripTrailingZeros().scale() > 0) {
            return Optional.of("Invalid value for " + key + ": expected a whole number");
        }
        if (parsed.signum() < 0) {
            return Optional.of(key + " value " + value + " must not be negative");
        }

        Optional<TunableParameter> tunable = TunableParameter.fromKey(key);
        if (tunable.isPresent()) {
            if (parsed.compareTo(tunable.get().getMin()) < 0) {
                return Optional.of(key + " value " + value + " is below minimum " + tunable.get().getMin());
            }
            if (parsed.compareTo(tunable.get().getMax()) > 0) {
                return Optional.of(key + " value " + value + " is above maximum " + tunable.get().getMax());
            }
        }
        return Optional.empty();
    }
}

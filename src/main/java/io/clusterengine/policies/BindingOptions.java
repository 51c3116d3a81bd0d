package io.clusterengine.policies;

import io.clusterengine.enums.EnforcementLevel;
import io.clusterengine.models.Action;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import static io.clusterengine.config.Constants.*;

/**
 * Binding settings supplied on attach or update. Null fields keep the current (or default)
 * value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BindingOptions {

    private EnforcementLevel level;
    private Boolean enabled;
    private Integer priority;
    private Integer cooldownSeconds;

    public static BindingOptions defaults() {
        return new BindingOptions();
    }

    /**
     * Reads the options from the inputs of an attach or update action.
     */
    public static BindingOptions fromInputs(Action action) throws InvalidPolicyConfigException {
        BindingOptions options = new BindingOptions();
        try {
            if (action.hasInput(INPUT_LEVEL)) {
                EnforcementLevel level = EnforcementLevel.fromString(action.getStringInput(INPUT_LEVEL));
                if (level == null) {
                    throw new InvalidPolicyConfigException("Unknown enforcement level: " + action.getInput(INPUT_LEVEL));
                }
                options.setLevel(level);
            }
            if (action.hasInput(INPUT_ENABLED)) {
                options.setEnabled(action.getBooleanInput(INPUT_ENABLED, true));
            }
            if (action.hasInput(INPUT_PRIORITY)) {
                options.setPriority(action.getIntInput(INPUT_PRIORITY, DEFAULT_BINDING_PRIORITY));
            }
            if (action.hasInput(INPUT_COOLDOWN)) {
                options.setCooldownSeconds(action.getIntInput(INPUT_COOLDOWN, DEFAULT_BINDING_COOLDOWN_SECONDS));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyConfigException(e.getMessage(), e);
        }
        if (options.getCooldownSeconds() != null && options.getCooldownSeconds() < 0) {
            throw new InvalidPolicyConfigException("cooldown must not be negative, got " + options.getCooldownSeconds());
        }
        return options;
    }
}

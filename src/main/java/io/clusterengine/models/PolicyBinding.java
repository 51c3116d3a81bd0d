package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.EnforcementLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

import static io.clusterengine.config.Constants.DEFAULT_BINDING_COOLDOWN_SECONDS;
import static io.clusterengine.config.Constants.DEFAULT_BINDING_PRIORITY;

/**
 * Attachment of a policy to a cluster.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PolicyBinding {

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("policy_id")
    private String policyId;

    @Builder.Default
    @JsonProperty("level")
    private EnforcementLevel level = EnforcementLevel.CRITICAL;

    @Builder.Default
    @JsonProperty("enabled")
    private boolean enabled = true;

    // Lower value runs first
    @Builder.Default
    @JsonProperty("priority")
    private int priority = DEFAULT_BINDING_PRIORITY;

    @Builder.Default
    @JsonProperty("cooldown_seconds")
    private int cooldownSeconds = DEFAULT_BINDING_COOLDOWN_SECONDS;

    @JsonProperty("attached_at")
    private OffsetDateTime attachedAt;

    @JsonProperty("last_triggered_at")
    private OffsetDateTime lastTriggeredAt;

    /**
     * Whether the binding is still cooling down from its last triggering at {@code now}.
     */
    public boolean isInCooldown(OffsetDateTime now) {
        if (cooldownSeconds <= 0 || lastTriggeredAt == null) {
            return false;
        }
        return lastTriggeredAt.plusSeconds(cooldownSeconds).isAfter(now);
    }
}

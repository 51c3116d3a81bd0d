package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.CheckStatus;
import io.clusterengine.enums.PolicyPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one bound policy for one phase of one action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PolicyResult {

    @JsonProperty("policy_id")
    private String policyId;

    @JsonProperty("policy_type")
    private String policyType;

    @JsonProperty("phase")
    private PolicyPhase phase;

    // What the policy itself reported
    @JsonProperty("raw_status")
    private CheckStatus rawStatus;

    // After the binding's enforcement level was applied
    @JsonProperty("status")
    private CheckStatus status;

    @JsonProperty("reason")
    private String reason;
}

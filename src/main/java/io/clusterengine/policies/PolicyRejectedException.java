package io.clusterengine.policies;

import io.clusterengine.models.PolicyResult;
import lombok.Getter;

import java.util.List;

/**
 * Thrown when a bound policy produced an effective CRITICAL result for an action.
 */
@Getter
public class PolicyRejectedException extends Exception {

    private final String policyId;
    private final String reason;
    private final List<PolicyResult> results;

    public PolicyRejectedException(String policyId, String reason, List<PolicyResult> results) {
        super("Policy " + policyId + " rejected action: " + reason);
        this.policyId = policyId;
        this.reason = reason;
        this.results = List.copyOf(results);
    }
}

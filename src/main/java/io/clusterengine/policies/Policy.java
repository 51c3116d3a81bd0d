package io.clusterengine.policies;

import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.PolicyPhase;
import io.clusterengine.models.PolicyCheck;

import static io.clusterengine.config.Constants.DEFAULT_BINDING_PRIORITY;

/**
 * A rule bound to a cluster that inspects, and may modify or veto, the actions run on it.
 *
 * Hooks may write to the action's inputs; policies evaluated later in the chain see those
 * writes. A hook that throws is treated as having returned ERROR.
 */
public interface Policy {

    String getId();

    String getName();

    /**
     * Registered type name, e.g. "DeletionPolicy".
     */
    String getType();

    /**
     * Whether the policy has a hook for this action type in this phase.
     */
    boolean supports(ActionType actionType, PolicyPhase phase);

    /**
     * Priority given to a new binding of this policy when the caller names none. Lower runs
     * first.
     */
    default int getDefaultPriority() {
        return DEFAULT_BINDING_PRIORITY;
    }

    PolicyCheck preOp(PolicyContext context);

    PolicyCheck postOp(PolicyContext context);
}

package io.clusterengine.policies;

import io.clusterengine.enums.PolicyPhase;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.store.TargetRegistry;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What a policy hook sees: the action being checked, a snapshot of the cluster taken when the
 * phase started, and the registry for anything else it needs to read or update.
 */
@Getter
@AllArgsConstructor
public class PolicyContext {

    private final TargetRegistry registry;
    private final Cluster cluster;
    private final Action action;
    private final PolicyPhase phase;

    public String getClusterId() {
        return cluster.getId();
    }
}

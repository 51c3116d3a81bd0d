package io.clusterengine.policies.impl;

import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.ClusterStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.PolicyCheck;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.policies.BasePolicy;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.policies.PolicyContext;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

import static io.clusterengine.config.Constants.*;

/**
 * Suspends health reporting while nodes are being removed and flags clusters whose share of
 * unhealthy nodes exceeds the configured limit after a check.
 */
@Slf4j
@Getter
public class HealthPolicy extends BasePolicy {

    private static final Set<ActionType> DELETIONS = EnumSet.of(
            ActionType.CLUSTER_SCALE_IN,
            ActionType.CLUSTER_DEL_NODES,
            ActionType.CLUSTER_DELETE,
            ActionType.NODE_DELETE);

    private final HealthPolicySpec spec;

    public HealthPolicy(PolicyRecord record) throws InvalidPolicyConfigException {
        super(record);
        this.spec = parseSpec(record.getSpec(), HealthPolicySpec.class);
        int max = spec.getMaxUnhealthyPercentage();
        if (max < 0 || max > 100) {
            throw new InvalidPolicyConfigException("max_unhealthy_percentage must be within 0..100, got " + max);
        }
    }

    @Override
    protected Set<ActionType> preTargets() {
        return DELETIONS;
    }

    @Override
    protected Set<ActionType> postTargets() {
        return EnumSet.of(ActionType.CLUSTER_CHECK);
    }

    @Override
    public PolicyCheck preOp(PolicyContext context) {
        context.getAction().putInput(INPUT_HEALTH_CHECK_SUSPENDED, true);
        return PolicyCheck.ok();
    }

    @Override
    public PolicyCheck postOp(PolicyContext context) {
        Action action = context.getAction();
        int healthy = size(action.getOutput(OUTPUT_HEALTHY_NODES));
        int unhealthy = size(action.getOutput(OUTPUT_UNHEALTHY_NODES));
        int total = healthy + unhealthy;
        if (total == 0 || unhealthy == 0) {
            return PolicyCheck.ok();
        }

        double percentage = unhealthy * 100.0 / total;
        if (percentage <= spec.getMaxUnhealthyPercentage()) {
            return PolicyCheck.ok();
        }

        String reason = String.format("%d of %d nodes unhealthy (%.1f%% > %d%%)",
                unhealthy, total, percentage, spec.getMaxUnhealthyPercentage());
        log.warn("[Cluster: {}] {}", context.getClusterId(), reason);
        if (spec.isMarkClusterWarning()) {
            context.getRegistry().updateClusterStatus(context.getClusterId(), ClusterStatus.WARNING, reason);
        }
        return PolicyCheck.error(reason);
    }

    private static int size(Object value) {
        return value instanceof Collection ? ((Collection<?>) value).size() : 0;
    }
}

package io.clusterengine.policies.impl;

import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.AdjustmentType;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.PolicyCheck;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.policies.BasePolicy;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.policies.PolicyContext;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;

import static io.clusterengine.config.Constants.INPUT_COUNT;
import static io.clusterengine.config.Constants.SCALING_BINDING_PRIORITY;

/**
 * Works out how many nodes a scale-in or scale-out request moves when the request itself does
 * not say, and keeps the result inside the cluster's size bounds.
 *
 * A count that would push the cluster outside [min_size, max_size] is CRITICAL, or with
 * {@code best_effort} is clamped to the bound and reported as WARNING.
 */
@Slf4j
@Getter
public class ScalingPolicy extends BasePolicy {

    private final ScalingPolicySpec spec;

    public ScalingPolicy(PolicyRecord record) throws InvalidPolicyConfigException {
        super(record);
        this.spec = parseSpec(record.getSpec(), ScalingPolicySpec.class);
        validate(spec);
    }

    private static void validate(ScalingPolicySpec spec) throws InvalidPolicyConfigException {
        if (spec.getEvent() != ActionType.CLUSTER_SCALE_IN && spec.getEvent() != ActionType.CLUSTER_SCALE_OUT) {
            throw new InvalidPolicyConfigException("event must be CLUSTER_SCALE_IN or CLUSTER_SCALE_OUT, got " + spec.getEvent());
        }
        ScalingPolicySpec.Adjustment adjustment = spec.getAdjustment();
        if (adjustment == null || adjustment.getType() == null) {
            throw new InvalidPolicyConfigException("adjustment.type is required");
        }
        if (adjustment.getNumber() < 0) {
            throw new InvalidPolicyConfigException("adjustment.number must not be negative, got " + adjustment.getNumber());
        }
        if (adjustment.getType() != AdjustmentType.CHANGE_IN_PERCENTAGE
                && adjustment.getNumber() != Math.floor(adjustment.getNumber())) {
            throw new InvalidPolicyConfigException("adjustment.number must be an integer for " + adjustment.getType());
        }
        if (adjustment.getMinStep() < 0) {
            throw new InvalidPolicyConfigException("adjustment.min_step must not be negative, got " + adjustment.getMinStep());
        }
    }

    @Override
    protected Set<ActionType> preTargets() {
        return Set.of(spec.getEvent());
    }

    @Override
    public int getDefaultPriority() {
        return SCALING_BINDING_PRIORITY;
    }

    @Override
    public PolicyCheck preOp(PolicyContext context) {
        Action action = context.getAction();
        if (action.hasInput(INPUT_COUNT)) {
            return PolicyCheck.ok("explicit count " + action.getInput(INPUT_COUNT));
        }

        Cluster cluster = context.getCluster();
        int current = cluster.getDesiredCapacity();
        int count = computeCount(current);
        int clamped = clamp(cluster, current, count);

        if (clamped == count) {
            action.putInput(INPUT_COUNT, count);
            return PolicyCheck.ok();
        }

        String reason = String.format("%s by %d would leave capacity %d outside [%d, %s]",
                spec.getEvent(), count, resulting(current, count), cluster.getMinSize(),
                cluster.getMaxSize() < 0 ? "unbounded" : String.valueOf(cluster.getMaxSize()));
        if (!spec.getAdjustment().isBestEffort()) {
            return PolicyCheck.critical(reason);
        }
        log.info("[Cluster: {}] {}; best effort count {}", cluster.getId(), reason, clamped);
        action.putInput(INPUT_COUNT, clamped);
        return PolicyCheck.warning(reason + ", clamped to " + clamped);
    }

    /**
     * Number of nodes to add or remove, before bounds are applied.
     */
    int computeCount(int current) {
        ScalingPolicySpec.Adjustment adjustment = spec.getAdjustment();
        double number = adjustment.getNumber();
        switch (adjustment.getType()) {
            case EXACT_CAPACITY:
                int target = (int) number;
                return spec.getEvent() == ActionType.CLUSTER_SCALE_IN
                        ? Math.max(0, current - target)
                        : Math.max(0, target - current);
            case CHANGE_IN_PERCENTAGE:
                int byPercent = (int) Math.floor(current * number / 100.0);
                return Math.max(byPercent, adjustment.getMinStep());
            case CHANGE_IN_CAPACITY:
            default:
                return (int) number;
        }
    }

    private int clamp(Cluster cluster, int current, int count) {
        if (spec.getEvent() == ActionType.CLUSTER_SCALE_IN) {
            return Math.max(0, Math.min(count, current - cluster.getMinSize()));
        }
        if (cluster.getMaxSize() < 0) {
            return count;
        }
        return Math.max(0, Math.min(count, cluster.getMaxSize() - current));
    }

    private int resulting(int current, int count) {
        return spec.getEvent() == ActionType.CLUSTER_SCALE_IN ? current - count : current + count;
    }
}

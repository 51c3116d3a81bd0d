package io.clusterengine.policies.impl;

import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.DeletionCriteria;
import io.clusterengine.enums.NodeStatus;
import io.clusterengine.models.Action;
import io.clusterengine.models.Node;
import io.clusterengine.models.PolicyCheck;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.policies.BasePolicy;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.policies.PolicyContext;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.*;

/**
 * Chooses which nodes leave a cluster when it shrinks, and how they leave.
 *
 * PRE: when the action carries no explicit candidates, ranks the eligible members by the
 * configured criteria and writes the first {@code count} of them to the action's
 * {@code candidates} input, together with the destroy, grace period and capacity settings.
 * Selecting fewer nodes than requested is reported as WARNING.
 *
 * POST: when {@code reduce_desired_capacity} is set, lowers the cluster's desired capacity by
 * the number of nodes the action actually removed.
 */
@Slf4j
@Getter
public class DeletionPolicy extends BasePolicy {

    private static final Set<ActionType> TARGETS = Collections.unmodifiableSet(EnumSet.of(
            ActionType.CLUSTER_SCALE_IN,
            ActionType.CLUSTER_DEL_NODES,
            ActionType.CLUSTER_DELETE,
            ActionType.NODE_DELETE));

    private final DeletionPolicySpec spec;
    private final Random random;

    public DeletionPolicy(PolicyRecord record) throws InvalidPolicyConfigException {
        this(record, new Random());
    }

    public DeletionPolicy(PolicyRecord record, Random random) throws InvalidPolicyConfigException {
        super(record);
        this.spec = parseSpec(record.getSpec(), DeletionPolicySpec.class);
        if (spec.getCriteria() == null) {
            throw new InvalidPolicyConfigException("criteria must be one of OLDEST_FIRST, OLDEST_PROFILE_FIRST, YOUNGEST_FIRST, RANDOM");
        }
        if (spec.getGracePeriod() < 0) {
            throw new InvalidPolicyConfigException("grace_period must not be negative, got " + spec.getGracePeriod());
        }
        this.random = random;
    }

    @Override
    protected Set<ActionType> preTargets() {
        return TARGETS;
    }

    @Override
    protected Set<ActionType> postTargets() {
        return TARGETS;
    }

    @Override
    public PolicyCheck preOp(PolicyContext context) {
        Action action = context.getAction();
        PolicyCheck result = PolicyCheck.ok();

        if (!action.hasInput(INPUT_CANDIDATES)) {
            List<String> explicit = explicitCandidates(action);
            if (explicit != null) {
                action.putInput(INPUT_CANDIDATES, explicit);
            } else {
                result = selectCandidates(context);
            }
        }

        action.putInput(INPUT_DESTROY_AFTER_DELETION, spec.isDestroyAfterDeletion());
        action.putInput(INPUT_GRACE_PERIOD, spec.getGracePeriod());
        action.putInput(INPUT_REDUCE_DESIRED_CAPACITY, spec.isReduceDesiredCapacity());
        return result;
    }

    @Override
    public PolicyCheck postOp(PolicyContext context) {
        Action action = context.getAction();
        // Set by preOp; absent when PRE did not run for this action
        if (!action.getBooleanInput(INPUT_REDUCE_DESIRED_CAPACITY, false) || action.getType() == ActionType.CLUSTER_DELETE) {
            return PolicyCheck.ok();
        }
        int removed = countRemoved(action.getOutput(OUTPUT_NODES_REMOVED));
        if (removed == 0) {
            return PolicyCheck.ok();
        }
        int capacity = context.getRegistry().updateClusterCapacity(context.getClusterId(), -removed);
        log.info("[Cluster: {}] Desired capacity reduced by {} to {} after {}",
                context.getClusterId(), removed, capacity, action.getId());
        return PolicyCheck.ok("desired capacity reduced by " + removed);
    }

    /**
     * Nodes named by the request itself: the target of a node delete, or the node list of a
     * del-nodes request. Null when the policy has to choose.
     */
    private List<String> explicitCandidates(Action action) {
        if (action.getType() == ActionType.NODE_DELETE) {
            return new ArrayList<>(List.of(action.getTargetId()));
        }
        if (action.getType() == ActionType.CLUSTER_DEL_NODES && action.hasInput(INPUT_NODES)) {
            return action.getStringListInput(INPUT_NODES);
        }
        return null;
    }

    private PolicyCheck selectCandidates(PolicyContext context) {
        Action action = context.getAction();
        List<Node> members = context.getRegistry().listNodes(context.getClusterId());

        List<Node> eligible;
        int count;
        if (action.getType() == ActionType.CLUSTER_DELETE) {
            eligible = members;
            count = members.size();
        } else {
            eligible = members.stream()
                    .filter(n -> n.getStatus() == NodeStatus.ACTIVE)
                    .collect(Collectors.toList());
            count = action.getIntInput(INPUT_COUNT, 1);
        }

        if (count < 0) {
            return PolicyCheck.error("deletion count must not be negative, got " + count);
        }
        if (count == 0) {
            action.putInput(INPUT_CANDIDATES, new ArrayList<String>());
            return PolicyCheck.ok("nothing to delete");
        }

        List<String> candidates = rank(eligible).stream()
                .limit(count)
                .map(Node::getId)
                .collect(Collectors.toList());
        action.putInput(INPUT_CANDIDATES, candidates);

        log.info("[Cluster: {}] {} selected {} of {} requested node(s) for deletion: {}",
                context.getClusterId(), spec.getCriteria(), candidates.size(), count, candidates);

        if (candidates.size() < count) {
            return PolicyCheck.warning("only " + candidates.size() + " eligible node(s) for " + count + " requested");
        }
        return PolicyCheck.ok();
    }

    /**
     * Orders the nodes so that the first ones are the preferred victims. Ties go to the
     * lower node id, and nodes without a creation time come last under every age criteria.
     */
    List<Node> rank(List<Node> nodes) {
        Comparator<Node> byId = Comparator.comparing(Node::getId);
        Comparator<Node> byAge = Comparator.comparing(Node::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()));
        Comparator<Node> byYouth = Comparator.comparing(Node::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));
        List<Node> ranked = new ArrayList<>(nodes);

        DeletionCriteria criteria = spec.getCriteria();
        switch (criteria) {
            case OLDEST_FIRST:
                ranked.sort(byAge.thenComparing(byId));
                break;
            case YOUNGEST_FIRST:
                ranked.sort(byYouth.thenComparing(byId));
                break;
            case OLDEST_PROFILE_FIRST:
                ranked.sort(Comparator.comparingInt(Node::getProfileVersionIndex).thenComparing(byAge).thenComparing(byId));
                break;
            case RANDOM:
                ranked.sort(byId);
                Collections.shuffle(ranked, random);
                break;
            default:
                throw new IllegalStateException("Unhandled deletion criteria " + criteria);
        }
        return ranked;
    }

    private static int countRemoved(Object removed) {
        if (removed instanceof Collection) {
            return ((Collection<?>) removed).size();
        }
        if (removed instanceof Number) {
            return ((Number) removed).intValue();
        }
        return 0;
    }
}

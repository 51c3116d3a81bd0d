package io.clusterengine.policies;

import io.clusterengine.enums.CheckStatus;
import io.clusterengine.enums.EnforcementLevel;
import io.clusterengine.enums.PolicyPhase;
import io.clusterengine.models.Action;
import io.clusterengine.models.Cluster;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.models.PolicyCheck;
import io.clusterengine.models.PolicyResult;
import io.clusterengine.store.StoreException;
import io.clusterengine.store.TargetNotFoundException;
import io.clusterengine.store.TargetRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Runs an action through the policies bound to a cluster.
 *
 * Bindings are visited in priority order. Each enabled binding whose policy hooks the action
 * type in the given phase, and which is not cooling down, contributes one result. The
 * binding's enforcement level turns the policy's raw status into the effective one, and the
 * first effective CRITICAL ends the evaluation.
 *
 * Cooldown is tracked on the PRE phase only; POST hooks always run.
 */
@Slf4j
public class PolicyEngine {

    private final TargetRegistry registry;
    private final PolicyManager policyManager;
    private final Clock clock;

    public PolicyEngine(TargetRegistry registry, PolicyManager policyManager) {
        this(registry, policyManager, Clock.systemUTC());
    }

    public PolicyEngine(TargetRegistry registry, PolicyManager policyManager, Clock clock) {
        this.registry = registry;
        this.policyManager = policyManager;
        this.clock = clock;
    }

    /**
     * Evaluates every applicable binding and returns their results in evaluation order.
     */
    public List<PolicyResult> evaluate(String clusterId, Action action, PolicyPhase phase) {
        if (clusterId == null) {
            return Collections.emptyList();
        }
        Optional<Cluster> cluster = registry.getCluster(clusterId);
        if (cluster.isEmpty()) {
            log.debug("Cluster {} not found, no policies to evaluate for {}", clusterId, action.getId());
            return Collections.emptyList();
        }

        PolicyContext context = new PolicyContext(registry, cluster.get(), action, phase);
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<PolicyResult> results = new ArrayList<>();

        for (PolicyBinding binding : cluster.get().getOrderedBindings()) {
            if (!binding.isEnabled()) {
                continue;
            }
            Policy policy;
            try {
                policy = policyManager.loadPolicy(binding.getPolicyId());
            } catch (InvalidPolicyConfigException | TargetNotFoundException e) {
                log.error("[Cluster: {}] Bound policy {} cannot be loaded: {}", clusterId, binding.getPolicyId(), e.getMessage());
                PolicyResult result = toResult(binding, null, phase, PolicyCheck.error("policy cannot be loaded: " + e.getMessage()));
                results.add(result);
                if (result.getStatus() == CheckStatus.CRITICAL) {
                    break;
                }
                continue;
            }

            if (!policy.supports(action.getType(), phase)) {
                continue;
            }
            if (phase == PolicyPhase.PRE && binding.isInCooldown(now)) {
                log.info("[Cluster: {}] Policy {} in cooldown until {}, skipped for {}", clusterId, policy.getId(),
                        binding.getLastTriggeredAt().plusSeconds(binding.getCooldownSeconds()), action.getId());
                continue;
            }

            PolicyResult result = toResult(binding, policy, phase, runHook(policy, context));
            results.add(result);
            if (phase == PolicyPhase.PRE) {
                markTriggered(clusterId, binding, now);
            }

            if (result.getStatus() == CheckStatus.CRITICAL) {
                log.warn("[Cluster: {}] Policy {} blocked {} at {}: {}", clusterId, policy.getId(), action.getId(), phase, result.getReason());
                break;
            }
        }
        return results;
    }

    /**
     * Evaluates the phase and records the results on the action.
     *
     * @throws PolicyRejectedException if any binding produced an effective CRITICAL
     */
    public List<PolicyResult> enforce(String clusterId, Action action, PolicyPhase phase) throws PolicyRejectedException {
        List<PolicyResult> results = evaluate(clusterId, action, phase);
        action.addPolicyResults(results);
        for (PolicyResult result : results) {
            if (result.getStatus() == CheckStatus.CRITICAL) {
                throw new PolicyRejectedException(result.getPolicyId(), result.getReason(), results);
            }
        }
        return results;
    }

    private PolicyCheck runHook(Policy policy, PolicyContext context) {
        try {
            PolicyCheck check = context.getPhase() == PolicyPhase.PRE ? policy.preOp(context) : policy.postOp(context);
            return check != null ? check : PolicyCheck.ok();
        } catch (RuntimeException e) {
            log.error("Policy {} failed in {} of {}: {}", policy.getId(), context.getPhase(), context.getAction().getId(), e.getMessage(), e);
            return PolicyCheck.error(policy.getType() + " failed: " + e.getMessage());
        }
    }

    private PolicyResult toResult(PolicyBinding binding, Policy policy, PolicyPhase phase, PolicyCheck check) {
        EnforcementLevel level = binding.getLevel() != null ? binding.getLevel() : EnforcementLevel.CRITICAL;
        CheckStatus effective = level.apply(check.getStatus());
        if (level == EnforcementLevel.IGNORE && check.getStatus() != CheckStatus.OK) {
            log.info("[Cluster: {}] Ignoring {} from policy {}: {}", binding.getClusterId(), check.getStatus(),
                    binding.getPolicyId(), check.getReason());
        }
        return PolicyResult.builder()
                .policyId(binding.getPolicyId())
                .policyType(policy != null ? policy.getType() : null)
                .phase(phase)
                .rawStatus(check.getStatus())
                .status(effective)
                .reason(check.getReason())
                .build();
    }

    private void markTriggered(String clusterId, PolicyBinding binding, OffsetDateTime now) {
        if (binding.getCooldownSeconds() <= 0) {
            return;
        }
        try {
            registry.updateCluster(clusterId, c -> {
                c.getBindings().replaceAll(b -> b.getPolicyId().equals(binding.getPolicyId())
                        ? b.toBuilder().lastTriggeredAt(now).build() : b);
                return c;
            });
        } catch (StoreException e) {
            log.warn("[Cluster: {}] Could not record trigger time of policy {}: {}", clusterId, binding.getPolicyId(), e.getMessage());
        }
    }
}

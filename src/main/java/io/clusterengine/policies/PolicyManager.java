package io.clusterengine.policies;

import io.clusterengine.models.Cluster;
import io.clusterengine.models.PolicyBinding;
import io.clusterengine.models.PolicyRecord;
import io.clusterengine.store.TargetNotFoundException;
import io.clusterengine.store.TargetRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Creates policy records and manages their bindings to clusters.
 *
 * Policy objects are built once per record and cached; records are immutable, so the cache
 * only needs invalidating on delete.
 */
@Slf4j
public class PolicyManager {

    private final TargetRegistry registry;
    private final PolicyRegistry policyRegistry;
    private final ConcurrentMap<String, Policy> cache = new ConcurrentHashMap<>();

    public PolicyManager(TargetRegistry registry, PolicyRegistry policyRegistry) {
        this.registry = registry;
        this.policyRegistry = policyRegistry;
    }

    /**
     * Validates and stores a new policy.
     *
     * @throws InvalidPolicyConfigException if the type is unknown or the spec is malformed
     */
    public PolicyRecord createPolicy(String name, String type, Map<String, Object> spec) throws InvalidPolicyConfigException {
        String canonicalType = policyRegistry.resolveType(type);
        PolicyRecord record = new PolicyRecord(
                UUID.randomUUID().toString(),
                name,
                canonicalType,
                spec != null ? new LinkedHashMap<>(spec) : new LinkedHashMap<>(),
                OffsetDateTime.now());

        Policy policy = policyRegistry.create(record);
        registry.savePolicy(record);
        cache.put(record.getId(), policy);
        log.info("Created policy {} ({}) as {}", name, canonicalType, record.getId());
        return record;
    }

    /**
     * Deletes a policy that is not bound to any cluster.
     */
    public void deletePolicy(String policyId) throws InvalidPolicyConfigException {
        registry.getPolicy(policyId).orElseThrow(() -> new TargetNotFoundException("Policy", policyId));
        List<String> boundTo = registry.listClusters().stream()
                .filter(c -> c.findBinding(policyId).isPresent())
                .map(Cluster::getId)
                .collect(Collectors.toList());
        if (!boundTo.isEmpty()) {
            throw new InvalidPolicyConfigException("Policy " + policyId + " is still attached to " + boundTo);
        }
        registry.deletePolicy(policyId);
        cache.remove(policyId);
        log.info("Deleted policy {}", policyId);
    }

    /**
     * Policy object for a stored record.
     *
     * @throws TargetNotFoundException if no such policy exists
     */
    public Policy loadPolicy(String policyId) throws InvalidPolicyConfigException {
        Policy cached = cache.get(policyId);
        if (cached != null) {
            return cached;
        }
        PolicyRecord record = registry.getPolicy(policyId)
                .orElseThrow(() -> new TargetNotFoundException("Policy", policyId));
        Policy policy = policyRegistry.create(record);
        Policy existing = cache.putIfAbsent(policyId, policy);
        return existing != null ? existing : policy;
    }

    /**
     * Binds a policy to a cluster. A cluster holds at most one policy of each type. Without an
     * explicit priority the binding takes the policy type's default.
     */
    public PolicyBinding attach(String clusterId, String policyId, BindingOptions options) throws InvalidPolicyConfigException {
        Policy policy = loadPolicy(policyId);
        Cluster cluster = registry.requireCluster(clusterId);
        checkAttachable(cluster, policy);

        PolicyBinding binding = applyOptions(PolicyBinding.builder()
                .clusterId(clusterId)
                .policyId(policyId)
                .priority(policy.getDefaultPriority())
                .attachedAt(OffsetDateTime.now())
                .build(), options);

        try {
            registry.updateCluster(clusterId, c -> {
                try {
                    checkAttachable(c, policy);
                } catch (InvalidPolicyConfigException e) {
                    throw new BindingConflict(e);
                }
                c.getBindings().add(binding);
                return c;
            });
        } catch (BindingConflict e) {
            throw e.conflict;
        }
        log.info("[Cluster: {}] Attached policy {} ({}) level={} priority={}",
                clusterId, policyId, policy.getType(), binding.getLevel(), binding.getPriority());
        return binding;
    }

    public void detach(String clusterId, String policyId) throws InvalidPolicyConfigException {
        Cluster cluster = registry.requireCluster(clusterId);
        if (cluster.findBinding(policyId).isEmpty()) {
            throw new InvalidPolicyConfigException("Policy " + policyId + " is not attached to cluster " + clusterId);
        }
        registry.updateCluster(clusterId, c -> {
            c.getBindings().removeIf(b -> b.getPolicyId().equals(policyId));
            return c;
        });
        log.info("[Cluster: {}] Detached policy {}", clusterId, policyId);
    }

    public PolicyBinding updateBinding(String clusterId, String policyId, BindingOptions options) throws InvalidPolicyConfigException {
        Cluster cluster = registry.requireCluster(clusterId);
        if (cluster.findBinding(policyId).isEmpty()) {
            throw new InvalidPolicyConfigException("Policy " + policyId + " is not attached to cluster " + clusterId);
        }
        Cluster updated = registry.updateCluster(clusterId, c -> {
            c.getBindings().replaceAll(b -> b.getPolicyId().equals(policyId) ? applyOptions(b, options) : b);
            return c;
        });
        PolicyBinding binding = updated.findBinding(policyId)
                .orElseThrow(() -> new InvalidPolicyConfigException("Policy " + policyId + " was detached concurrently"));
        log.info("[Cluster: {}] Updated binding of policy {}: level={} enabled={} priority={} cooldown={}",
                clusterId, policyId, binding.getLevel(), binding.isEnabled(), binding.getPriority(), binding.getCooldownSeconds());
        return binding;
    }

    public Optional<PolicyBinding> getBinding(String clusterId, String policyId) {
        return registry.getCluster(clusterId).flatMap(c -> c.findBinding(policyId));
    }

    private void checkAttachable(Cluster cluster, Policy policy) throws InvalidPolicyConfigException {
        for (PolicyBinding existing : cluster.getBindings()) {
            if (existing.getPolicyId().equals(policy.getId())) {
                throw new InvalidPolicyConfigException("Policy " + policy.getId() + " is already attached to cluster " + cluster.getId());
            }
            Policy bound = loadPolicyQuietly(existing.getPolicyId());
            if (bound != null && bound.getType().equals(policy.getType())) {
                throw new InvalidPolicyConfigException("Cluster " + cluster.getId() + " already has a " + policy.getType()
                        + " attached (" + existing.getPolicyId() + ")");
            }
        }
    }

    private Policy loadPolicyQuietly(String policyId) {
        try {
            return loadPolicy(policyId);
        } catch (InvalidPolicyConfigException | TargetNotFoundException e) {
            log.warn("Bound policy {} cannot be loaded: {}", policyId, e.getMessage());
            return null;
        }
    }

    private static PolicyBinding applyOptions(PolicyBinding binding, BindingOptions options) {
        if (options == null) {
            return binding;
        }
        PolicyBinding.PolicyBindingBuilder builder = binding.toBuilder();
        if (options.getLevel() != null) {
            builder.level(options.getLevel());
        }
        if (options.getEnabled() != null) {
            builder.enabled(options.getEnabled());
        }
        if (options.getPriority() != null) {
            builder.priority(options.getPriority());
        }
        if (options.getCooldownSeconds() != null) {
            builder.cooldownSeconds(options.getCooldownSeconds());
        }
        return builder.build();
    }

    /**
     * Carries a conflict found inside a registry update out of the mutator.
     */
    private static final class BindingConflict extends RuntimeException {
        private final InvalidPolicyConfigException conflict;

        BindingConflict(InvalidPolicyConfigException cause) {
            super(cause.getMessage(), cause);
            this.conflict = cause;
        }
    }
}

package io.clusterengine.policies;

import io.clusterengine.models.PolicyRecord;
import io.clusterengine.policies.impl.DeletionPolicy;
import io.clusterengine.policies.impl.HealthPolicy;
import io.clusterengine.policies.impl.ScalingPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static io.clusterengine.config.Constants.*;

/**
 * Maps policy type names to the factories that build them.
 *
 * Built-in types are registered on construction. Further types and aliases may be added until
 * the registry is sealed, which the engine does when it starts.
 */
@Slf4j
public class PolicyRegistry {

    private final Map<String, PolicyFactory> factories = new LinkedHashMap<>();
    private final Map<String, String> aliases = new LinkedHashMap<>();
    private volatile boolean sealed = false;

    public PolicyRegistry() {
        this(Collections.emptyMap());
    }

    /**
     * @param aliases custom type name to registered type name
     */
    public PolicyRegistry(Map<String, String> aliases) {
        register(POLICY_TYPE_DELETION, DeletionPolicy::new);
        register(POLICY_TYPE_SCALING, ScalingPolicy::new);
        register(POLICY_TYPE_HEALTH, HealthPolicy::new);
        aliases.forEach(this::registerAlias);
    }

    public synchronized void register(String type, PolicyFactory factory) {
        checkNotSealed();
        if (factories.putIfAbsent(type, factory) != null) {
            throw new IllegalArgumentException("Policy type already registered: " + type);
        }
        log.debug("Registered policy type {}", type);
    }

    public synchronized void registerAlias(String alias, String type) {
        checkNotSealed();
        if (!factories.containsKey(type)) {
            throw new IllegalArgumentException("Alias " + alias + " refers to unknown policy type " + type);
        }
        if (factories.containsKey(alias)) {
            throw new IllegalArgumentException("Alias " + alias + " shadows a registered policy type");
        }
        aliases.put(alias, type);
        log.info("Registered policy type alias {} -> {}", alias, type);
    }

    /**
     * Stops further registration.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    /**
     * Canonical type name for a registered type or alias.
     */
    public synchronized String resolveType(String type) throws InvalidPolicyConfigException {
        if (type == null) {
            throw new InvalidPolicyConfigException("Policy type is required");
        }
        if (factories.containsKey(type)) {
            return type;
        }
        String target = aliases.get(type);
        if (target == null) {
            throw new InvalidPolicyConfigException("Unknown policy type: " + type);
        }
        return target;
    }

    /**
     * Builds the policy described by the record.
     */
    public Policy create(PolicyRecord record) throws InvalidPolicyConfigException {
        PolicyFactory factory;
        synchronized (this) {
            factory = factories.get(resolveType(record.getType()));
        }
        return factory.create(record);
    }

    public synchronized Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
    }

    private void checkNotSealed() {
        if (sealed) {
            throw new IllegalStateException("Policy registry is sealed; register policy types before the engine starts");
        }
    }
}

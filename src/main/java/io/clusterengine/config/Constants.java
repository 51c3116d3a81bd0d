package io.clusterengine.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_ENGINE_ID = "cluster-engine";
    public static final String STORE_BACKEND_MEMORY = "memory";
    public static final String STORE_BACKEND_ETCD = "etcd";
    public static final int DEFAULT_WORKER_COUNT = 4;
    public static final int DEFAULT_LOCK_MAX_RETRIES = 10;
    public static final long DEFAULT_LOCK_RETRY_BASE_MILLIS = 100L;
    public static final long DEFAULT_LOCK_RETRY_MAX_MILLIS = 5_000L;
    public static final long DEFAULT_DRAIN_TIMEOUT_SECONDS = 30L;
    public static final long DEFAULT_ACTION_RETENTION_MINUTES = 60L;
    public static final long DEFAULT_PURGE_INTERVAL_SECONDS = 60L;

    // Action input keys
    public static final String INPUT_COUNT = "count";
    public static final String INPUT_NODES = "nodes";
    public static final String INPUT_CANDIDATES = "candidates";
    public static final String INPUT_DESTROY_AFTER_DELETION = "destroy_after_deletion";
    public static final String INPUT_GRACE_PERIOD = "grace_period";
    public static final String INPUT_REDUCE_DESIRED_CAPACITY = "reduce_desired_capacity";
    public static final String INPUT_HEALTH_CHECK_SUSPENDED = "health_check_suspended";
    public static final String INPUT_CLUSTER_ID = "cluster_id";
    public static final String INPUT_POLICY_ID = "policy_id";
    public static final String INPUT_LEVEL = "level";
    public static final String INPUT_PRIORITY = "priority";
    public static final String INPUT_ENABLED = "enabled";
    public static final String INPUT_COOLDOWN = "cooldown";
    public static final String INPUT_DEFERRED = "deferred";

    // Action output keys
    public static final String OUTPUT_NODES_REMOVED = "nodes_removed";
    public static final String OUTPUT_NODES_CREATED = "nodes_created";
    public static final String OUTPUT_NODES_ADDED = "nodes_added";
    public static final String OUTPUT_DEFERRED_DESTROYS = "deferred_destroys";
    public static final String OUTPUT_FAILED_NODES = "failed_nodes";
    public static final String OUTPUT_HEALTHY_NODES = "healthy_nodes";
    public static final String OUTPUT_UNHEALTHY_NODES = "unhealthy_nodes";
    public static final String OUTPUT_POLICY_WARNINGS = "policy_warnings";

    // Policy binding defaults
    public static final int DEFAULT_BINDING_PRIORITY = 50;
    // Scaling fixes the count before deletion picks candidates
    public static final int SCALING_BINDING_PRIORITY = 10;
    public static final int DEFAULT_BINDING_COOLDOWN_SECONDS = 0;

    // Built-in policy type names
    public static final String POLICY_TYPE_DELETION = "DeletionPolicy";
    public static final String POLICY_TYPE_SCALING = "ScalingPolicy";
    public static final String POLICY_TYPE_HEALTH = "HealthPolicy";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_ENGINE_ROOT = "cluster-engine";
    public static final String PATH_CLUSTERS = "clusters";
    public static final String PATH_NODES = "nodes";
    public static final String PATH_POLICIES = "policies";
    public static final String PATH_ACTION_LOCKS = "action-locks";

    // Node name pattern used for nodes created by cluster actions
    public static final String NODE_NAME_FORMAT = "node-%s-%03d";
}

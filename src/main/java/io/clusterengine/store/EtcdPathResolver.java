package io.clusterengine.store;

import java.nio.file.Paths;

import static io.clusterengine.config.Constants.*;

/**
 * Centralized etcd path resolver for engine records.
 * Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    /**
     * Pattern: /cluster-engine/clusters
     */
    public String getClustersPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ENGINE_ROOT, PATH_CLUSTERS).toString();
    }

    /**
     * Pattern: /cluster-engine/clusters/<cluster-id>
     */
    public String getClusterPath(String clusterId) {
        return Paths.get(getClustersPrefix(), clusterId).toString();
    }

    /**
     * Pattern: /cluster-engine/nodes
     */
    public String getNodesPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ENGINE_ROOT, PATH_NODES).toString();
    }

    /**
     * Pattern: /cluster-engine/nodes/<node-id>
     */
    public String getNodePath(String nodeId) {
        return Paths.get(getNodesPrefix(), nodeId).toString();
    }

    /**
     * Pattern: /cluster-engine/policies
     */
    public String getPoliciesPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ENGINE_ROOT, PATH_POLICIES).toString();
    }

    /**
     * Pattern: /cluster-engine/policies/<policy-id>
     */
    public String getPolicyPath(String policyId) {
        return Paths.get(getPoliciesPrefix(), policyId).toString();
    }

    /**
     * Pattern: /cluster-engine/action-locks
     */
    public String getActionLocksPrefix() {
        return Paths.get(PATH_DELIMITER, PATH_ENGINE_ROOT, PATH_ACTION_LOCKS).toString();
    }

    /**
     * Pattern: /cluster-engine/action-locks/<target-id>
     */
    public String getActionLockPath(String targetId) {
        return Paths.get(getActionLocksPrefix(), targetId).toString();
    }
}

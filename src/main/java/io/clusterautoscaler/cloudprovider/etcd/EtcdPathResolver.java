package io.clusterautoscaler.cloudprovider.etcd;

import java.nio.file.Paths;

import static io.clusterautoscaler.config.Constants.*;

/**
 * Centralized etcd path resolver for node pool and node records.
 * All methods accept the cluster name, so one resolver serves every cluster.
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

    // =================================================================
    // NODE POOL PATHS
    // =================================================================

    /**
     * Get prefix for all node pools
     * Pattern: /<cluster-name>/node-pools
     */
    public String getNodePoolsPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_NODE_POOLS).toString();
    }

    /**
     * Get node pool configuration path
     * Pattern: /<cluster-name>/node-pools/<pool-id>/conf
     */
    public String getNodePoolConfPath(String clusterName, String nodePoolId) {
        return Paths.get(getNodePoolsPrefix(clusterName), nodePoolId, SUFFIX_CONF).toString();
    }

    /**
     * Get node pool goal state path
     * Pattern: /<cluster-name>/node-pools/<pool-id>/goal-state
     */
    public String getNodePoolGoalStatePath(String clusterName, String nodePoolId) {
        return Paths.get(getNodePoolsPrefix(clusterName), nodePoolId, SUFFIX_GOAL_STATE).toString();
    }

    // =================================================================
    // NODE PATHS
    // =================================================================

    /**
     * Get prefix for all nodes
     * Pattern: /<cluster-name>/nodes
     */
    public String getNodesPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_NODES).toString();
    }

    // =================================================================
    // KEY PARSING
    // =================================================================

    /**
     * Extract the pool id from a key under the node pools prefix, or null if the key is not a pool record.
     * Example: /c1/node-pools/pool-a/conf -> pool-a
     */
    public String extractNodePoolId(String clusterName, String key) {
        String prefix = getNodePoolsPrefix(clusterName) + PATH_DELIMITER;
        if (key == null || !key.startsWith(prefix)) {
            return null;
        }
        String remainder = key.substring(prefix.length());
        int end = remainder.indexOf(PATH_DELIMITER);
        if (end <= 0) {
            return null;
        }
        return remainder.substring(0, end);
    }
}

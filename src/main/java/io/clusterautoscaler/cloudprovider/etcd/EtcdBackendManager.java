package io.clusterautoscaler.cloudprovider.etcd;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterautoscaler.cloudprovider.AutoscalingOptions;
import io.clusterautoscaler.cloudprovider.BackendSnapshot;
import io.clusterautoscaler.cloudprovider.CachedIndex;
import io.clusterautoscaler.cloudprovider.CachingBackendManager;
import io.clusterautoscaler.cloudprovider.NodeGroupDiscoveryOptions;
import io.clusterautoscaler.cloudprovider.NodeGroupSpec;
import io.clusterautoscaler.cloudprovider.errors.BackendException;
import io.clusterautoscaler.cloudprovider.errors.ConstructionException;
import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.NodePool;
import io.clusterautoscaler.models.NodePoolGoalState;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.options.GetOption;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.clusterautoscaler.config.Constants.*;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Backend manager reading node pools and node assignments from etcd.
 * <p>
 * Layout under {@code /<cluster>}: {@code node-pools/<id>/conf} holds the pool definition,
 * {@code node-pools/<id>/goal-state} the scale request written by this manager, and
 * {@code nodes/<name>} one record per provisioned node. Values are JSON.
 */
@Slf4j
public class EtcdBackendManager extends CachingBackendManager {

    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;
    private final String clusterName;
    private final long operationTimeoutSeconds;
    private final long cleanupTimeoutSeconds;

    EtcdBackendManager(Client etcdClient, KV kvClient, AutoscalingOptions options, Map<String, NodeGroupSpec> nodeGroupSpecs) {
        super(nodeGroupSpecs);
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = new ObjectMapper();
        this.clusterName = options.getClusterName();
        this.operationTimeoutSeconds = options.getEtcdOperationTimeoutSeconds();
        this.cleanupTimeoutSeconds = options.getCleanupTimeoutSeconds();

        log.info("EtcdBackendManager initialized for cluster {} ({} static node group specs)",
                clusterName, nodeGroupSpecs.size());
    }

    /**
     * Create a manager connected to the configured etcd endpoints.
     */
    public static EtcdBackendManager create(AutoscalingOptions options, NodeGroupDiscoveryOptions discoveryOptions)
            throws ConstructionException {
        if (options.getEtcdEndpoints().isEmpty()) {
            throw new ConstructionException("No etcd endpoints configured for cloud provider " + EtcdCloudProvider.PROVIDER_NAME);
        }
        if (options.getClusterName() == null || options.getClusterName().isBlank()) {
            throw new ConstructionException("Cluster name must be set for cloud provider " + EtcdCloudProvider.PROVIDER_NAME);
        }

        Map<String, NodeGroupSpec> specs;
        try {
            specs = discoveryOptions.parseSpecs();
        } catch (IllegalArgumentException e) {
            throw new ConstructionException("Invalid node group specs: " + e.getMessage(), e);
        }

        try {
            Client client = Client.builder()
                    .endpoints(options.getEtcdEndpoints().toArray(new String[0]))
                    .build();
            log.info("Created etcd client for endpoints: {}", String.join(",", options.getEtcdEndpoints()));
            return new EtcdBackendManager(client, client.getKVClient(), options, specs);
        } catch (Exception e) {
            throw new ConstructionException("Failed to create etcd client: " + e.getMessage(), e);
        }
    }

    // =================================================================
    // REFRESH
    // =================================================================

    @Override
    protected BackendSnapshot fetchSnapshot() throws Exception {
        log.debug("Fetching node pools and nodes for cluster {} from etcd", clusterName);

        List<NodePool> nodePools = new ArrayList<>();
        Map<String, NodePoolGoalState> goalStates = new HashMap<>();
        GetResponse poolsResponse = executeEtcdPrefixQuery(pathResolver.getNodePoolsPrefix(clusterName));
        for (KeyValue kv : poolsResponse.getKvs()) {
            String key = kv.getKey().toString(UTF_8);
            String nodePoolId = pathResolver.extractNodePoolId(clusterName, key);
            if (nodePoolId == null) {
                log.debug("Skipping unrecognized node pool key {}", key);
            } else if (key.equals(pathResolver.getNodePoolConfPath(clusterName, nodePoolId))) {
                NodePool nodePool = readValue(key, kv, NodePool.class);
                // The key decides the id; goal state and scale writes are addressed by it
                if (nodePool.getId() != null && !nodePool.getId().isBlank() && !nodePool.getId().equals(nodePoolId)) {
                    log.warn("Node pool record at {} has id {}, using {} from the key", key, nodePool.getId(), nodePoolId);
                }
                nodePool.setId(nodePoolId);
                nodePools.add(nodePool);
            } else if (key.equals(pathResolver.getNodePoolGoalStatePath(clusterName, nodePoolId))) {
                goalStates.put(nodePoolId, readValue(key, kv, NodePoolGoalState.class));
            } else {
                log.debug("Skipping unrecognized node pool key {}", key);
            }
        }

        List<BackendNode> nodes = new ArrayList<>();
        GetResponse nodesResponse = executeEtcdPrefixQuery(pathResolver.getNodesPrefix(clusterName));
        for (KeyValue kv : nodesResponse.getKvs()) {
            nodes.add(readValue(kv.getKey().toString(UTF_8), kv, BackendNode.class));
        }

        log.debug("Fetched {} node pools, {} goal states and {} nodes from etcd",
                nodePools.size(), goalStates.size(), nodes.size());
        return new BackendSnapshot(nodePools, goalStates, nodes);
    }

    // =================================================================
    // SCALE REQUESTS
    // =================================================================

    @Override
    public void setTargetSize(String nodePoolId, int targetSize) throws BackendException {
        String path = pathResolver.getNodePoolGoalStatePath(clusterName, nodePoolId);
        try {
            NodePoolGoalState goalState = getObjectByPath(path, NodePoolGoalState.class)
                    .orElseGet(NodePoolGoalState::new);
            goalState.setTargetSize(targetSize);
            goalState.setLastUpdated(OffsetDateTime.now(ZoneOffset.UTC).toString());
            storeObjectAsJson(path, goalState);
            log.info("Set target size of node pool {} to {}", nodePoolId, targetSize);
        } catch (Exception e) {
            log.error("Failed to set target size of node pool {}: {}", nodePoolId, e.getMessage(), e);
            throw new BackendException("Failed to set target size of node pool " + nodePoolId, e);
        }
    }

    @Override
    public void deleteNodes(String nodePoolId, List<String> nodeNames) throws BackendException {
        CachedIndex.PoolEntry entry = currentIndex().pool(nodePoolId)
                .orElseThrow(() -> new BackendException("Unknown node pool " + nodePoolId));
        String path = pathResolver.getNodePoolGoalStatePath(clusterName, nodePoolId);
        try {
            NodePoolGoalState goalState = getObjectByPath(path, NodePoolGoalState.class)
                    .orElseGet(NodePoolGoalState::new);
            Set<String> pending = new LinkedHashSet<>();
            if (goalState.getNodesToDelete() != null) {
                pending.addAll(goalState.getNodesToDelete());
            }
            int newlyPending = 0;
            for (String nodeName : nodeNames) {
                if (pending.add(nodeName)) {
                    newlyPending++;
                }
            }
            // Nodes already pending were subtracted when first requested
            int currentTarget = goalState.getTargetSize() != null ? goalState.getTargetSize() : entry.getTargetSize();
            goalState.setNodesToDelete(new ArrayList<>(pending));
            goalState.setTargetSize(currentTarget - newlyPending);
            goalState.setLastUpdated(OffsetDateTime.now(ZoneOffset.UTC).toString());
            storeObjectAsJson(path, goalState);
            log.info("Requested deletion of nodes {} from node pool {}, new target size {}",
                    nodeNames, nodePoolId, goalState.getTargetSize());
        } catch (Exception e) {
            log.error("Failed to delete nodes from node pool {}: {}", nodePoolId, e.getMessage(), e);
            throw new BackendException("Failed to delete nodes from node pool " + nodePoolId, e);
        }
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    @Override
    protected void closeBackend() throws Exception {
        log.info("Closing etcd client");
        try {
            CompletableFuture.runAsync(etcdClient::close).get(cleanupTimeoutSeconds, TimeUnit.SECONDS);
            log.info("etcd client closed successfully");
        } catch (TimeoutException e) {
            throw new Exception("Timed out after " + cleanupTimeoutSeconds + "s closing etcd client", e);
        }
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Trailing slash so that /c1/nodes does not also match /c1/nodes-archive
        ByteSequence prefixBytes = ByteSequence.from(prefix + PATH_DELIMITER, UTF_8);
        return kvClient.get(
                prefixBytes,
                GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    private GetResponse executeEtcdGet(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, UTF_8);
        return kvClient.get(keyBytes).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    private void executeEtcdPut(String key, String value) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, UTF_8);
        ByteSequence valueBytes = ByteSequence.from(value, UTF_8);
        kvClient.put(keyBytes, valueBytes).get(operationTimeoutSeconds, TimeUnit.SECONDS);
    }

    private <T> T readValue(String key, KeyValue kv, Class<T> clazz) throws Exception {
        String json = kv.getValue().toString(UTF_8);
        try {
            return objectMapper.readValue(json, clazz);
        } catch (Exception e) {
            throw new Exception("Malformed " + clazz.getSimpleName() + " record at " + key + ": " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> getObjectByPath(String path, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdGet(path);
        if (response.getCount() == 0) {
            return Optional.empty();
        }
        return Optional.of(readValue(path, response.getKvs().get(0), clazz));
    }

    private void storeObjectAsJson(String path, Object object) throws Exception {
        String json = objectMapper.writeValueAsString(object);
        executeEtcdPut(path, json);
    }
}

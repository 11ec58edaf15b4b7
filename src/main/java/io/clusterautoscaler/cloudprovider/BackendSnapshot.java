package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.models.BackendNode;
import io.clusterautoscaler.models.NodePool;
import io.clusterautoscaler.models.NodePoolGoalState;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw backend state fetched during one refresh, before discovery filtering.
 */
@Value
public class BackendSnapshot {
    List<NodePool> nodePools;
    Map<String, NodePoolGoalState> goalStates;
    List<BackendNode> nodes;
}

package io.clusterautoscaler.api.handlers;

import io.clusterautoscaler.api.models.responses.ErrorResponse;
import io.clusterautoscaler.api.models.responses.NodeGroupListResponse;
import io.clusterautoscaler.api.models.responses.NodeGroupResponse;
import io.clusterautoscaler.cloudprovider.CloudProvider;
import io.clusterautoscaler.cloudprovider.NodeGroup;
import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.models.Node;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only REST API over the cloud provider's current snapshot.
 *
 * Supported operations:
 * - GET /node-groups - All node groups with provider name and cache generation
 * - GET /node-groups/{nodeGroupId} - A single node group
 * - GET /nodes/{nodeName}/node-group - The node group owning a node
 */
@Slf4j
@RestController
public class NodeGroupHandler {

    private final CloudProvider cloudProvider;

    public NodeGroupHandler(CloudProvider cloudProvider) {
        this.cloudProvider = cloudProvider;
    }

    @GetMapping("/node-groups")
    public ResponseEntity<Object> listNodeGroups() {
        try {
            long generation = cloudProvider.generation();
            List<NodeGroupResponse> nodeGroups = cloudProvider.nodeGroups().stream()
                    .map(NodeGroupResponse::from)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(new NodeGroupListResponse(cloudProvider.name(), generation, nodeGroups));
        } catch (Exception e) {
            log.error("Error listing node groups: {}", e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/node-groups/{nodeGroupId}")
    public ResponseEntity<Object> getNodeGroup(@PathVariable String nodeGroupId) {
        try {
            Optional<NodeGroup> nodeGroup = cloudProvider.nodeGroups().stream()
                    .filter(group -> group.id().equals(nodeGroupId))
                    .findFirst();
            if (nodeGroup.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.notFound("Node group '" + nodeGroupId + "'"));
            }
            return ResponseEntity.ok(NodeGroupResponse.from(nodeGroup.get()));
        } catch (Exception e) {
            log.error("Error getting node group '{}': {}", nodeGroupId, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    @GetMapping("/nodes/{nodeName}/node-group")
    public ResponseEntity<Object> getNodeGroupForNode(@PathVariable String nodeName) {
        try {
            Optional<NodeGroup> nodeGroup = cloudProvider.nodeGroupForNode(Node.named(nodeName));
            if (nodeGroup.isEmpty()) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ErrorResponse.notFound("Managed node '" + nodeName + "'"));
            }
            return ResponseEntity.ok(NodeGroupResponse.from(nodeGroup.get()));
        } catch (DataIntegrityException e) {
            log.warn("Node '{}' has an inconsistent backend record: {}", nodeName, e.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.conflict(e.getKind().name(), e.getMessage()));
        } catch (Exception e) {
            log.error("Error resolving node group for node '{}': {}", nodeName, e.getMessage(), e);
            return ResponseEntity.status(500).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}

package io.clusterautoscaler.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterautoscaler.cloudprovider.NodeGroup;
import io.clusterautoscaler.cloudprovider.errors.DataIntegrityException;
import io.clusterautoscaler.models.BackendNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeGroupResponse {

    @JsonProperty("id")
    private String id;

    @JsonProperty("min_size")
    private int minSize;

    @JsonProperty("max_size")
    private int maxSize;

    // Null when the group left the snapshot between listing and reading
    @JsonProperty("target_size")
    private Integer targetSize;

    @JsonProperty("nodes")
    private List<String> nodes;

    public static NodeGroupResponse from(NodeGroup nodeGroup) {
        Integer targetSize;
        try {
            targetSize = nodeGroup.targetSize();
        } catch (DataIntegrityException e) {
            targetSize = null;
        }
        return NodeGroupResponse.builder()
            .id(nodeGroup.id())
            .minSize(nodeGroup.minSize())
            .maxSize(nodeGroup.maxSize())
            .targetSize(targetSize)
            .nodes(nodeGroup.nodes().stream().map(BackendNode::getNodeName).collect(Collectors.toList()))
            .build();
    }
}

package io.clusterautoscaler.api.models.responses;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeGroupListResponse {

    @JsonProperty("provider")
    private String provider;

    @JsonProperty("generation")
    private long generation;

    @JsonProperty("node_groups")
    private List<NodeGroupResponse> nodeGroups;
}

package io.clusterautoscaler.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Scale request for a pool, written by the autoscaler and consumed by the backend provisioner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodePoolGoalState {

    @JsonProperty("target_size")
    private Integer targetSize;

    @JsonProperty("nodes_to_delete")
    @Builder.Default
    private List<String> nodesToDelete = new ArrayList<>();

    @JsonProperty("last_updated")
    private String lastUpdated;
}

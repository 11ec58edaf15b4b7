package io.clusterautoscaler.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Backend record of a node and the pool it was provisioned from.
 * The pool id may be empty when the backend lost or never recorded the assignment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendNode {

    @JsonProperty("id")
    private String id;

    @JsonProperty("node_name")
    private String nodeName;

    @JsonProperty("node_pool_id")
    private String nodePoolId;

    @JsonProperty("provider_id")
    private String providerId;

    public boolean hasNodePool() {
        return nodePoolId != null && !nodePoolId.isBlank();
    }
}

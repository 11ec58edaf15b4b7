package io.clusterautoscaler.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A cluster member as observed by the autoscaling control loop.
 * The name is the stable identity used to look the node up in the backend cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Node {

    @JsonProperty("name")
    private String name;

    @JsonProperty("provider_id")
    private String providerId;

    @JsonProperty("labels")
    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    public static Node named(String name) {
        return Node.builder().name(name).build();
    }
}

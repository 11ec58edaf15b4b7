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
 * Pool configuration as stored in the backend.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodePool {

    @JsonProperty("id")
    private String id;

    @JsonProperty("min_size")
    private int minSize;

    @JsonProperty("max_size")
    private int maxSize;

    @JsonProperty("machine_type")
    private String machineType;

    @JsonProperty("labels")
    @Builder.Default
    private Map<String, String> labels = new HashMap<>();
}

package io.clusterautoscaler.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Taint {

    @JsonProperty("key")
    private String key;

    @JsonProperty("value")
    private String value;

    // NoSchedule, PreferNoSchedule or NoExecute
    @JsonProperty("effect")
    private String effect;
}

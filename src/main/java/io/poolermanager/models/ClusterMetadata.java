package io.poolermanager.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterMetadata {

    @JsonProperty("name")
    private String name;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("annotations")
    private Map<String, String> annotations = new LinkedHashMap<>();

    public void setAnnotations(Map<String, String> annotations) {
        this.annotations = annotations != null ? annotations : new LinkedHashMap<>();
    }
}

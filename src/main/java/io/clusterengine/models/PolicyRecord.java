package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored policy: a type name plus the spec document the policy object is built from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PolicyRecord {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type;

    @JsonProperty("spec")
    private Map<String, Object> spec = new LinkedHashMap<>();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;
}

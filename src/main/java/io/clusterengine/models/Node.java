package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.NodeStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Node record as kept in the target registry. A null cluster id marks an orphan node.
 */
@Data
@NoArgsConstructor
public class Node {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("profile_id")
    private String profileId;

    @JsonProperty("status")
    private NodeStatus status = NodeStatus.INIT;

    @JsonProperty("created_at")
    private OffsetDateTime createdAt;

    @JsonProperty("index")
    private int index;

    @JsonProperty("profile_version_index")
    private int profileVersionIndex;

    public Node(String id, String clusterId, String profileId, OffsetDateTime createdAt) {
        this.id = id;
        this.name = id;
        this.clusterId = clusterId;
        this.profileId = profileId;
        this.createdAt = createdAt;
    }

    public Node copy() {
        Node copy = new Node(id, clusterId, profileId, createdAt);
        copy.setName(name);
        copy.setStatus(status);
        copy.setIndex(index);
        copy.setProfileVersionIndex(profileVersionIndex);
        return copy;
    }
}

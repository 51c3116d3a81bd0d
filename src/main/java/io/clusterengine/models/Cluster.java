package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ClusterStatus;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Cluster record as kept in the target registry.
 */
@Data
@NoArgsConstructor
public class Cluster {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("profile_id")
    private String profileId;

    @JsonProperty("desired_capacity")
    private int desiredCapacity;

    @JsonProperty("min_size")
    private int minSize;

    // Negative means unbounded
    @JsonProperty("max_size")
    private int maxSize = -1;

    @JsonProperty("status")
    private ClusterStatus status = ClusterStatus.INIT;

    @JsonProperty("status_reason")
    private String statusReason;

    @JsonProperty("bindings")
    private List<PolicyBinding> bindings = new ArrayList<>();

    @JsonProperty("node_ids")
    private Set<String> nodeIds = new LinkedHashSet<>();

    @JsonProperty("created_at")
    private OffsetDateTime createdAt = OffsetDateTime.now();

    public Cluster(String id, String profileId, int desiredCapacity, int minSize, int maxSize) {
        this.id = id;
        this.name = id;
        this.profileId = profileId;
        this.desiredCapacity = desiredCapacity;
        this.minSize = minSize;
        this.maxSize = maxSize;
    }

    /**
     * Deep copy, so registry callers never share mutable collections.
     */
    public Cluster copy() {
        Cluster copy = new Cluster(id, profileId, desiredCapacity, minSize, maxSize);
        copy.setName(name);
        copy.setStatus(status);
        copy.setStatusReason(statusReason);
        copy.setCreatedAt(createdAt);
        copy.setNodeIds(new LinkedHashSet<>(nodeIds));
        List<PolicyBinding> bindingCopies = new ArrayList<>();
        for (PolicyBinding binding : bindings) {
            bindingCopies.add(binding.toBuilder().build());
        }
        copy.setBindings(bindingCopies);
        return copy;
    }

    /**
     * Whether the given capacity lies within [min_size, max_size].
     */
    public boolean isWithinBounds(int capacity) {
        if (capacity < minSize) {
            return false;
        }
        return maxSize < 0 || capacity <= maxSize;
    }

    /**
     * Enabled and disabled bindings in evaluation order: priority ascending, then attach order.
     */
    @JsonIgnore
    public List<PolicyBinding> getOrderedBindings() {
        return bindings.stream()
                .sorted(Comparator.comparingInt(PolicyBinding::getPriority)
                        .thenComparing(PolicyBinding::getAttachedAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public Optional<PolicyBinding> findBinding(String policyId) {
        return bindings.stream().filter(b -> b.getPolicyId().equals(policyId)).findFirst();
    }
}

package io.clusterengine.lock;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Represents an exclusive execution right over a target held by one action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionLock {

    @JsonProperty("target_id")
    private String targetId;

    @JsonProperty("action_id")
    private String actionId;

    @JsonProperty("worker_id")
    private String workerId;

    @JsonProperty("acquired_at")
    private OffsetDateTime acquiredAt;

    public boolean isOwnedBy(String candidateActionId) {
        return actionId != null && actionId.equals(candidateActionId);
    }
}

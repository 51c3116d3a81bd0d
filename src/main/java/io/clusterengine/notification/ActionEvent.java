package io.clusterengine.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ActionType;
import io.clusterengine.models.Action;
import io.clusterengine.models.ActionError;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Emitted whenever an action changes status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionEvent {

    @JsonProperty("action_id")
    private String actionId;

    @JsonProperty("action_type")
    private ActionType actionType;

    @JsonProperty("target_id")
    private String targetId;

    @JsonProperty("parent_id")
    private String parentId;

    @JsonProperty("status")
    private ActionStatus status;

    @JsonProperty("status_reason")
    private String statusReason;

    @JsonProperty("error")
    private ActionError error;

    @JsonProperty("timestamp")
    private OffsetDateTime timestamp;

    public static ActionEvent of(Action action) {
        return ActionEvent.builder()
                .actionId(action.getId())
                .actionType(action.getType())
                .targetId(action.getTargetId())
                .parentId(action.getParentId())
                .status(action.getStatus())
                .statusReason(action.getStatusReason())
                .error(action.getError())
                .timestamp(OffsetDateTime.now())
                .build();
    }
}

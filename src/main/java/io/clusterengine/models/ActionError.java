package io.clusterengine.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusterengine.enums.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Structured reason recorded on an action that ended in FAILED or CANCELLED.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionError {

    @JsonProperty("type")
    private ErrorType type;

    @JsonProperty("message")
    private String message;

    // Set only for POLICY_REJECTED
    @JsonProperty("policy_id")
    private String policyId;

    public static ActionError of(ErrorType type, String message) {
        return new ActionError(type, message, null);
    }
}

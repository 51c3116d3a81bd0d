package io.clusterengine.policies;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.PolicyPhase;
import io.clusterengine.models.PolicyCheck;
import io.clusterengine.models.PolicyRecord;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Common state of the built-in policies plus spec document parsing.
 */
@Getter
public abstract class BasePolicy implements Policy {

    private static final ObjectMapper SPEC_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    private final String id;
    private final String name;
    private final String type;

    protected BasePolicy(PolicyRecord record) {
        this.id = record.getId();
        this.name = record.getName();
        this.type = record.getType();
    }

    /**
     * Action types this policy hooks before the body runs.
     */
    protected Set<ActionType> preTargets() {
        return Collections.emptySet();
    }

    /**
     * Action types this policy hooks after a successful body.
     */
    protected Set<ActionType> postTargets() {
        return Collections.emptySet();
    }

    @Override
    public boolean supports(ActionType actionType, PolicyPhase phase) {
        return phase == PolicyPhase.PRE ? preTargets().contains(actionType) : postTargets().contains(actionType);
    }

    @Override
    public PolicyCheck preOp(PolicyContext context) {
        return PolicyCheck.ok();
    }

    @Override
    public PolicyCheck postOp(PolicyContext context) {
        return PolicyCheck.ok();
    }

    /**
     * Maps a spec document onto its typed form. Unknown keys and values of the wrong type are
     * rejected.
     */
    protected static <T> T parseSpec(Map<String, Object> spec, Class<T> specClass) throws InvalidPolicyConfigException {
        try {
            return SPEC_MAPPER.convertValue(spec != null ? spec : Collections.emptyMap(), specClass);
        } catch (IllegalArgumentException e) {
            throw new InvalidPolicyConfigException("Invalid " + specClass.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return type + "[" + id + ", " + name + "]";
    }
}

package io.clusterengine.models;

import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.ActionType;
import io.clusterengine.enums.TargetKind;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of requested work against a cluster or node target.
 *
 * Status, owner and the cancel flag may be touched by the caller and by the owning worker
 * concurrently; everything else is written only by the worker currently executing the action.
 */
public class Action {

    @Getter private final String id;
    @Getter private final ActionType type;
    @Getter private final String targetId;
    @Getter private final TargetKind targetKind;
    @Getter private final String parentId;
    @Getter private final long timeoutSeconds;
    @Getter private final OffsetDateTime createdAt;

    @Getter private final Map<String, Object> inputs;
    @Getter private final Map<String, Object> outputs;
    @Getter private final List<PolicyResult> policyResults = new CopyOnWriteArrayList<>();

    private final AtomicReference<ActionStatus> statusRef = new AtomicReference<>(ActionStatus.INIT);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicInteger attempts = new AtomicInteger(0);

    @Getter private volatile String owner;
    @Getter private volatile OffsetDateTime startedAt;
    @Getter private volatile OffsetDateTime endedAt;
    @Getter private volatile String statusReason;
    @Getter private volatile ActionError error;

    public Action(ActionType type, String targetId, Map<String, Object> inputs) {
        this(UUID.randomUUID().toString(), type, targetId, inputs, null, 0L);
    }

    public Action(String id, ActionType type, String targetId, Map<String, Object> inputs,
                  String parentId, long timeoutSeconds) {
        if (type == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Action target is required");
        }
        this.id = id;
        this.type = type;
        this.targetId = targetId;
        this.targetKind = type.getTargetKind();
        this.parentId = parentId;
        this.timeoutSeconds = Math.max(0L, timeoutSeconds);
        this.createdAt = OffsetDateTime.now();
        this.inputs = Collections.synchronizedMap(new LinkedHashMap<>());
        this.outputs = Collections.synchronizedMap(new LinkedHashMap<>());
        if (inputs != null) {
            this.inputs.putAll(inputs);
        }
    }

    public static Action of(ActionType type, String targetId) {
        return new Action(type, targetId, null);
    }

    public static Action of(ActionType type, String targetId, Map<String, Object> inputs) {
        return new Action(type, targetId, inputs);
    }

    /**
     * Creates an action derived from this one (e.g. a deferred node destroy).
     */
    public Action derive(ActionType childType, String childTarget, Map<String, Object> childInputs) {
        return new Action(UUID.randomUUID().toString(), childType, childTarget, childInputs, id, 0L);
    }

    public ActionStatus getStatus() {
        return statusRef.get();
    }

    public boolean isTerminal() {
        return statusRef.get().isTerminal();
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Flags the action for cooperative cancellation.
     *
     * @return true if this call set the flag
     */
    public boolean requestCancel() {
        return cancelRequested.compareAndSet(false, true);
    }

    public int getAttempts() {
        return attempts.get();
    }

    public int incrementAttempts() {
        return attempts.incrementAndGet();
    }

    /**
     * Atomically moves the action from {@code expected} to {@code next}.
     * Terminal states are final: no transition out of them is ever accepted.
     *
     * @return false if the current status is not {@code expected}
     */
    public boolean transition(ActionStatus expected, ActionStatus next) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal action transition " + expected + " -> " + next + " for " + id);
        }
        if (!statusRef.compareAndSet(expected, next)) {
            return false;
        }
        OffsetDateTime now = OffsetDateTime.now();
        if (next == ActionStatus.RUNNING) {
            startedAt = now;
        } else if (next.isTerminal()) {
            endedAt = now;
        }
        return true;
    }

    /**
     * Moves a not-yet-running action straight to a terminal state.
     */
    public boolean finishBeforeStart(ActionStatus terminal, String reason, ActionError error) {
        for (ActionStatus from : new ActionStatus[]{ActionStatus.INIT, ActionStatus.WAITING}) {
            if (transition(from, terminal)) {
                this.statusReason = reason;
                this.error = error;
                return true;
            }
        }
        return false;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public void setStatusReason(String statusReason) {
        this.statusReason = statusReason;
    }

    public void setError(ActionError error) {
        this.error = error;
    }

    public void addPolicyResults(Collection<PolicyResult> results) {
        policyResults.addAll(results);
    }

    // ---------------------------------------------------------------
    // Typed input helpers
    // ---------------------------------------------------------------

    public Object getInput(String key) {
        return inputs.get(key);
    }

    public void putInput(String key, Object value) {
        inputs.put(key, value);
    }

    public boolean hasInput(String key) {
        return inputs.containsKey(key) && inputs.get(key) != null;
    }

    public int getIntInput(String key, int defaultValue) {
        Object value = inputs.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Input '" + key + "' is not an integer: " + value, e);
        }
    }

    public boolean getBooleanInput(String key, boolean defaultValue) {
        Object value = inputs.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    public String getStringInput(String key) {
        Object value = inputs.get(key);
        return value != null ? value.toString() : null;
    }

    public List<String> getStringListInput(String key) {
        Object value = inputs.get(key);
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof Collection) {
            List<String> result = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        throw new IllegalArgumentException("Input '" + key + "' is not a list: " + value);
    }

    public void putOutput(String key, Object value) {
        outputs.put(key, value);
    }

    public Object getOutput(String key) {
        return outputs.get(key);
    }

    @Override
    public String toString() {
        return type + "[" + id + "] on " + targetKind + " " + targetId + " (" + getStatus() + ")";
    }
}

package io.clusterengine.metrics;

/**
 * Metric names and tags emitted by the cluster engine.
 */
public class MetricsConstants {
    public final static String ACTIONS_SUBMITTED_METRIC_NAME = "engine_actions_submitted";
    public final static String ACTIONS_COMPLETED_METRIC_NAME = "engine_actions_completed";
    public final static String ACTION_DURATION_METRIC_NAME = "engine_action_duration";
    public final static String LOCK_BUSY_RETRIES_METRIC_NAME = "engine_lock_busy_retries";
    public final static String INCONSISTENT_LOCK_RELEASES_METRIC_NAME = "engine_inconsistent_lock_releases";
    public final static String POLICY_REJECTIONS_METRIC_NAME = "engine_policy_rejections";
    public final static String PENDING_ACTIONS_METRIC_NAME = "engine_pending_actions";
    public final static String DEFERRED_ACTIONS_METRIC_NAME = "engine_deferred_actions";
    public final static String ACTION_TYPE_TAG = "actionType";
    public final static String STATUS_TAG = "status";
    public final static String POLICY_TYPE_TAG = "policyType";

    private MetricsConstants() {}
}

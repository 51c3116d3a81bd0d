package io.clusterengine.dispatcher;

import io.clusterengine.actions.ActionContext;
import io.clusterengine.actions.ActionHandler;
import io.clusterengine.actions.ActionHandlerFactory;
import io.clusterengine.config.EngineConfig;
import io.clusterengine.driver.Driver;
import io.clusterengine.driver.DriverException;
import io.clusterengine.enums.ActionStatus;
import io.clusterengine.enums.CheckStatus;
import io.clusterengine.enums.ErrorType;
import io.clusterengine.enums.PolicyPhase;
import io.clusterengine.lock.ActionLockManager;
import io.clusterengine.lock.InconsistentLockReleaseException;
import io.clusterengine.lock.LockBusyException;
import io.clusterengine.metrics.MetricsProvider;
import io.clusterengine.models.Action;
import io.clusterengine.models.ActionError;
import io.clusterengine.models.PolicyResult;
import io.clusterengine.notification.ActionEvent;
import io.clusterengine.notification.NotificationSink;
import io.clusterengine.policies.InvalidPolicyConfigException;
import io.clusterengine.policies.PolicyEngine;
import io.clusterengine.policies.PolicyManager;
import io.clusterengine.policies.PolicyRejectedException;
import io.clusterengine.store.TargetNotFoundException;
import io.clusterengine.store.TargetRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static io.clusterengine.config.Constants.OUTPUT_POLICY_WARNINGS;
import static io.clusterengine.metrics.MetricsConstants.*;

/**
 * Runs submitted actions on a fixed pool of workers.
 *
 * Pending actions wait in a delay queue ordered by ready time, then by enqueue order. Each
 * target also has a FIFO line of its unfinished actions, and only the action at the head of
 * a line may try the target's lock, so actions on one target run in submission order. An
 * action that cannot start yet is put back with exponential backoff until its retries run
 * out.
 *
 * A worker that holds the lock runs PRE policies, the handler body and POST policies, then
 * releases the lock and records the terminal status. Cancellation is cooperative: the flag is
 * checked before the lock is taken and at every checkpoint of the body.
 */
@Slf4j
public class ActionDispatcher implements DeferredActionScheduler {

    private static final long POLL_INTERVAL_MILLIS = 100L;
    private static final long DRAIN_POLL_MILLIS = 20L;

    private enum State { NEW, RUNNING, STOPPING, STOPPED }

    private final String engineId;
    private final int workerCount;
    private final int lockMaxRetries;
    private final long lockRetryBaseMillis;
    private final long lockRetryMaxMillis;
    private final long drainTimeoutSeconds;
    private final Duration retention;
    private final long purgeIntervalSeconds;

    private final TargetRegistry registry;
    private final ActionLockManager lockManager;
    private final PolicyEngine policyEngine;
    private final ActionHandlerFactory handlers;
    private final ActionContext context;
    private final NotificationSink notifier;
    private final MetricsProvider metrics;

    private final ConcurrentMap<String, Action> actions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<Action>> completions = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final DelayQueue<PendingAction> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    // target id -> ids of its unfinished submitted actions, in submission order
    private final Map<String, Deque<String>> lines = new HashMap<>();

    // parent action id -> deferred children and their timers
    private final ConcurrentMap<String, List<Action>> deferredChildren = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<ScheduledFuture<?>>> deferredTimers = new ConcurrentHashMap<>();

    private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
    private ExecutorService workers;
    private final ScheduledExecutorService timers;

    public ActionDispatcher(EngineConfig config,
                            TargetRegistry registry,
                            ActionLockManager lockManager,
                            PolicyEngine policyEngine,
                            PolicyManager policyManager,
                            Driver driver,
                            NotificationSink notifier,
                            MetricsProvider metrics) {
        this(config, registry, lockManager, policyEngine, policyManager, driver, notifier, metrics, new ActionHandlerFactory());
    }

    public ActionDispatcher(EngineConfig config,
                            TargetRegistry registry,
                            ActionLockManager lockManager,
                            PolicyEngine policyEngine,
                            PolicyManager policyManager,
                            Driver driver,
                            NotificationSink notifier,
                            MetricsProvider metrics,
                            ActionHandlerFactory handlers) {
        this.engineId = config.getEngineId();
        this.workerCount = config.getWorkerCount();
        this.lockMaxRetries = config.getLockMaxRetries();
        this.lockRetryBaseMillis = config.getLockRetryBaseMillis();
        this.lockRetryMaxMillis = config.getLockRetryMaxMillis();
        this.drainTimeoutSeconds = config.getDrainTimeoutSeconds();
        this.retention = Duration.ofMinutes(config.getActionRetentionMinutes());
        this.purgeIntervalSeconds = config.getPurgeIntervalSeconds();
        this.registry = registry;
        this.lockManager = lockManager;
        this.policyEngine = policyEngine;
        this.handlers = handlers;
        this.notifier = notifier;
        this.metrics = metrics;
        this.context = new ActionContext(registry, lockManager, driver, policyManager, this,
                config.getLockMaxRetries(), config.getLockRetryBaseMillis());

        this.timers = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName(engineId + "-timer-" + t.getId());
            t.setDaemon(true);
            return t;
        });

        metrics.gauge(PENDING_ACTIONS_METRIC_NAME, Map.of());
        metrics.gauge(DEFERRED_ACTIONS_METRIC_NAME, Map.of());
    }

    // =================================================================
    // LIFECYCLE
    // =================================================================

    public void start() {
        if (!state.compareAndSet(State.NEW, State.RUNNING)) {
            throw new IllegalStateException("Dispatcher already started");
        }
        workers = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r);
            t.setName(engineId + "-worker-" + t.getId());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < workerCount; i++) {
            String workerId = engineId + "-worker-" + i;
            workers.execute(() -> workerLoop(workerId));
        }
        timers.scheduleAtFixedRate(this::purgeSafely, purgeIntervalSeconds, purgeIntervalSeconds, TimeUnit.SECONDS);
        log.info("Dispatcher {} started with {} workers", engineId, workerCount);
    }

    /**
     * Stops accepting actions, lets pending ones finish for up to the drain timeout, then
     * cancels whatever is left. Deferred timers that have not fired are dropped and their
     * actions end CANCELLED.
     */
    public void shutdown() {
        State previous = state.getAndUpdate(s -> s == State.RUNNING ? State.STOPPING : s);
        if (previous == State.NEW) {
            state.set(State.STOPPED);
            timers.shutdownNow();
            return;
        }
        if (previous != State.RUNNING) {
            return;
        }
        log.info("Dispatcher {} shutting down, draining {} action(s)", engineId, inFlight.size());

        int dropped = 0;
        for (List<ScheduledFuture<?>> futures : deferredTimers.values()) {
            for (ScheduledFuture<?> future : futures) {
                if (future.cancel(false)) {
                    dropped++;
                }
            }
        }
        if (dropped > 0) {
            log.warn("Dropped {} deferred action timer(s) on shutdown; affected nodes stay orphaned", dropped);
        }
        timers.shutdownNow();
        for (List<Action> children : deferredChildren.values()) {
            for (Action child : children) {
                if (!child.isTerminal() && !inFlight.contains(child.getId())) {
                    cancelAction(child, "Engine shutting down");
                }
            }
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(drainTimeoutSeconds);
        waitForInFlight(deadline);

        if (!inFlight.isEmpty()) {
            log.warn("Drain timeout reached, cancelling {} action(s)", inFlight.size());
            for (String actionId : new ArrayList<>(inFlight)) {
                Action action = actions.get(actionId);
                if (action != null) {
                    cancelAction(action, "Cancelled by engine shutdown");
                }
            }
            waitForInFlight(System.nanoTime() + TimeUnit.SECONDS.toNanos(drainTimeoutSeconds));
        }

        state.set(State.STOPPED);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(drainTimeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Workers did not terminate in time, forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        log.info("Dispatcher {} stopped", engineId);
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    private void waitForInFlight(long deadlineNanos) {
        while (!inFlight.isEmpty() && System.nanoTime() - deadlineNanos < 0) {
            try {
                Thread.sleep(DRAIN_POLL_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    // =================================================================
    // SUBMISSION AND QUERIES
    // =================================================================

    /**
     * Queues an action for execution.
     *
     * @throws RejectedExecutionException if the dispatcher is not running
     */
    public Action submit(Action action) {
        if (state.get() != State.RUNNING) {
            throw new RejectedExecutionException("Dispatcher " + engineId + " is not accepting actions (" + state.get() + ")");
        }
        if (actions.putIfAbsent(action.getId(), action) != null) {
            throw new IllegalArgumentException("Action " + action.getId() + " was already submitted");
        }
        completions.putIfAbsent(action.getId(), new CompletableFuture<>());
        enqueue(action);
        metrics.counter(ACTIONS_SUBMITTED_METRIC_NAME, Map.of(ACTION_TYPE_TAG, action.getType().name())).increment();
        return action;
    }

    public Optional<Action> getAction(String actionId) {
        return Optional.ofNullable(actions.get(actionId));
    }

    /**
     * Known actions, oldest first.
     */
    public List<Action> listActions() {
        return actions.values().stream()
                .sorted(Comparator.comparing(Action::getCreatedAt))
                .collect(Collectors.toList());
    }

    public List<Action> listActions(String targetId) {
        return listActions().stream()
                .filter(a -> a.getTargetId().equals(targetId))
                .collect(Collectors.toList());
    }

    /**
     * Completes when the action reaches a terminal status.
     *
     * @throws TargetNotFoundException if the action is unknown
     */
    public CompletableFuture<Action> whenTerminal(String actionId) {
        CompletableFuture<Action> completion = completions.get(actionId);
        if (completion == null) {
            throw new TargetNotFoundException("Action", actionId);
        }
        return completion;
    }

    /**
     * Number of submitted actions that have not reached a terminal status.
     */
    public int getInFlightCount() {
        return inFlight.size();
    }

    // =================================================================
    // CANCELLATION AND DEFERRED ACTIONS
    // =================================================================

    /**
     * Requests cancellation. An action that has not started ends CANCELLED immediately; a
     * running one stops at its next checkpoint. Pending deferred children of the action are
     * cancelled too, even when the action itself already finished.
     *
     * @return false if the action is unknown
     */
    public boolean cancel(String actionId) {
        Action action = actions.get(actionId);
        if (action == null) {
            return false;
        }
        cancelAction(action, "Cancelled by request");
        return true;
    }

    private void cancelAction(Action action, String reason) {
        boolean newlyRequested = action.requestCancel();
        if (newlyRequested) {
            log.info("Cancellation requested for {}", action);
        }
        cancelDeferred(action.getId());
        if (action.finishBeforeStart(ActionStatus.CANCELLED, reason, ActionError.of(ErrorType.CANCELLED, reason))) {
            onTerminal(action);
        }
    }

    private void cancelDeferred(String parentId) {
        List<ScheduledFuture<?>> futures = deferredTimers.getOrDefault(parentId, List.of());
        int stopped = 0;
        for (ScheduledFuture<?> future : futures) {
            if (future.cancel(false)) {
                stopped++;
            }
        }
        for (Action child : deferredChildren.getOrDefault(parentId, List.of())) {
            cancelAction(child, "Parent action " + parentId + " cancelled");
        }
        if (stopped > 0) {
            log.info("Stopped {} deferred timer(s) of action {}", stopped, parentId);
            updateDeferredGauge();
        }
    }

    @Override
    public void scheduleDeferred(Action parent, Action child, Duration delay) {
        actions.put(child.getId(), child);
        completions.putIfAbsent(child.getId(), new CompletableFuture<>());
        deferredChildren.computeIfAbsent(parent.getId(), k -> new CopyOnWriteArrayList<>()).add(child);

        if (state.get() != State.RUNNING) {
            log.warn("Dispatcher {} is stopping, dropping deferred {} on {}; the node stays orphaned",
                    engineId, child.getType(), child.getTargetId());
            cancelAction(child, "Engine shutting down");
            return;
        }

        ScheduledFuture<?> future = timers.schedule(() -> fireDeferred(parent, child), delay.toMillis(), TimeUnit.MILLISECONDS);
        deferredTimers.computeIfAbsent(parent.getId(), k -> new CopyOnWriteArrayList<>()).add(future);
        updateDeferredGauge();
        log.info("Scheduled {} on {} in {}s for parent {}", child.getType(), child.getTargetId(), delay.getSeconds(), parent.getId());

        // The parent may have been cancelled while the timer was being registered
        if (parent.isCancelRequested()) {
            cancelDeferred(parent.getId());
        }
    }

    private void fireDeferred(Action parent, Action child) {
        updateDeferredGauge();
        if (parent.isCancelRequested() || child.isCancelRequested()) {
            cancelAction(child, "Parent action " + parent.getId() + " cancelled");
            return;
        }
        if (child.isTerminal() || state.get() != State.RUNNING) {
            return;
        }
        log.info("Deferred {} on {} is due", child.getType(), child.getTargetId());
        enqueue(child);
    }

    private void updateDeferredGauge() {
        long pending = deferredTimers.values().stream()
                .flatMap(List::stream)
                .filter(f -> !f.isDone())
                .count();
        metrics.gauge(DEFERRED_ACTIONS_METRIC_NAME, Map.of()).set(pending);
    }

    // =================================================================
    // QUEUE AND PER-TARGET LINES
    // =================================================================

    private void enqueue(Action action) {
        if (!action.transition(ActionStatus.INIT, ActionStatus.WAITING)) {
            log.debug("{} not enqueued, already {}", action.getId(), action.getStatus());
            return;
        }
        inFlight.add(action.getId());
        joinLine(action);
        metrics.gauge(PENDING_ACTIONS_METRIC_NAME, Map.of()).set(inFlight.size());
        notifier.emit(ActionEvent.of(action));
        queue.add(new PendingAction(action, System.nanoTime(), sequence.incrementAndGet()));
        log.debug("Queued {}", action);
    }

    private void requeue(Action action, long delayMillis) {
        long readyAt = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMillis);
        queue.add(new PendingAction(action, readyAt, sequence.incrementAndGet()));
    }

    private void joinLine(Action action) {
        synchronized (lines) {
            lines.computeIfAbsent(action.getTargetId(), k -> new ArrayDeque<>()).addLast(action.getId());
        }
    }

    private void leaveLine(Action action) {
        synchronized (lines) {
            Deque<String> line = lines.get(action.getTargetId());
            if (line != null) {
                line.remove(action.getId());
                if (line.isEmpty()) {
                    lines.remove(action.getTargetId());
                }
            }
        }
    }

    private boolean isHeadOfLine(Action action) {
        synchronized (lines) {
            Deque<String> line = lines.get(action.getTargetId());
            return line != null && action.getId().equals(line.peekFirst());
        }
    }

    /**
     * Backoff before the given (1-based) retry: base * 2^(retry - 1), capped.
     */
    long backoffMillis(int retry) {
        int shift = Math.min(Math.max(retry - 1, 0), 30);
        long delay = lockRetryBaseMillis << shift;
        return Math.min(delay < 0 ? lockRetryMaxMillis : delay, lockRetryMaxMillis);
    }

    // =================================================================
    // WORKERS
    // =================================================================

    private void workerLoop(String workerId) {
        log.debug("Worker {} started", workerId);
        while (state.get() != State.STOPPED) {
            PendingAction pending;
            try {
                pending = queue.poll(POLL_INTERVAL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (pending == null) {
                continue;
            }
            try {
                process(pending.getAction(), workerId);
            } catch (RuntimeException e) {
                log.error("Worker {} failed while processing {}: {}", workerId, pending.getAction().getId(), e.getMessage(), e);
            }
        }
        log.debug("Worker {} stopped", workerId);
    }

    private void process(Action action, String workerId) {
        if (action.isTerminal()) {
            return;
        }
        if (action.isCancelRequested()) {
            cancelAction(action, "Cancelled before start");
            return;
        }

        if (!isHeadOfLine(action)) {
            retryLater(action, "waiting behind an earlier action on " + action.getTargetId());
            return;
        }
        try {
            lockManager.acquire(action.getTargetId(), action.getId(), workerId);
        } catch (LockBusyException e) {
            retryLater(action, "target " + action.getTargetId() + " locked by " + e.getHolderActionId());
            return;
        }

        action.setOwner(workerId);
        if (!action.transition(ActionStatus.WAITING, ActionStatus.RUNNING)) {
            // Cancelled between the checks above and the transition
            action.setOwner(null);
            releaseQuietly(action);
            return;
        }
        notifier.emit(ActionEvent.of(action));
        log.info("Worker {} running {}", workerId, action);
        execute(action, workerId);
    }

    private void retryLater(Action action, String why) {
        int retry = action.incrementAttempts();
        if (retry > lockMaxRetries) {
            String reason = "Gave up after " + lockMaxRetries + " retries: " + why;
            log.warn("{} failed: {}", action.getId(), reason);
            if (action.finishBeforeStart(ActionStatus.FAILED, reason, ActionError.of(ErrorType.LOCK_BUSY, reason))) {
                onTerminal(action);
            }
            return;
        }
        long delay = backoffMillis(retry);
        metrics.counter(LOCK_BUSY_RETRIES_METRIC_NAME, Map.of(ACTION_TYPE_TAG, action.getType().name())).increment();
        log.debug("{} {}; retry {} in {}ms", action.getId(), why, retry, delay);
        requeue(action, delay);
    }

    private void execute(Action action, String workerId) {
        ActionCancellationToken token = new ActionCancellationToken(action);
        ActionHandler handler = handlers.getHandler(action.getType());
        ActionStatus outcome;
        String reason;
        ActionError error = null;

        try {
            token.checkpoint();
            String clusterId = handler.resolvePolicyCluster(action, registry);
            policyEngine.enforce(clusterId, action, PolicyPhase.PRE);
            token.checkpoint();
            handler.execute(action, context, workerId, token);
            policyEngine.enforce(clusterId, action, PolicyPhase.POST);
            outcome = ActionStatus.SUCCEEDED;
            reason = "Action completed";
        } catch (ActionCancelledException e) {
            outcome = ActionStatus.CANCELLED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.CANCELLED, e.getMessage());
        } catch (ActionTimeoutException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.TIMEOUT, e.getMessage());
        } catch (ActionAbortedException e) {
            outcome = ActionStatus.CANCELLED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.CANCELLED, e.getMessage());
        } catch (PolicyRejectedException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = new ActionError(ErrorType.POLICY_REJECTED, e.getReason(), e.getPolicyId());
            metrics.counter(POLICY_REJECTIONS_METRIC_NAME, Map.of(POLICY_TYPE_TAG, policyTypeOf(e))).increment();
        } catch (DriverException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.DRIVER_ERROR, e.getMessage());
        } catch (LockBusyException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.LOCK_BUSY, e.getMessage());
        } catch (InvalidPolicyConfigException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.INVALID_INPUT, e.getMessage());
        } catch (TargetNotFoundException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.TARGET_NOT_FOUND, e.getMessage());
        } catch (IllegalArgumentException e) {
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.INVALID_INPUT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure running {}: {}", action, e.getMessage(), e);
            outcome = ActionStatus.FAILED;
            reason = "Internal error: " + e.getMessage();
            error = ActionError.of(ErrorType.INTERNAL, e.getMessage());
        }

        try {
            lockManager.release(action.getTargetId(), action.getId());
        } catch (InconsistentLockReleaseException e) {
            int cleared = lockManager.forceRelease(action.getId());
            log.error("Inconsistent lock release by {}: {} (cleared {} record(s) still held by the action)",
                    action.getId(), e.getMessage(), cleared);
            metrics.counter(INCONSISTENT_LOCK_RELEASES_METRIC_NAME, Map.of()).increment();
            outcome = ActionStatus.FAILED;
            reason = e.getMessage();
            error = ActionError.of(ErrorType.INCONSISTENT_LOCK_RELEASE, e.getMessage());
        }

        recordPolicyWarnings(action);
        action.setStatusReason(reason);
        action.setError(error);
        if (!action.transition(ActionStatus.RUNNING, outcome)) {
            log.error("{} left RUNNING unexpectedly, now {}", action.getId(), action.getStatus());
            return;
        }
        if (outcome == ActionStatus.SUCCEEDED) {
            log.info("{} succeeded", action);
        } else {
            log.warn("{} ended {}: {}", action, outcome, reason);
        }
        onTerminal(action);
    }

    private void releaseQuietly(Action action) {
        try {
            lockManager.release(action.getTargetId(), action.getId());
        } catch (InconsistentLockReleaseException e) {
            log.error("Could not release lock of {} after aborted start: {}", action.getId(), e.getMessage());
            lockManager.forceRelease(action.getId());
        }
    }

    private void recordPolicyWarnings(Action action) {
        List<String> warnings = action.getPolicyResults().stream()
                .filter(r -> r.getStatus() == CheckStatus.WARNING)
                .map(r -> r.getPolicyId() + ": " + r.getReason())
                .collect(Collectors.toList());
        if (!warnings.isEmpty()) {
            action.putOutput(OUTPUT_POLICY_WARNINGS, warnings);
        }
    }

    private static String policyTypeOf(PolicyRejectedException e) {
        return e.getResults().stream()
                .filter(r -> e.getPolicyId().equals(r.getPolicyId()))
                .map(PolicyResult::getPolicyType)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("unknown");
    }

    /**
     * Bookkeeping for the single caller that moved the action into its terminal status.
     */
    private void onTerminal(Action action) {
        leaveLine(action);
        inFlight.remove(action.getId());
        metrics.gauge(PENDING_ACTIONS_METRIC_NAME, Map.of()).set(inFlight.size());
        metrics.counter(ACTIONS_COMPLETED_METRIC_NAME, Map.of(
                ACTION_TYPE_TAG, action.getType().name(),
                STATUS_TAG, action.getStatus().name())).increment();
        if (action.getStartedAt() != null && action.getEndedAt() != null) {
            metrics.timer(ACTION_DURATION_METRIC_NAME, Map.of(ACTION_TYPE_TAG, action.getType().name()))
                    .record(Duration.between(action.getStartedAt(), action.getEndedAt()));
        }
        notifier.emit(ActionEvent.of(action));
        CompletableFuture<Action> completion = completions.get(action.getId());
        if (completion != null) {
            completion.complete(action);
        }
    }

    // =================================================================
    // PURGE
    // =================================================================

    private void purgeSafely() {
        try {
            purge(OffsetDateTime.now().minus(retention));
        } catch (RuntimeException e) {
            log.error("Purge of finished actions failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Forgets terminal actions that ended before {@code cutoff}. Actions with deferred
     * children still waiting on a timer are kept so they stay cancellable.
     *
     * @return number of actions removed
     */
    int purge(OffsetDateTime cutoff) {
        int removed = 0;
        for (Action action : new ArrayList<>(actions.values())) {
            if (!action.isTerminal() || action.getEndedAt() == null || !action.getEndedAt().isBefore(cutoff)) {
                continue;
            }
            boolean timersPending = deferredTimers.getOrDefault(action.getId(), List.of()).stream()
                    .anyMatch(f -> !f.isDone());
            if (timersPending) {
                continue;
            }
            actions.remove(action.getId());
            completions.remove(action.getId());
            deferredTimers.remove(action.getId());
            deferredChildren.remove(action.getId());
            removed++;
        }
        if (removed > 0) {
            log.info("Purged {} finished action(s) older than {}", removed, cutoff);
        }
        return removed;
    }
}

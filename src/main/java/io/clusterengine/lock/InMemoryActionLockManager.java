package io.clusterengine.lock;

import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local lock table backed by a concurrent map. Every mutation is a single
 * compare-and-swap on the entry for the target, so distinct targets never contend.
 */
@Slf4j
public class InMemoryActionLockManager implements ActionLockManager {

    private final ConcurrentMap<String, ActionLock> locks = new ConcurrentHashMap<>();

    @Override
    public ActionLock acquire(String targetId, String actionId, String workerId) throws LockBusyException {
        ActionLock candidate = new ActionLock(targetId, actionId, workerId, OffsetDateTime.now());
        ActionLock existing = locks.putIfAbsent(targetId, candidate);

        if (existing == null) {
            log.debug("Lock acquired on {} by action {} (worker {})", targetId, actionId, workerId);
            return candidate;
        }
        if (existing.isOwnedBy(actionId)) {
            log.debug("Lock on {} already held by action {}, re-entrant acquire", targetId, actionId);
            return existing;
        }
        throw new LockBusyException(targetId, existing.getActionId());
    }

    @Override
    public void release(String targetId, String actionId) throws InconsistentLockReleaseException {
        ActionLock current = locks.get(targetId);
        if (current == null || !current.isOwnedBy(actionId)) {
            String holder = current != null ? current.getActionId() : null;
            log.error("Inconsistent lock release on {}: action {} is not the owner (holder: {})",
                    targetId, actionId, holder);
            throw new InconsistentLockReleaseException(targetId, actionId, holder);
        }
        if (!locks.remove(targetId, current)) {
            ActionLock now = locks.get(targetId);
            String holder = now != null ? now.getActionId() : null;
            log.error("Lock on {} changed while action {} was releasing it (holder: {})", targetId, actionId, holder);
            throw new InconsistentLockReleaseException(targetId, actionId, holder);
        }
        log.debug("Lock on {} released by action {}", targetId, actionId);
    }

    @Override
    public Optional<ActionLock> isLocked(String targetId) {
        return Optional.ofNullable(locks.get(targetId));
    }

    @Override
    public Optional<ActionLock> steal(String targetId) {
        ActionLock removed = locks.remove(targetId);
        if (removed != null) {
            log.warn("Lock on {} stolen from action {} (worker {}, acquired at {})",
                    targetId, removed.getActionId(), removed.getWorkerId(), removed.getAcquiredAt());
        } else {
            log.warn("Steal requested for {} but no lock was held", targetId);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public int forceRelease(String actionId) {
        AtomicInteger removed = new AtomicInteger();
        for (Map.Entry<String, ActionLock> entry : locks.entrySet()) {
            if (entry.getValue().isOwnedBy(actionId) && locks.remove(entry.getKey(), entry.getValue())) {
                log.warn("Force-cleared lock on {} held by action {}", entry.getKey(), actionId);
                removed.incrementAndGet();
            }
        }
        return removed.get();
    }

    /**
     * Number of targets currently locked.
     */
    public int size() {
        return locks.size();
    }
}

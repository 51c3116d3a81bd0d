package io.clusterengine.lock;

import java.util.Optional;

/**
 * Grants and releases exclusive execution rights over targets (clusters or nodes).
 *
 * Implementations must make {@link #acquire} an atomic test-and-set: no two callers may both
 * observe a target as unlocked.
 */
public interface ActionLockManager {

    /**
     * Acquire the lock on a target. Re-acquiring a lock already held by the same action
     * succeeds and returns the existing record.
     *
     * @throws LockBusyException if a different action holds the lock
     */
    ActionLock acquire(String targetId, String actionId, String workerId) throws LockBusyException;

    /**
     * Release the lock if, and only if, the given action owns it.
     *
     * @throws InconsistentLockReleaseException if the lock is absent or owned by another action
     */
    void release(String targetId, String actionId) throws InconsistentLockReleaseException;

    /**
     * Current owner of the target's lock, if any.
     */
    Optional<ActionLock> isLocked(String targetId);

    /**
     * Administrative override used after the owning worker is known to be dead.
     *
     * @return the lock record that was removed, if any
     */
    Optional<ActionLock> steal(String targetId);

    /**
     * Clears every lock record still attributed to the given action.
     *
     * @return number of records removed
     */
    int forceRelease(String actionId);
}

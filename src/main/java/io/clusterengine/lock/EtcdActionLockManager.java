package io.clusterengine.lock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clusterengine.store.EtcdPathResolver;
import io.clusterengine.store.StoreException;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static io.clusterengine.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Lock table kept in etcd so several engine processes can share targets.
 *
 * Acquisition is a transaction that only writes the lock key when it does not exist yet
 * (create revision 0); release and forced clears only delete the key at the revision that
 * was read, so a concurrent re-acquisition is never removed by mistake.
 */
@Slf4j
public class EtcdActionLockManager implements ActionLockManager {

    private static final int ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdActionLockManager(Client etcdClient) {
        this(etcdClient.getKVClient());
    }

    public EtcdActionLockManager(KV kvClient) {
        this.kvClient = kvClient;
        this.pathResolver = EtcdPathResolver.getInstance();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("EtcdActionLockManager initialized");
    }

    @Override
    public ActionLock acquire(String targetId, String actionId, String workerId) throws LockBusyException {
        ActionLock candidate = new ActionLock(targetId, actionId, workerId, OffsetDateTime.now());
        ByteSequence key = lockKey(targetId);

        TxnResponse response = await(kvClient.txn()
                .If(new Cmp(key, Cmp.Op.EQUAL, CmpTarget.createRevision(0)))
                .Then(Op.put(key, ByteSequence.from(writeJson(candidate), UTF_8), PutOption.DEFAULT))
                .Else(Op.get(key, GetOption.DEFAULT))
                .commit(), "acquire lock " + targetId);

        if (response.isSucceeded()) {
            log.debug("Lock acquired on {} by action {} (worker {})", targetId, actionId, workerId);
            return candidate;
        }

        ActionLock existing = response.getGetResponses().isEmpty()
                || response.getGetResponses().get(0).getKvs().isEmpty()
                ? null
                : readJson(response.getGetResponses().get(0).getKvs().get(0));
        if (existing != null && existing.isOwnedBy(actionId)) {
            log.debug("Lock on {} already held by action {}, re-entrant acquire", targetId, actionId);
            return existing;
        }
        throw new LockBusyException(targetId, existing != null ? existing.getActionId() : null);
    }

    @Override
    public void release(String targetId, String actionId) throws InconsistentLockReleaseException {
        Optional<KeyValue> current = getLockKeyValue(targetId);
        ActionLock holder = current.map(this::readJson).orElse(null);

        if (holder == null || !holder.isOwnedBy(actionId)) {
            String holderId = holder != null ? holder.getActionId() : null;
            log.error("Inconsistent lock release on {}: action {} is not the owner (holder: {})",
                    targetId, actionId, holderId);
            throw new InconsistentLockReleaseException(targetId, actionId, holderId);
        }

        if (!deleteAtRevision(targetId, current.get().getModRevision())) {
            log.error("Lock on {} changed while action {} was releasing it", targetId, actionId);
            throw new InconsistentLockReleaseException(targetId, actionId, null);
        }
        log.debug("Lock on {} released by action {}", targetId, actionId);
    }

    @Override
    public Optional<ActionLock> isLocked(String targetId) {
        return getLockKeyValue(targetId).map(this::readJson);
    }

    @Override
    public Optional<ActionLock> steal(String targetId) {
        Optional<KeyValue> current = getLockKeyValue(targetId);
        if (current.isEmpty()) {
            log.warn("Steal requested for {} but no lock was held", targetId);
            return Optional.empty();
        }
        ActionLock removed = readJson(current.get());
        if (!deleteAtRevision(targetId, current.get().getModRevision())) {
            log.warn("Lock on {} changed during steal, leaving it in place", targetId);
            return Optional.empty();
        }
        log.warn("Lock on {} stolen from action {} (worker {}, acquired at {})",
                targetId, removed.getActionId(), removed.getWorkerId(), removed.getAcquiredAt());
        return Optional.of(removed);
    }

    @Override
    public int forceRelease(String actionId) {
        ByteSequence prefix = ByteSequence.from(pathResolver.getActionLocksPrefix() + PATH_DELIMITER, UTF_8);
        GetResponse response = await(kvClient.get(prefix, GetOption.newBuilder().withPrefix(prefix).build()),
                "list locks");
        int removed = 0;
        for (KeyValue kv : response.getKvs()) {
            ActionLock lock = readJson(kv);
            if (lock.isOwnedBy(actionId) && deleteAtRevision(lock.getTargetId(), kv.getModRevision())) {
                log.warn("Force-cleared lock on {} held by action {}", lock.getTargetId(), actionId);
                removed++;
            }
        }
        return removed;
    }

    private boolean deleteAtRevision(String targetId, long modRevision) {
        ByteSequence key = lockKey(targetId);
        TxnResponse response = await(kvClient.txn()
                .If(new Cmp(key, Cmp.Op.EQUAL, CmpTarget.modRevision(modRevision)))
                .Then(Op.delete(key, DeleteOption.DEFAULT))
                .commit(), "delete lock " + targetId);
        return response.isSucceeded();
    }

    private Optional<KeyValue> getLockKeyValue(String targetId) {
        GetResponse response = await(kvClient.get(lockKey(targetId)), "get lock " + targetId);
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(response.getKvs().get(0));
    }

    private ByteSequence lockKey(String targetId) {
        return ByteSequence.from(pathResolver.getActionLockPath(targetId), UTF_8);
    }

    private ActionLock readJson(KeyValue kv) {
        try {
            return objectMapper.readValue(kv.getValue().toString(UTF_8), ActionLock.class);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to deserialize action lock", e);
        }
    }

    private String writeJson(ActionLock lock) {
        try {
            return objectMapper.writeValueAsString(lock);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to serialize action lock for " + lock.getTargetId(), e);
        }
    }

    private <T> T await(CompletableFuture<T> future, String operation) {
        try {
            return future.get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted during etcd " + operation, e);
        } catch (ExecutionException e) {
            log.error("etcd {} failed: {}", operation, e.getMessage());
            throw new StoreException("etcd " + operation + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new StoreException("Timeout during etcd " + operation, e);
        }
    }
}

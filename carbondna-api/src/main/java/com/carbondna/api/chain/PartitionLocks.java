package com.carbondna.api.chain;

import com.carbondna.api.config.LedgerProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per partition. Serializes appends inside this process so they
 * do not burn their retry budget on each other; other processes are kept out
 * by the optimistic check on the persisted chain head.
 */
@Component
public class PartitionLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LedgerProperties properties;

    public PartitionLocks(LedgerProperties properties) {
        this.properties = properties;
    }

    public <T> T withLock(String partitionId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(partitionId, id -> new ReentrantLock(true));
        long timeoutMs = properties.getLockTimeout().toMillis();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainWriteFailedException(partitionId,
                    "Interrupted while waiting for the lock of partition '" + partitionId + "'", e);
        }
        if (!acquired) {
            throw new ChainWriteFailedException(partitionId,
                    "Timed out after " + timeoutMs + " ms waiting for the lock of partition '" + partitionId + "'",
                    null);
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}

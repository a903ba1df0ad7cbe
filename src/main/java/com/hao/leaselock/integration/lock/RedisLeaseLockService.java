package com.hao.leaselock.integration.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 基于 Redis 的租约锁服务实现
 */
@Slf4j
@Service
public class RedisLeaseLockService implements LeaseLockService {

    private final LockClient lockClient;

    public RedisLeaseLockService(LockClient lockClient) {
        this.lockClient = lockClient;
    }

    @Override
    public LeaseLock acquire(AcquireLockOptions options) {
        return lockClient.acquire(options);
    }

    @Override
    public void release(LeaseLock lock) {
        lockClient.release(lock);
    }

    /**
     * 在锁保护下执行任务
     *
     * 实现逻辑：
     * 1. 获取锁，失败直接上抛。
     * 2. 执行任务，finally 中释放锁。
     * 3. 任务与释放都失败时，释放异常作为 suppressed 挂到任务异常上。
     */
    @Override
    public <T> T executeWithLock(AcquireLockOptions options, Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        LeaseLock lock = lockClient.acquire(options);
        log.debug("锁内任务开始|Locked_action_start,shardKey={},name={}", lock.getShardKey(), lock.getName());

        RuntimeException failure = null;
        try {
            return action.get();
        } catch (RuntimeException e) {
            failure = e;
            throw e;
        } finally {
            releaseAfterAction(lock, failure);
        }
    }

    private void releaseAfterAction(LeaseLock lock, RuntimeException failure) {
        try {
            lockClient.release(lock);
        } catch (RuntimeException e) {
            if (failure == null) {
                throw e;
            }
            log.warn("锁内任务失败后释放锁失败|Release_after_action_failure_fail,name={},error={}",
                    lock.getName(), e.getMessage());
            failure.addSuppressed(e);
        }
    }
}

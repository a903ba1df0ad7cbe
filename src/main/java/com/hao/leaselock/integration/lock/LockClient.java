package com.hao.leaselock.integration.lock;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hao.leaselock.common.constants.LeaseLockConstants;
import com.hao.leaselock.common.exception.LockReleasedException;
import com.hao.leaselock.common.exception.LockUnavailableException;
import com.hao.leaselock.integration.store.ItemAlreadyExistsException;
import com.hao.leaselock.integration.store.ItemNotFoundException;
import com.hao.leaselock.integration.store.LeaseStore;
import com.hao.leaselock.integration.store.VersionMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 租约锁客户端
 *
 * 类职责：
 * 基于 {@link LeaseStore} 的条件写与 TTL 实现获取、续期、释放三种租约状态转换，
 * 并按需为锁挂上自动续期任务。
 *
 * 设计目的：
 * 1. 互斥完全交给存储的条件写保证，客户端不持有任何跨进程状态。
 * 2. 冲突只在获取时重试，续期与释放失败不重试，由调用方或下一轮续期决定。
 * 3. 构造时即校验一致性级别，弱一致存储上无法使用该客户端。
 *
 * 为什么需要该类：
 * 把“重试 + 异常映射 + 续期生命周期”集中在一处，业务层只面对锁句柄和几种语义异常。
 *
 * 核心实现思路：
 * - 获取：循环 create，冲突时在超时内按 retryWaitMillis 退避。
 * - 续期：带令牌的 replace，令牌或条目失效映射为 LockReleasedException。
 * - 释放：先同步停掉续期，再带令牌的 delete，条目已不在视为成功。
 * - 所有续期任务共用一个调度线程池，自建的线程池在 close 时关闭。
 */
@Slf4j
public class LockClient implements AutoCloseable {

    private final LeaseStore store;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final long minRenewIntervalMillis;
    private final boolean ownsScheduler;

    /**
     * 使用默认配置构造，客户端自建续期线程池并在 close 时关闭
     *
     * @param store 租约存储
     */
    public LockClient(LeaseStore store) {
        this(store, Clock.systemUTC(), newScheduler(LeaseLockConstants.DEFAULT_RENEWAL_POOL_SIZE),
                LeaseLockConstants.DEFAULT_MIN_RENEW_INTERVAL_MILLIS, true);
    }

    /**
     * 使用外部时钟与线程池构造，线程池的生命周期由调用方负责
     *
     * @param store 租约存储
     * @param clock 本地时钟，决定 isAcquired 与退避计时
     * @param scheduler 续期调度线程池
     * @param minRenewIntervalMillis 两次自动续期的最小间隔
     */
    public LockClient(LeaseStore store, Clock clock, ScheduledExecutorService scheduler, long minRenewIntervalMillis) {
        this(store, clock, scheduler, minRenewIntervalMillis, false);
    }

    private LockClient(LeaseStore store, Clock clock, ScheduledExecutorService scheduler,
                       long minRenewIntervalMillis, boolean ownsScheduler) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (minRenewIntervalMillis < 0) {
            throw new IllegalArgumentException("minRenewIntervalMillis 不能小于 0");
        }
        this.minRenewIntervalMillis = minRenewIntervalMillis;
        this.ownsScheduler = ownsScheduler;

        try {
            ConsistencyGuard.check(store);
        } catch (RuntimeException e) {
            if (ownsScheduler) {
                scheduler.shutdownNow();
            }
            throw e;
        }
        log.info("租约锁客户端初始化完成|Lock_client_initialized,minRenewIntervalMs={},ownsScheduler={}",
                minRenewIntervalMillis, ownsScheduler);
    }

    /**
     * 创建续期线程池，守护线程，命名 LeaseLockRenewal-N
     *
     * @param poolSize 核心线程数
     * @return 调度线程池
     */
    public static ScheduledExecutorService newScheduler(int poolSize) {
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize 必须大于 0");
        }
        return Executors.newScheduledThreadPool(poolSize, new ThreadFactoryBuilder()
                .setNameFormat("LeaseLockRenewal-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * 获取锁
     *
     * 实现逻辑：
     * 1. 校验参数，记录循环起始时间。
     * 2. 尝试创建锁条目，成功则记录令牌与本地时间，按需启动自动续期。
     * 3. 条目已存在时，若仍在超时内则等待 retryWaitMillis 后重试，否则抛出 LockUnavailableException。
     * 4. 其他异常原样上抛。
     *
     * @param options 获取参数
     * @return 锁句柄
     */
    public LeaseLock acquire(AcquireLockOptions options) {
        validate(options);
        long start = clock.millis();
        ItemAlreadyExistsException lastConflict;
        int attempts = 0;

        while (true) {
            attempts++;
            try {
                return createLock(options);
            } catch (ItemAlreadyExistsException e) {
                lastConflict = e;
            }

            if (clock.millis() - start >= options.getTimeoutMillis()) {
                log.info("获取锁超时|Lock_acquire_timeout,shardKey={},name={},attempts={}",
                        options.getShardKey(), options.getName(), attempts);
                throw new LockUnavailableException(options.getShardKey(), options.getName(), lastConflict);
            }

            try {
                Thread.sleep(options.getRetryWaitMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("获取锁等待被中断|Lock_acquire_interrupted,shardKey={},name={}",
                        options.getShardKey(), options.getName());
                LockUnavailableException ex =
                        new LockUnavailableException(options.getShardKey(), options.getName(), e);
                ex.addSuppressed(lastConflict);
                throw ex;
            }
        }
    }

    /**
     * 只尝试一次获取，忽略 timeoutMillis
     *
     * @param options 获取参数
     * @return 成功时为锁句柄，锁被占用时为空
     */
    public Optional<LeaseLock> tryAcquire(AcquireLockOptions options) {
        validate(options);
        try {
            return Optional.of(createLock(options));
        } catch (ItemAlreadyExistsException e) {
            log.debug("锁被占用|Lock_held_by_other,key={}", e.getKey());
            return Optional.empty();
        }
    }

    /**
     * 异步获取锁
     * <p>
     * 重试逻辑与 {@link #acquire} 一致，退避通过调度线程池延时执行，不阻塞任何线程。
     * 参数错误同步抛出。
     *
     * @param options 获取参数
     * @return 完成时为锁句柄，超时以 LockUnavailableException 异常完成
     */
    public CompletableFuture<LeaseLock> acquireAsync(AcquireLockOptions options) {
        validate(options);
        CompletableFuture<LeaseLock> future = new CompletableFuture<>();
        long start = clock.millis();
        submit(() -> attemptAsync(options, start, future), future);
        return future;
    }

    /**
     * 续期
     *
     * 实现逻辑：
     * 1. 句柄本地已失效（已释放或租约到期）时直接抛出 LockReleasedException，不访问存储。
     * 2. 记录本次调用的本地时间。
     * 3. 带当前令牌替换条目，成功后更新令牌与获取时间。
     * 4. 条目不存在或令牌不匹配时抛出 LockReleasedException，其他异常原样上抛。
     *
     * @param lock 锁句柄
     */
    public void renew(LeaseLock lock) {
        Objects.requireNonNull(lock, "lock");
        // 本地失效的句柄不能复活，即使服务端条目因时钟漂移尚未过期
        if (!lock.isAcquired()) {
            log.debug("句柄本地已失效_拒绝续期|Renew_rejected_lease_lapsed,shardKey={},name={}",
                    lock.getShardKey(), lock.getName());
            throw new LockReleasedException(lock.getShardKey(), lock.getName(), null);
        }
        Instant renewedAt = clock.instant();
        try {
            String token = store.replace(lock.toItem(), lock.getVersionToken());
            lock.markAcquired(token, renewedAt);
        } catch (ItemNotFoundException | VersionMismatchException e) {
            throw new LockReleasedException(lock.getShardKey(), lock.getName(), e);
        }
    }

    /**
     * 异步续期，在调度线程池上执行 {@link #renew}
     */
    public CompletableFuture<Void> renewAsync(LeaseLock lock) {
        Objects.requireNonNull(lock, "lock");
        return CompletableFuture.runAsync(() -> renew(lock), scheduler);
    }

    /**
     * 释放锁
     *
     * 实现逻辑：
     * 1. 同步停止自动续期，保证删除前没有续期在进行。
     * 2. 带当前令牌删除条目。
     * 3. 成功或条目已不在（过期/被他人重新获取）都标记为已释放，其他异常原样上抛且不标记。
     *
     * @param lock 锁句柄
     */
    public void release(LeaseLock lock) {
        Objects.requireNonNull(lock, "lock");
        lock.stopRenewal();
        try {
            store.delete(lock.toItem(), lock.getVersionToken());
            log.debug("锁释放成功|Lock_released,shardKey={},name={}", lock.getShardKey(), lock.getName());
        } catch (ItemNotFoundException | VersionMismatchException e) {
            log.debug("锁条目已不存在_视为已释放|Lock_already_gone,key={},reason={}",
                    e.getKey(), e.getClass().getSimpleName());
        }
        lock.markReleased();
    }

    /**
     * 异步释放，在调度线程池上执行 {@link #release}
     */
    public CompletableFuture<Void> releaseAsync(LeaseLock lock) {
        Objects.requireNonNull(lock, "lock");
        return CompletableFuture.runAsync(() -> release(lock), scheduler);
    }

    /**
     * 关闭客户端
     * <p>
     * 只关闭自建的线程池，不释放任何锁，未释放的锁条目由 TTL 回收。
     */
    @Override
    public void close() {
        if (ownsScheduler) {
            scheduler.shutdownNow();
            log.info("租约锁客户端已关闭|Lock_client_closed");
        }
    }

    private LeaseLock createLock(AcquireLockOptions options) {
        LeaseLock lock = new LeaseLock(options.getShardKey(), options.getName(),
                options.getLeaseDurationSeconds(), clock);
        Instant acquiredAt = clock.instant();
        String token = store.create(lock.toItem());
        lock.markAcquired(token, acquiredAt);
        log.debug("锁获取成功|Lock_acquired,shardKey={},name={},leaseSeconds={}",
                lock.getShardKey(), lock.getName(), lock.getLeaseDurationSeconds());

        if (options.isAutoRenew()) {
            startRenewal(lock);
        }
        return lock;
    }

    /**
     * 启动自动续期
     * <p>
     * 调度器拒绝任务时锁条目已创建，调用方拿不到句柄，先尽力删除条目再上抛，
     * 删除失败作为 suppressed 附在拒绝异常上。
     */
    private void startRenewal(LeaseLock lock) {
        LockRenewalTask task = new LockRenewalTask(lock, this, scheduler, clock, minRenewIntervalMillis);
        lock.attachRenewalTask(task);
        try {
            task.start();
        } catch (RejectedExecutionException e) {
            lock.detachRenewalTask(task);
            log.warn("续期调度器拒绝任务_回滚锁条目|Renew_scheduler_rejected_rollback,shardKey={},name={}",
                    lock.getShardKey(), lock.getName());
            try {
                store.delete(lock.toItem(), lock.getVersionToken());
                lock.markReleased();
            } catch (RuntimeException deleteFailure) {
                e.addSuppressed(deleteFailure);
            }
            throw e;
        }
    }

    private void attemptAsync(AcquireLockOptions options, long start, CompletableFuture<LeaseLock> future) {
        try {
            future.complete(createLock(options));
            return;
        } catch (ItemAlreadyExistsException e) {
            if (clock.millis() - start >= options.getTimeoutMillis()) {
                future.completeExceptionally(
                        new LockUnavailableException(options.getShardKey(), options.getName(), e));
                return;
            }
        } catch (RuntimeException e) {
            future.completeExceptionally(e);
            return;
        }

        try {
            scheduler.schedule(() -> attemptAsync(options, start, future),
                    options.getRetryWaitMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
    }

    private void submit(Runnable action, CompletableFuture<?> future) {
        try {
            scheduler.execute(action);
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
    }

    private static void validate(AcquireLockOptions options) {
        Objects.requireNonNull(options, "options");
        if (!StringUtils.hasText(options.getShardKey())) {
            throw new IllegalArgumentException("shardKey 不能为空");
        }
        if (!StringUtils.hasText(options.getName())) {
            throw new IllegalArgumentException("name 不能为空");
        }
        if (options.getLeaseDurationSeconds() <= 0) {
            throw new IllegalArgumentException("leaseDurationSeconds 必须大于 0");
        }
        if (options.getTimeoutMillis() < 0) {
            throw new IllegalArgumentException("timeoutMillis 不能小于 0");
        }
        if (options.getRetryWaitMillis() < 0) {
            throw new IllegalArgumentException("retryWaitMillis 不能小于 0");
        }
    }
}

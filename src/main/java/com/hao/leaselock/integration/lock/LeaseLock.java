package com.hao.leaselock.integration.lock;

import com.hao.leaselock.integration.store.LeaseItem;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 租约锁句柄
 *
 * 类职责：
 * 表示一次成功获取的租约，记录版本令牌与本地获取时间，并据此估算锁是否仍被持有。
 *
 * 设计目的：
 * 1. 句柄是令牌、时间戳与释放标记的唯一写入方，续期任务只是借用句柄。
 * 2. isAcquired 仅用本地时钟估算，用来省掉一次网络往返，不是正确性保证。
 *
 * 注意：
 * 本地时钟与存储服务端时钟存在漂移，服务端可能早于本地估算删除条目。
 * 续期/释放时的条件写会暴露这种情况（LockReleasedException 或幂等释放）。
 */
public class LeaseLock {

    @Getter
    private final String shardKey;

    @Getter
    private final String name;

    @Getter
    private final int leaseDurationSeconds;

    private final Clock clock;

    // 续期线程与调用方线程共享，使用 volatile 保证可见性
    @Getter(AccessLevel.PACKAGE)
    private volatile String versionToken;

    /**
     * 最近一次成功创建或续期的本地时间
     */
    @Getter
    private volatile Instant acquiredAtLocal;

    @Getter(AccessLevel.PACKAGE)
    private volatile boolean locallyReleased;

    private volatile LockRenewalTask renewalTask;

    LeaseLock(String shardKey, String name, int leaseDurationSeconds, Clock clock) {
        this.shardKey = shardKey;
        this.name = name;
        this.leaseDurationSeconds = leaseDurationSeconds;
        this.clock = clock;
    }

    /**
     * 锁是否仍被持有（本地估算）
     *
     * 实现逻辑：
     * 1. 已显式释放则直接返回 false。
     * 2. 否则判断距最近一次获取/续期是否仍在租约时长内。
     *
     * @return 未释放且租约未到期时为 true
     */
    public boolean isAcquired() {
        Instant acquiredAt = this.acquiredAtLocal;
        if (locallyReleased || acquiredAt == null) {
            return false;
        }
        return Duration.between(acquiredAt, clock.instant()).toMillis() < leaseDurationSeconds * 1000L;
    }

    /**
     * 本地估算的剩余租约时间（毫秒），未持有时为 0
     */
    public long remainingLeaseMillis() {
        Instant acquiredAt = this.acquiredAtLocal;
        if (locallyReleased || acquiredAt == null) {
            return 0L;
        }
        long elapsed = Duration.between(acquiredAt, clock.instant()).toMillis();
        return Math.max(0L, leaseDurationSeconds * 1000L - elapsed);
    }

    /**
     * 是否挂有自动续期任务
     */
    public boolean isAutoRenewing() {
        return renewalTask != null;
    }

    LeaseItem toItem() {
        return new LeaseItem(shardKey, name, leaseDurationSeconds);
    }

    void markAcquired(String token, Instant acquiredAt) {
        this.versionToken = token;
        this.acquiredAtLocal = acquiredAt;
    }

    void markReleased() {
        this.locallyReleased = true;
    }

    void attachRenewalTask(LockRenewalTask task) {
        if (this.renewalTask != null) {
            throw new IllegalStateException("锁已存在自动续期任务: " + this);
        }
        this.renewalTask = task;
    }

    /**
     * 续期任务自行停止时摘除引用，只摘除自己，避免误删后挂上的任务
     */
    void detachRenewalTask(LockRenewalTask task) {
        if (this.renewalTask == task) {
            this.renewalTask = null;
        }
    }

    /**
     * 同步停止并摘除续期任务，返回后不会再有续期调用
     */
    void stopRenewal() {
        LockRenewalTask task = this.renewalTask;
        if (task != null) {
            task.stop();
            this.renewalTask = null;
        }
    }

    @Override
    public String toString() {
        return "LeaseLock{shardKey='" + shardKey + "', name='" + name
                + "', leaseDurationSeconds=" + leaseDurationSeconds
                + ", acquiredAtLocal=" + acquiredAtLocal
                + ", locallyReleased=" + locallyReleased + "}";
    }
}

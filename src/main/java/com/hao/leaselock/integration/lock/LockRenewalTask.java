package com.hao.leaselock.integration.lock;

import com.hao.leaselock.common.constants.LeaseLockConstants;
import com.hao.leaselock.common.exception.LockReleasedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 租约自动续期任务（看门狗）
 *
 * 类职责：
 * 每把开启 autoRenew 的锁对应一个任务，按租约的 1/3 周期调用续期，直到被释放或本地判定租约已失效。
 *
 * 核心实现思路：
 * - 一次性定时 + 每轮自行重新挂起，间隔扣除本轮续期耗时，下限为 minIntervalMillis。
 * - 续期失败（含 LockReleasedException）只记日志不停止，由下一轮的 isAcquired 检查决定是否停止。
 * - 每轮在 monitor 内执行，stop() 拿到 monitor 即意味着没有正在进行的续期，
 *   释放流程据此保证删除之前续期已彻底停止。
 */
@Slf4j
final class LockRenewalTask implements Runnable {

    private final LeaseLock lock;
    private final LockClient client;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long intervalMillis;
    private final long minIntervalMillis;

    private final Object monitor = new Object();
    private ScheduledFuture<?> pending;
    private boolean stopped;

    LockRenewalTask(LeaseLock lock, LockClient client, ScheduledExecutorService scheduler,
                    Clock clock, long minIntervalMillis) {
        this.lock = lock;
        this.client = client;
        this.scheduler = scheduler;
        this.clock = clock;
        this.intervalMillis = lock.getLeaseDurationSeconds() * 1000L / LeaseLockConstants.RENEWAL_FRACTION;
        this.minIntervalMillis = minIntervalMillis;
    }

    /**
     * 挂起第一轮续期
     */
    void start() {
        synchronized (monitor) {
            pending = scheduler.schedule(this, intervalMillis, TimeUnit.MILLISECONDS);
        }
        log.debug("自动续期启动|Auto_renew_started,name={},intervalMs={}", lock.getName(), intervalMillis);
    }

    @Override
    public void run() {
        synchronized (monitor) {
            if (stopped) {
                return;
            }
            long start = clock.millis();

            if (!lock.isAcquired()) {
                stopped = true;
                pending = null;
                lock.detachRenewalTask(this);
                log.info("租约已失效_停止自动续期|Lease_lapsed_stop_auto_renew,shardKey={},name={}",
                        lock.getShardKey(), lock.getName());
                return;
            }

            try {
                client.renew(lock);
                log.debug("自动续期成功|Auto_renew_success,name={}", lock.getName());
            } catch (LockReleasedException e) {
                log.warn("自动续期失败_锁已释放|Auto_renew_fail_lock_released,name={},error={}",
                        lock.getName(), e.getMessage());
            } catch (RuntimeException e) {
                // 下一轮重试
                log.warn("自动续期异常|Auto_renew_error,name={},error={}", lock.getName(), e.getMessage());
            }

            long elapsed = clock.millis() - start;
            long delay = Math.max(minIntervalMillis, intervalMillis - elapsed);
            try {
                pending = scheduler.schedule(this, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                stopped = true;
                pending = null;
                lock.detachRenewalTask(this);
                log.warn("续期调度器已关闭_停止自动续期|Renew_scheduler_shutdown_stop_auto_renew,name={}",
                        lock.getName());
            }
        }
    }

    /**
     * 同步停止
     * <p>
     * 若续期正在进行，会等待其结束；返回后不会再发起任何续期。
     */
    void stop() {
        synchronized (monitor) {
            stopped = true;
            if (pending != null) {
                pending.cancel(false);
                pending = null;
            }
        }
        log.debug("自动续期停止|Auto_renew_stopped,name={}", lock.getName());
    }

    boolean isStopped() {
        synchronized (monitor) {
            return stopped;
        }
    }
}

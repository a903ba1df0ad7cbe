package com.hao.leaselock.integration.lock;

import java.util.function.Supplier;

/**
 * 租约锁服务接口
 * <p>
 * 职责：
 * 业务层获取与释放租约锁的统一入口。
 * <p>
 * 设计目的：
 * 隐藏 {@link LockClient} 的构造与生命周期，业务代码只依赖该接口，便于测试替换。
 */
public interface LeaseLockService {

    /**
     * 获取租约锁，超时仍未获取时抛出 LockUnavailableException。
     *
     * @param options 获取参数
     * @return 锁句柄
     */
    LeaseLock acquire(AcquireLockOptions options);

    /**
     * 释放租约锁，锁已过期或已被他人重新获取时视为成功。
     *
     * @param lock 锁句柄
     */
    void release(LeaseLock lock);

    /**
     * 在锁保护下执行任务，执行结束后无论成功失败都释放锁。
     *
     * @param options 获取参数
     * @param action 受保护的任务
     * @param <T> 返回类型
     * @return 任务结果
     */
    <T> T executeWithLock(AcquireLockOptions options, Supplier<T> action);
}

package com.hao.leaselock.common.demo;

import com.hao.leaselock.common.exception.LockUnavailableException;
import com.hao.leaselock.integration.lock.AcquireLockOptions;
import com.hao.leaselock.integration.lock.LeaseLock;
import com.hao.leaselock.integration.lock.LeaseLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 租约锁启动示例执行器
 *
 * 类职责：
 * 在应用启动时走一遍获取、冲突、锁内执行、释放流程，用于验证 Redis 与锁配置可用。
 *
 * 核心实现思路：
 * - 使用 CommandLineRunner 在启动后执行示例操作。
 * - 通过 lease.lock.sample.enabled 控制是否启用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "lease.lock.sample.enabled", havingValue = "true")
public class LeaseLockSampleRunner implements CommandLineRunner {

    private final LeaseLockService leaseLockService;

    @Override
    public void run(String... args) {
        AcquireLockOptions options = new AcquireLockOptions("demo", "sample-job");
        options.setLeaseDurationSeconds(10);
        options.setAutoRenew(true);

        LeaseLock lock = leaseLockService.acquire(options);
        log.info("示例锁获取成功|Sample_lock_acquired,lock={},remainingMs={}", lock, lock.remainingLeaseMillis());

        try {
            // 同名锁已被持有，只尝试一次
            leaseLockService.acquire(new AcquireLockOptions("demo", "sample-job"));
            log.warn("示例锁重复获取成功_互斥失效|Sample_lock_not_exclusive");
        } catch (LockUnavailableException e) {
            log.info("示例锁互斥生效|Sample_lock_exclusive,error={}", e.getMessage());
        } finally {
            leaseLockService.release(lock);
        }
        log.info("示例锁已释放|Sample_lock_released,acquired={}", lock.isAcquired());

        String result = leaseLockService.executeWithLock(new AcquireLockOptions("demo", "sample-task"),
                () -> "done");
        log.info("示例锁内任务完成|Sample_locked_action_done,result={}", result);
    }
}

package com.hao.leaselock.integration.lock;

import com.hao.leaselock.integration.store.InMemoryLeaseStore;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 自动续期测试
 *
 * 测试目的：
 * 1. 验证续期节奏约为租约的 1/3。
 * 2. 验证续期持续失败时，任务在本地判定租约失效后停止。
 * 3. 验证释放后不再有续期调用。
 *
 * 设计思路：
 * - 使用真实时钟与 2 秒租约，断言计数时保留调度抖动的余量。
 */
@Slf4j
class LockRenewalTaskTest {

    private ScheduledExecutorService scheduler;
    private InMemoryLeaseStore store;
    private LockClient client;

    @BeforeEach
    void setUp() {
        scheduler = LockClient.newScheduler(2);
        store = new InMemoryLeaseStore(Clock.systemUTC());
        client = new LockClient(store, Clock.systemUTC(), scheduler, 100);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private LeaseLock acquireAutoRenew() {
        AcquireLockOptions options = new AcquireLockOptions("orders", "sync");
        options.setLeaseDurationSeconds(2);
        options.setAutoRenew(true);
        return client.acquire(options);
    }

    @Test
    @DisplayName("自动续期使锁持续有效")
    void autoRenewKeepsLockAlive() throws InterruptedException {
        LeaseLock lock = acquireAutoRenew();

        Thread.sleep(3_500);

        int renewals = store.replaceCalls();
        log.info("自动续期次数|Auto_renew_count,renewals={}", renewals);
        assertTrue(renewals >= 4 && renewals <= 5, "renewals=" + renewals);
        assertTrue(lock.isAcquired());
        assertTrue(lock.isAutoRenewing());
        assertTrue(store.contains("orders", "sync"));

        client.release(lock);
    }

    @Test
    @DisplayName("续期持续失败时租约失效后停止续期")
    void stopsAfterLeaseLapses() throws InterruptedException {
        store.setReplaceFailure(new QueryTimeoutException("command timed out"));
        LeaseLock lock = acquireAutoRenew();

        Thread.sleep(2_500);
        int callsAtLapse = store.replaceCalls();
        assertTrue(callsAtLapse >= 2 && callsAtLapse <= 3, "calls=" + callsAtLapse);
        assertFalse(lock.isAcquired());

        Thread.sleep(1_000);
        assertEquals(callsAtLapse, store.replaceCalls());
        assertFalse(lock.isAutoRenewing());
    }

    @Test
    @DisplayName("条目被服务端删除后续期失败但不立即停止")
    void keepsTickingAfterLockReleasedUntilLapse() throws InterruptedException {
        LeaseLock lock = acquireAutoRenew();
        store.evict("orders", "sync");

        Thread.sleep(1_000);
        assertEquals(1, store.replaceCalls());
        assertTrue(lock.isAutoRenewing());

        Thread.sleep(2_500);
        assertFalse(lock.isAcquired());
        assertFalse(lock.isAutoRenewing());
    }

    @Test
    @DisplayName("释放后不再续期")
    void noRenewalAfterRelease() throws InterruptedException {
        LeaseLock lock = acquireAutoRenew();
        Thread.sleep(800);
        client.release(lock);
        int callsAtRelease = store.replaceCalls();

        Thread.sleep(2_000);

        assertEquals(1, callsAtRelease);
        assertEquals(callsAtRelease, store.replaceCalls());
        assertFalse(lock.isAutoRenewing());
        assertFalse(store.contains("orders", "sync"));
    }

    @Test
    @DisplayName("同一把锁只能挂一个续期任务")
    void singleRenewalTaskPerLock() {
        LeaseLock lock = acquireAutoRenew();
        LockRenewalTask extra = new LockRenewalTask(lock, client, scheduler, Clock.systemUTC(), 100);

        assertThrows(IllegalStateException.class, () -> lock.attachRenewalTask(extra));

        client.release(lock);
    }

    @Test
    @DisplayName("停止后任务不再执行续期")
    void stoppedTaskDoesNothing() {
        AcquireLockOptions options = new AcquireLockOptions("orders", "sync");
        options.setLeaseDurationSeconds(2);
        LeaseLock lock = client.acquire(options);
        LockRenewalTask task = new LockRenewalTask(lock, client, scheduler, Clock.systemUTC(), 100);

        task.stop();
        task.run();

        assertTrue(task.isStopped());
        assertEquals(0, store.replaceCalls());
    }
}

package com.hao.leaselock.common.constants;

/**
 * 租约锁默认参数常量
 *
 * 类职责：
 * 集中管理租约锁的默认值，避免魔法数字散落在客户端、配置与测试中。
 *
 * 使用说明：
 * 配置项未显式设置时，由 LeaseLockConfig 与 AcquireLockOptions 回落到这里的值。
 */
public class LeaseLockConstants {

    /**
     * 锁键默认前缀
     * 最终键形如 lease:lock:{shardKey}:name，花括号内为集群 Hash Tag
     */
    public static final String DEFAULT_KEY_PREFIX = "lease:lock:";

    /**
     * 默认租约时长（秒），同时作为 Redis 键的 TTL
     */
    public static final int DEFAULT_LEASE_DURATION_SECONDS = 60;

    /**
     * 默认获取超时（毫秒），0 表示只尝试一次
     */
    public static final long DEFAULT_TIMEOUT_MILLIS = 0L;

    /**
     * 默认重试间隔（毫秒）
     */
    public static final long DEFAULT_RETRY_WAIT_MILLIS = 1000L;

    /**
     * 自动续期周期占租约时长的分母：每 1/3 租约续期一次
     */
    public static final int RENEWAL_FRACTION = 3;

    /**
     * 自动续期最小间隔（毫秒），防止续期调用过慢时出现忙等
     */
    public static final long DEFAULT_MIN_RENEW_INTERVAL_MILLIS = 100L;

    /**
     * 续期调度线程池默认大小
     */
    public static final int DEFAULT_RENEWAL_POOL_SIZE = 2;

    private LeaseLockConstants() {
        // 禁止实例化
    }
}

package com.hao.leaselock.integration.lock;

import com.hao.leaselock.common.constants.LeaseLockConstants;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 获取锁参数
 * <p>
 * 每次获取调用独立的一组配置，字段合法性在 {@link LockClient} 获取时统一校验。
 */
@Data
@NoArgsConstructor
public class AcquireLockOptions {

    /**
     * 路由键，存储据此定位锁条目
     */
    private String shardKey;

    /**
     * 锁名，分片内唯一
     */
    private String name;

    /**
     * 租约时长（秒），即锁条目 TTL，存储只支持秒级精度
     */
    private int leaseDurationSeconds = LeaseLockConstants.DEFAULT_LEASE_DURATION_SECONDS;

    /**
     * 获取重试的总时长（毫秒），0 表示只尝试一次
     */
    private long timeoutMillis = LeaseLockConstants.DEFAULT_TIMEOUT_MILLIS;

    /**
     * 两次获取尝试之间的等待（毫秒）
     */
    private long retryWaitMillis = LeaseLockConstants.DEFAULT_RETRY_WAIT_MILLIS;

    /**
     * 是否在获取成功后启动后台自动续期
     */
    private boolean autoRenew;

    public AcquireLockOptions(String shardKey, String name) {
        this.shardKey = shardKey;
        this.name = name;
    }
}

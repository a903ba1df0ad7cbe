package com.hao.leaselock.config;

import com.hao.leaselock.common.constants.LeaseLockConstants;
import com.hao.leaselock.common.enums.ConsistencyLevel;
import com.hao.leaselock.integration.lock.LockClient;
import com.hao.leaselock.integration.store.LeaseStore;
import com.hao.leaselock.integration.store.RedisLeaseStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;

/**
 * 租约锁配置类
 *
 * 类职责：
 * 组装租约存储、续期线程池与锁客户端。
 *
 * 核心实现思路：
 * - lease.lock.* 配置通过 @Value 读取并带默认值。
 * - 线程池由容器管理生命周期，客户端不负责关闭它。
 */
@Slf4j
@Configuration
public class LeaseLockConfig {

    @Value("${lease.lock.key-prefix:" + LeaseLockConstants.DEFAULT_KEY_PREFIX + "}")
    private String keyPrefix;

    @Value("${lease.lock.consistency-level:}")
    private String consistencyLevel;

    @Value("${lease.lock.renewal.pool-size:" + LeaseLockConstants.DEFAULT_RENEWAL_POOL_SIZE + "}")
    private int renewalPoolSize;

    @Value("${lease.lock.renewal.min-interval-millis:" + LeaseLockConstants.DEFAULT_MIN_RENEW_INTERVAL_MILLIS + "}")
    private long minRenewIntervalMillis;

    @Bean
    public LeaseStore leaseStore(StringRedisTemplate stringRedisTemplate) {
        ConsistencyLevel clientLevel = ConsistencyLevel.parse(consistencyLevel);
        log.info("租约存储初始化|Lease_store_init,keyPrefix={},clientConsistencyLevel={}", keyPrefix, clientLevel);
        return new RedisLeaseStore(stringRedisTemplate, keyPrefix, clientLevel);
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService leaseRenewalScheduler() {
        return LockClient.newScheduler(renewalPoolSize);
    }

    @Bean(destroyMethod = "close")
    public LockClient lockClient(LeaseStore leaseStore, ScheduledExecutorService leaseRenewalScheduler) {
        return new LockClient(leaseStore, Clock.systemUTC(), leaseRenewalScheduler, minRenewIntervalMillis);
    }
}

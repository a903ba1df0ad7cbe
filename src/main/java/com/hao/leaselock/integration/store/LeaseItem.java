package com.hao.leaselock.integration.store;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 锁条目
 * <p>
 * 写入存储的值对象：由 (shardKey, name) 定位，leaseDurationSeconds 作为条目 TTL。
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class LeaseItem {

    /**
     * 路由键，存储据此定位条目所在分片
     */
    private final String shardKey;

    /**
     * 锁名，分片内唯一
     */
    private final String name;

    /**
     * 租约时长（秒）
     */
    private final int leaseDurationSeconds;
}

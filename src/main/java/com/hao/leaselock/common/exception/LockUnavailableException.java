package com.hao.leaselock.common.exception;

import lombok.Getter;

/**
 * 锁不可用异常
 *
 * 类职责：
 * 在获取超时内始终未能创建锁条目时抛出，表示锁仍被其他持有者占用。
 *
 * 设计目的：
 * 1. 与存储层异常区分：调用方只需关心“没拿到锁”，无需理解底层冲突细节。
 * 2. 通过 cause 保留最后一次冲突，便于排查是谁占用了锁。
 *
 * 实现思路：
 * - 继承 RuntimeException，业务层可按需捕获。
 * - 记录 shardKey 与 name，便于日志与监控按锁维度聚合。
 */
@Getter
public class LockUnavailableException extends RuntimeException {

    private final String shardKey;
    private final String name;

    public LockUnavailableException(String shardKey, String name, Throwable cause) {
        super(String.format("分布式锁不可用: shardKey=%s, name=%s", shardKey, name), cause);
        this.shardKey = shardKey;
        this.name = name;
    }
}

package com.hao.leaselock.common.exception;

import lombok.Getter;

/**
 * 锁已释放异常
 *
 * 类职责：
 * 续期时发现锁条目已不存在（过期/被删除）或版本令牌不匹配（已被他人重新获取）时抛出。
 *
 * 为什么需要该类：
 * 这是该锁句柄的终态信号，调用方收到后不应再继续续期，而应重新获取新锁。
 */
@Getter
public class LockReleasedException extends RuntimeException {

    private final String shardKey;
    private final String name;

    public LockReleasedException(String shardKey, String name, Throwable cause) {
        super(String.format("分布式锁已释放或过期: shardKey=%s, name=%s", shardKey, name), cause);
        this.shardKey = shardKey;
        this.name = name;
    }
}

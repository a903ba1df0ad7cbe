package com.hao.leaselock.integration.store;

import lombok.Getter;

/**
 * 存储层语义异常基类
 *
 * 类职责：
 * 存储适配器把底层传输异常翻译成有限的语义类型后抛出，锁协议只针对这些类型分支。
 *
 * 设计目的：
 * 1. 锁协议核心不感知 Redis 返回码、Lua 脚本结果等实现细节。
 * 2. 未被翻译的底层异常（连接超时等）保持原样向上传播。
 */
@Getter
public abstract class LeaseStoreException extends RuntimeException {

    /**
     * 发生冲突的存储键
     */
    private final String key;

    protected LeaseStoreException(String key, String message) {
        super(message);
        this.key = key;
    }
}

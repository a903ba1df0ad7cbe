package com.hao.leaselock.common.exception;

import com.hao.leaselock.common.enums.ConsistencyLevel;
import lombok.Getter;

/**
 * 一致性级别不满足异常
 *
 * 类职责：
 * 锁客户端构造时发现存储的有效一致性级别不是 STRONG，立即失败。
 *
 * 设计目的：
 * 弱一致存储上的条件写无法保证互斥，宁可启动失败也不能带病运行。
 */
@Getter
public class ConsistencyLevelException extends RuntimeException {

    private final ConsistencyLevel level;

    public ConsistencyLevelException(ConsistencyLevel level) {
        this(level, null);
    }

    public ConsistencyLevelException(ConsistencyLevel level, Throwable cause) {
        super(String.format("不支持一致性级别 \"%s\"，请使用 STRONG", level), cause);
        this.level = level;
    }
}

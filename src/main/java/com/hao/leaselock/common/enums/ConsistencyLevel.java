package com.hao.leaselock.common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * 存储一致性级别枚举
 *
 * 类职责：
 * 描述后端存储可提供的读写一致性强弱，供一致性守卫判定是否满足互斥要求。
 *
 * 设计目的：
 * 1. 用统一的强弱序列比较“客户端期望级别”与“部署实际级别”。
 * 2. 屏蔽具体存储的术语差异（如 Redis 的主从异步复制）。
 *
 * 为什么需要该类：
 * 租约锁的正确性依赖线性一致的条件写，只有 STRONG 级别可以安全使用。
 *
 * 核心实现思路：
 * - strength 数值越大表示一致性越强。
 * - 提供 isStrongerThan 与宽松解析方法，便于配置读取。
 */
@Getter
@AllArgsConstructor
public enum ConsistencyLevel {

    /**
     * 强一致：所有读取都能看到最近一次成功写入
     * Redis 场景：单主无副本，或集群中每个槽只有主节点
     */
    STRONG(5, "强一致"),

    /**
     * 有界过期：读取可能落后，但落后程度有上限
     * Redis 场景：主节点挂有异步副本，故障切换可能丢失已确认写
     */
    BOUNDED_STALENESS(4, "有界过期"),

    /**
     * 会话一致：同一会话内读己之写
     */
    SESSION(3, "会话一致"),

    /**
     * 一致前缀：读取到的写入顺序不会乱序
     */
    CONSISTENT_PREFIX(2, "一致前缀"),

    /**
     * 最终一致
     * Redis 场景：客户端直接连接到只读副本
     */
    EVENTUAL(1, "最终一致");

    private final int strength;
    private final String desc;

    /**
     * 判断当前级别是否严格强于另一级别
     *
     * @param other 对比级别
     * @return 当前级别更强时返回 true
     */
    public boolean isStrongerThan(ConsistencyLevel other) {
        return other != null && this.strength > other.strength;
    }

    /**
     * 宽松解析配置值
     *
     * 实现逻辑：
     * 1. 空白值视为未配置，返回 null。
     * 2. 忽略大小写，并把中划线视为下划线（bounded-staleness）。
     *
     * @param raw 配置原文
     * @return 对应枚举，未配置时为 null
     */
    public static ConsistencyLevel parse(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return ConsistencyLevel.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("不支持的一致性级别: " + raw, e);
        }
    }
}

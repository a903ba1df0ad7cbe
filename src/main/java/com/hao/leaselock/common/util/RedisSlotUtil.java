package com.hao.leaselock.common.util;

import io.lettuce.core.codec.CRC16;

import java.nio.charset.StandardCharsets;

/**
 * Redis 集群槽位计算工具类
 *
 * 类职责：
 * 负责把锁的 shardKey 包装成 Hash Tag，并计算锁键所属的哈希槽 (Slot)。
 *
 * 设计目的：
 * 1. 同一 shardKey 下的所有锁落在同一槽位，即同一个主节点上。
 * 2. 计算方式与 Redis 服务端一致，日志中输出的槽位可直接对照 CLUSTER KEYSLOT。
 *
 * 核心算法：
 * Slot = CRC16(hashTag 或 key) % 16384
 */
public class RedisSlotUtil {

    /**
     * Redis 集群总槽位数
     */
    public static final int CLUSTER_SLOTS = 16384;

    private RedisSlotUtil() {
        // 工具类禁止实例化
    }

    /**
     * 把路由键包装成 Hash Tag
     *
     * 实现逻辑：
     * 1. 转义路由键：反斜杠写成 \\，左花括号写成 \(，右花括号写成 \)。
     *    转义后不含花括号，Tag 不会被截断，且不同路由键得到不同的 Tag。
     * 2. 用 {...} 包裹，Redis 只会对花括号内的部分计算槽位。
     *
     * @param shardKey 路由键
     * @return 形如 {shardKey} 的 Hash Tag
     */
    public static String hashTag(String shardKey) {
        StringBuilder tag = new StringBuilder(shardKey.length() + 2).append('{');
        for (int i = 0; i < shardKey.length(); i++) {
            char c = shardKey.charAt(i);
            switch (c) {
                case '\\' -> tag.append("\\\\");
                case '{' -> tag.append("\\(");
                case '}' -> tag.append("\\)");
                default -> tag.append(c);
            }
        }
        return tag.append('}').toString();
    }

    /**
     * 计算 Key 对应的 Slot
     *
     * 实现逻辑：
     * 1. 处理 Hash Tag：如果 Key 包含非空的 {...}，仅计算第一个花括号内的部分。
     * 2. 使用 CRC16 算法计算校验和并对 16384 取模。
     *
     * @param key Redis Key
     * @return Slot ID (0 - 16383)
     */
    public static int getSlot(String key) {
        if (key == null) {
            return 0;
        }

        // 例如 "lease:lock:{orders}:sync" -> 计算 "orders"
        int start = key.indexOf('{');
        if (start != -1) {
            int end = key.indexOf('}', start + 1);
            if (end != -1 && end > start + 1) {
                key = key.substring(start + 1, end);
            }
        }

        // Lettuce 提供了标准的 CRC16 实现，直接复用
        return CRC16.crc16(key.getBytes(StandardCharsets.UTF_8)) % CLUSTER_SLOTS;
    }
}

package com.hao.leaselock.integration.store;

import com.hao.leaselock.common.enums.ConsistencyLevel;

import java.util.Optional;

/**
 * 租约存储适配器接口
 *
 * 类职责：
 * 定义锁协议对后端存储的全部要求：带 TTL 的条件创建、基于版本令牌的条件替换与条件删除，
 * 以及一致性级别查询。
 *
 * 设计目的：
 * 1. 锁协议与具体存储解耦，便于从 Redis 切换到其他支持条件写的存储。
 * 2. 所有语义失败以 {@link LeaseStoreException} 子类表达，其余异常原样传播。
 *
 * 存储必须保证：
 * - 条目在最后一次成功创建/替换后 leaseDurationSeconds 秒自动删除，与客户端无关。
 * - 成功替换会重置条目的 TTL 计时。
 */
public interface LeaseStore {

    /**
     * 条件创建
     *
     * @param item 锁条目
     * @return 新的版本令牌
     * @throws ItemAlreadyExistsException 同键条目存在且未过期
     */
    String create(LeaseItem item);

    /**
     * 条件替换（续期）
     *
     * @param item 锁条目
     * @param expectedToken 期望的当前版本令牌
     * @return 新的版本令牌
     * @throws ItemNotFoundException 条目不存在
     * @throws VersionMismatchException 版本令牌不匹配
     */
    String replace(LeaseItem item, String expectedToken);

    /**
     * 条件删除（释放）
     *
     * @param item 锁条目
     * @param expectedToken 期望的当前版本令牌
     * @throws ItemNotFoundException 条目不存在
     * @throws VersionMismatchException 版本令牌不匹配
     */
    void delete(LeaseItem item, String expectedToken);

    /**
     * 查询部署本身的默认一致性级别
     *
     * @return 部署级别
     * @throws ConsistencyLevelNotSupportedException 客户端覆盖级别高于部署可提供的级别
     */
    ConsistencyLevel queryConsistencyLevel();

    /**
     * 客户端侧配置的一致性级别覆盖
     *
     * @return 覆盖级别，未配置时为空
     */
    Optional<ConsistencyLevel> clientConsistencyLevel();
}

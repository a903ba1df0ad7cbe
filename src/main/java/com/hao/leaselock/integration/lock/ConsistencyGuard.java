package com.hao.leaselock.integration.lock;

import com.hao.leaselock.common.enums.ConsistencyLevel;
import com.hao.leaselock.common.exception.ConsistencyLevelException;
import com.hao.leaselock.integration.store.ConsistencyLevelNotSupportedException;
import com.hao.leaselock.integration.store.LeaseStore;
import lombok.extern.slf4j.Slf4j;

/**
 * 一致性守卫
 *
 * 类职责：
 * 在锁客户端构造时校验存储的有效一致性级别，不是 STRONG 则立即失败。
 *
 * 设计目的：
 * 1. 客户端覆盖级别优先，其次是部署默认级别。
 * 2. “客户端级别高于部署支持级别”属于可预期情况，统一映射为 ConsistencyLevelException。
 *
 * 为什么需要该类：
 * 存储通常不允许客户端把一致性提升到部署级别之上，无法强制，只能检查并拒绝。
 */
@Slf4j
final class ConsistencyGuard {

    private ConsistencyGuard() {
    }

    /**
     * 校验存储一致性级别
     *
     * 实现逻辑：
     * 1. 查询部署级别，捕获“客户端级别过高”异常并映射。
     * 2. 取客户端覆盖级别或部署级别作为有效级别。
     * 3. 有效级别不是 STRONG 时抛出异常。
     *
     * @param store 租约存储
     */
    static void check(LeaseStore store) {
        ConsistencyLevel clientLevel = store.clientConsistencyLevel().orElse(null);
        ConsistencyLevel deploymentLevel;
        try {
            deploymentLevel = store.queryConsistencyLevel();
        } catch (ConsistencyLevelNotSupportedException e) {
            log.error("客户端一致性级别超出部署能力|Client_consistency_exceeds_deployment,requested={},supported={}",
                    e.getRequested(), e.getSupported());
            throw new ConsistencyLevelException(clientLevel != null ? clientLevel : e.getRequested(), e);
        }

        ConsistencyLevel effective = clientLevel != null ? clientLevel : deploymentLevel;
        if (effective != ConsistencyLevel.STRONG) {
            log.error("一致性级别不满足互斥要求|Consistency_level_rejected,level={}", effective);
            throw new ConsistencyLevelException(effective);
        }
        log.info("一致性级别校验通过|Consistency_level_accepted,level={}", effective);
    }
}

package com.hao.leaselock.integration.store;

import com.hao.leaselock.common.enums.ConsistencyLevel;
import lombok.Getter;

/**
 * 客户端配置的一致性级别高于部署所能提供的级别
 */
@Getter
public class ConsistencyLevelNotSupportedException extends RuntimeException {

    private final ConsistencyLevel requested;
    private final ConsistencyLevel supported;

    public ConsistencyLevelNotSupportedException(ConsistencyLevel requested, ConsistencyLevel supported) {
        super(String.format("客户端一致性级别 %s 高于部署支持的级别 %s", requested, supported));
        this.requested = requested;
        this.supported = supported;
    }
}

package com.hao.leaselock.integration.store;

/**
 * 版本令牌不匹配：条目存在，但已被其他持有者重新写入
 */
public class VersionMismatchException extends LeaseStoreException {

    public VersionMismatchException(String key) {
        super(key, "锁条目版本不匹配: " + key);
    }
}

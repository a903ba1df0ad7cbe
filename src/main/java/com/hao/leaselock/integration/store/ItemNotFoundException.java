package com.hao.leaselock.integration.store;

/**
 * 条目不存在：已过期、已删除或从未创建
 */
public class ItemNotFoundException extends LeaseStoreException {

    public ItemNotFoundException(String key) {
        super(key, "锁条目不存在: " + key);
    }
}

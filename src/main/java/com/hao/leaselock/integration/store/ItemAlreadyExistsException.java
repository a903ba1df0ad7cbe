package com.hao.leaselock.integration.store;

/**
 * 条目已存在：创建时发现同键且未过期的条目
 */
public class ItemAlreadyExistsException extends LeaseStoreException {

    public ItemAlreadyExistsException(String key) {
        super(key, "锁条目已存在: " + key);
    }
}

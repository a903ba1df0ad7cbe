package com.hao.leaselock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 租约锁示例应用启动入口
 *
 * 核心实现思路：
 * - @SpringBootApplication 完成自动配置与组件扫描，装配 Redis 连接、租约存储与锁客户端。
 */
@SpringBootApplication
public class LeaseLockApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaseLockApplication.class, args);
    }
}

package com.hao.leaselock.config;

import io.lettuce.core.api.StatefulConnection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisClusterConfiguration;
import org.springframework.data.redis.connection.RedisConfiguration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis 连接配置类
 * <p>
 * 类职责：
 * 构建 Lettuce 连接工厂与 StringRedisTemplate，供租约存储使用。
 *
 * 设计目的：
 * 1. 同时支持单机与集群：配置了 cluster.nodes 即走集群，否则走单机。
 * 2. 连接池参数统一从 spring.data.redis.lettuce.pool 读取。
 *
 * 核心实现思路：
 * - 读取 RedisProperties 组装连接配置与连接池配置。
 * - 锁的条件写依赖同一连接上的原子脚本，不需要关闭连接共享。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    /**
     * 创建并配置 Lettuce 连接工厂
     *
     * 实现逻辑：
     * 1. 根据是否配置集群节点选择集群或单机配置。
     * 2. 组装连接池与命令超时，构建客户端配置。
     * 3. 实例化连接工厂。
     *
     * @return 连接工厂
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        RedisConfiguration config = buildServerConfiguration();

        // Lettuce 使用 Commons-Pool2 管理连接
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        RedisProperties.Pool pool = redisProperties.getLettuce().getPool();
        if (pool != null) {
            poolConfig.setMaxTotal(pool.getMaxActive());
            poolConfig.setMaxIdle(pool.getMaxIdle());
            poolConfig.setMinIdle(pool.getMinIdle());
            if (pool.getMaxWait() != null) {
                poolConfig.setMaxWait(pool.getMaxWait());
            }
        }

        Duration timeout = redisProperties.getTimeout() != null ? redisProperties.getTimeout() : Duration.ofSeconds(5);

        LettuceClientConfiguration clientConfiguration = LettucePoolingClientConfiguration.builder()
                .commandTimeout(timeout)
                .poolConfig(poolConfig)
                .build();

        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(config, clientConfiguration);
        connectionFactory.setValidateConnection(true);
        log.info("Redis连接工厂创建完成|Redis_factory_created,mode={},poolMax={},timeout={}",
                config instanceof RedisClusterConfiguration ? "cluster" : "standalone",
                poolConfig.getMaxTotal(), timeout);
        return connectionFactory;
    }

    /**
     * 配置 StringRedisTemplate，键值都按字符串序列化，锁令牌即字符串值
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.afterPropertiesSet();
        log.info("StringRedisTemplate初始化完成|StringRedisTemplate_init_done");
        return template;
    }

    private RedisConfiguration buildServerConfiguration() {
        RedisProperties.Cluster cluster = redisProperties.getCluster();
        if (cluster != null && !CollectionUtils.isEmpty(cluster.getNodes())) {
            RedisClusterConfiguration config = new RedisClusterConfiguration(cluster.getNodes());
            // 防止集群拓扑变更时无限重定向
            if (cluster.getMaxRedirects() != null) {
                config.setMaxRedirects(cluster.getMaxRedirects());
            }
            if (StringUtils.hasText(redisProperties.getPassword())) {
                config.setPassword(redisProperties.getPassword());
            }
            log.info("使用Redis集群模式|Redis_cluster_mode,nodes={}", cluster.getNodes());
            return config;
        }

        RedisStandaloneConfiguration config =
                new RedisStandaloneConfiguration(redisProperties.getHost(), redisProperties.getPort());
        config.setDatabase(redisProperties.getDatabase());
        if (StringUtils.hasText(redisProperties.getUsername())) {
            config.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            config.setPassword(redisProperties.getPassword());
        }
        log.info("使用Redis单机模式|Redis_standalone_mode,host={},port={},database={}",
                redisProperties.getHost(), redisProperties.getPort(), redisProperties.getDatabase());
        return config;
    }
}

package com.hao.leaselock.integration.store;

import com.hao.leaselock.common.enums.ConsistencyLevel;
import com.hao.leaselock.common.util.RedisSlotUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisClusterConnection;
import org.springframework.data.redis.connection.RedisClusterNode;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.UUID;

/**
 * 基于 Redis 的租约存储适配器
 *
 * 类职责：
 * 用 StringRedisTemplate 实现 {@link LeaseStore} 的条件写与 TTL 语义，并推导部署的一致性级别。
 *
 * 设计目的：
 * 1. 创建使用 SET NX EX，一条命令完成“不存在才写 + 设置 TTL”。
 * 2. 替换与删除使用 Lua 脚本，比较版本令牌与写入在服务端原子完成。
 * 3. 把脚本返回码翻译成语义异常，锁协议层不再关心 Redis 细节。
 *
 * 为什么需要该类：
 * Redis 本身没有版本号概念，需要用随机令牌作为键值来模拟乐观并发控制。
 *
 * 核心实现思路：
 * - 键：{keyPrefix}{shardKey}:{name}，shardKey 转义后作为 Hash Tag 决定槽位。
 * - 值：每次写入生成的新 UUID 即版本令牌。
 * - 脚本返回 1 成功、0 条目不存在、-1 令牌不匹配。
 * - 连接异常等 DataAccessException 不做翻译，原样上抛。
 */
@Slf4j
public class RedisLeaseStore implements LeaseStore {

    static final long SCRIPT_OK = 1L;
    static final long SCRIPT_MISSING = 0L;
    static final long SCRIPT_MISMATCH = -1L;

    // Lua 脚本：比较令牌后覆盖写入并重置 TTL
    // KEYS[1]: 锁键
    // ARGV[1]: 期望令牌
    // ARGV[2]: 新令牌
    // ARGV[3]: TTL(秒)
    private static final String REPLACE_SCRIPT_TEXT =
            "local current = redis.call('GET', KEYS[1]) " +
            "if not current then " +
            "    return 0 " +
            "end " +
            "if current ~= ARGV[1] then " +
            "    return -1 " +
            "end " +
            "redis.call('SET', KEYS[1], ARGV[2], 'EX', tonumber(ARGV[3])) " +
            "return 1";

    // Lua 脚本：比较令牌后删除
    // KEYS[1]: 锁键
    // ARGV[1]: 期望令牌
    private static final String DELETE_SCRIPT_TEXT =
            "local current = redis.call('GET', KEYS[1]) " +
            "if not current then " +
            "    return 0 " +
            "end " +
            "if current ~= ARGV[1] then " +
            "    return -1 " +
            "end " +
            "redis.call('DEL', KEYS[1]) " +
            "return 1";

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final ConsistencyLevel clientLevel;
    private final DefaultRedisScript<Long> replaceScript;
    private final DefaultRedisScript<Long> deleteScript;

    /**
     * Redis 租约存储构造方法
     *
     * 实现逻辑：
     * 1. 校验并保存模板与键前缀。
     * 2. 初始化替换与删除脚本并设置返回类型。
     *
     * @param redisTemplate Redis 模板
     * @param keyPrefix 锁键前缀
     * @param clientLevel 客户端一致性级别覆盖，可为 null
     */
    public RedisLeaseStore(StringRedisTemplate redisTemplate, String keyPrefix, ConsistencyLevel clientLevel) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate 不能为空");
        if (!StringUtils.hasText(keyPrefix)) {
            throw new IllegalArgumentException("keyPrefix 不能为空");
        }
        this.keyPrefix = keyPrefix;
        this.clientLevel = clientLevel;
        this.replaceScript = new DefaultRedisScript<>(REPLACE_SCRIPT_TEXT, Long.class);
        this.deleteScript = new DefaultRedisScript<>(DELETE_SCRIPT_TEXT, Long.class);
    }

    /** 条件创建：SET key token NX EX ttl。 */
    @Override
    public String create(LeaseItem item) {
        String key = lockKey(item);
        String token = newToken();
        Boolean created = redisTemplate.opsForValue()
                .setIfAbsent(key, token, Duration.ofSeconds(item.getLeaseDurationSeconds()));
        if (!Boolean.TRUE.equals(created)) {
            throw new ItemAlreadyExistsException(key);
        }
        log.debug("锁条目创建成功|Lease_item_created,key={},slot={},ttlSeconds={}",
                key, RedisSlotUtil.getSlot(key), item.getLeaseDurationSeconds());
        return token;
    }

    /** 条件替换：令牌一致时写入新令牌并重置 TTL。 */
    @Override
    public String replace(LeaseItem item, String expectedToken) {
        String key = lockKey(item);
        String token = newToken();
        Long result = redisTemplate.execute(
                replaceScript,
                Collections.singletonList(key),
                nullToEmpty(expectedToken),
                token,
                String.valueOf(item.getLeaseDurationSeconds())
        );
        checkScriptResult(result, key);
        return token;
    }

    /** 条件删除：令牌一致时删除条目。 */
    @Override
    public void delete(LeaseItem item, String expectedToken) {
        String key = lockKey(item);
        Long result = redisTemplate.execute(
                deleteScript,
                Collections.singletonList(key),
                nullToEmpty(expectedToken)
        );
        checkScriptResult(result, key);
    }

    /**
     * 查询部署一致性级别
     *
     * 实现逻辑：
     * 1. 根据拓扑推导部署能提供的级别。
     * 2. 客户端覆盖级别高于部署级别时，抛出不支持异常。
     *
     * @return 部署级别
     */
    @Override
    public ConsistencyLevel queryConsistencyLevel() {
        ConsistencyLevel deploymentLevel = probeDeploymentLevel();
        if (clientLevel != null && clientLevel.isStrongerThan(deploymentLevel)) {
            throw new ConsistencyLevelNotSupportedException(clientLevel, deploymentLevel);
        }
        return deploymentLevel;
    }

    @Override
    public Optional<ConsistencyLevel> clientConsistencyLevel() {
        return Optional.ofNullable(clientLevel);
    }

    /**
     * 构造锁键
     *
     * @param item 锁条目
     * @return 形如 lease:lock:{shardKey}:name 的完整键
     */
    public String lockKey(LeaseItem item) {
        return keyPrefix + RedisSlotUtil.hashTag(item.getShardKey()) + ":" + item.getName();
    }

    /**
     * 推导部署一致性级别
     *
     * 实现逻辑：
     * 1. 集群模式：任一槽存在异步副本即为 BOUNDED_STALENESS，否则 STRONG。
     * 2. 单机模式：读取 INFO replication，连接到副本为 EVENTUAL，
     *    主节点挂有副本为 BOUNDED_STALENESS，无副本为 STRONG。
     *
     * @return 推导出的级别
     */
    private ConsistencyLevel probeDeploymentLevel() {
        RedisConnectionFactory factory = redisTemplate.getConnectionFactory();
        if (factory instanceof LettuceConnectionFactory lettuceFactory && lettuceFactory.isClusterAware()) {
            return probeClusterLevel(lettuceFactory);
        }

        Properties replication = redisTemplate.execute(
                (RedisCallback<Properties>) connection -> connection.serverCommands().info("replication"));
        if (replication == null) {
            log.warn("无法读取复制信息_按最终一致处理|Replication_info_unavailable_treat_as_eventual");
            return ConsistencyLevel.EVENTUAL;
        }

        String role = replication.getProperty("role", "master");
        int replicas = parseInt(replication.getProperty("connected_slaves"));
        log.info("Redis复制拓扑|Redis_replication_topology,role={},connectedReplicas={}", role, replicas);

        if (!"master".equalsIgnoreCase(role)) {
            return ConsistencyLevel.EVENTUAL;
        }
        return replicas > 0 ? ConsistencyLevel.BOUNDED_STALENESS : ConsistencyLevel.STRONG;
    }

    private ConsistencyLevel probeClusterLevel(LettuceConnectionFactory factory) {
        try (RedisClusterConnection connection = factory.getClusterConnection()) {
            int masters = 0;
            int replicas = 0;
            for (RedisClusterNode node : connection.clusterGetNodes()) {
                if (node.isReplica()) {
                    replicas++;
                } else {
                    masters++;
                }
            }
            log.info("Redis集群拓扑|Redis_cluster_topology,masters={},replicas={}", masters, replicas);
            return replicas > 0 ? ConsistencyLevel.BOUNDED_STALENESS : ConsistencyLevel.STRONG;
        }
    }

    private void checkScriptResult(Long result, String key) {
        if (result == null) {
            throw new IllegalStateException("锁脚本返回空结果: " + key);
        }
        if (result == SCRIPT_OK) {
            return;
        }
        if (result == SCRIPT_MISSING) {
            throw new ItemNotFoundException(key);
        }
        if (result == SCRIPT_MISMATCH) {
            throw new VersionMismatchException(key);
        }
        throw new IllegalStateException("锁脚本返回未知结果: " + result + ", key=" + key);
    }

    private static String newToken() {
        return UUID.randomUUID().toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static int parseInt(String value) {
        if (!StringUtils.hasText(value) || !value.trim().chars().allMatch(Character::isDigit)) {
            return 0;
        }
        return Integer.parseInt(value.trim());
    }
}

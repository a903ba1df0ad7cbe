package com.hao.leaselock.integration.store;

import com.hao.leaselock.common.enums.ConsistencyLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisClusterConnection;
import org.springframework.data.redis.connection.RedisClusterNode;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis 租约存储适配器测试
 *
 * 测试目的：
 * 1. 验证键格式、SET NX EX 参数与 Lua 脚本参数。
 * 2. 验证脚本返回码到语义异常的映射。
 * 3. 验证单机与集群拓扑下的一致性级别推导。
 *
 * 设计思路：
 * - 使用 Mockito 模拟 StringRedisTemplate，不依赖真实 Redis。
 */
@ExtendWith(MockitoExtension.class)
class RedisLeaseStoreTest {

    private static final String KEY = "lease:lock:{orders}:sync";
    private static final LeaseItem ITEM = new LeaseItem("orders", "sync", 30);

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisLeaseStore store() {
        return new RedisLeaseStore(redisTemplate, "lease:lock:", null);
    }

    @Test
    @DisplayName("锁键使用shardKey作为HashTag")
    void lockKeyUsesHashTag() {
        assertEquals(KEY, store().lockKey(ITEM));
        assertEquals("lease:lock:{\\(orders\\)}:sync", store().lockKey(new LeaseItem("{orders}", "sync", 30)));
    }

    @Test
    @DisplayName("含花括号的shardKey不会与其他锁键重合")
    void lockKeysOfDistinctShardKeysDiffer() {
        RedisLeaseStore store = store();

        assertNotEquals(store.lockKey(new LeaseItem("a{b}", "x", 5)), store.lockKey(new LeaseItem("ab", "x", 5)));
        assertNotEquals(store.lockKey(new LeaseItem("a}:{b", "x", 5)), store.lockKey(new LeaseItem("a", "b}:x", 5)));
    }

    @Test
    @DisplayName("创建成功时写入并返回新令牌")
    void createWritesTokenWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(Duration.ofSeconds(30)))).thenReturn(true);

        String token = store().create(ITEM);

        ArgumentCaptor<String> written = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).setIfAbsent(eq(KEY), written.capture(), eq(Duration.ofSeconds(30)));
        assertEquals(written.getValue(), token);
    }

    @Test
    @DisplayName("条目已存在时创建失败")
    void createConflict() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(Duration.ofSeconds(30)))).thenReturn(false);

        ItemAlreadyExistsException ex = assertThrows(ItemAlreadyExistsException.class, () -> store().create(ITEM));

        assertEquals(KEY, ex.getKey());
    }

    @Test
    @DisplayName("连接异常原样上抛")
    void createConnectionFailurePropagates() {
        RedisConnectionFailureException failure = new RedisConnectionFailureException("connection refused");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq(KEY), anyString(), eq(Duration.ofSeconds(30)))).thenThrow(failure);

        RuntimeException ex = assertThrows(RuntimeException.class, () -> store().create(ITEM));

        assertSame(failure, ex);
    }

    @Test
    @DisplayName("替换成功返回新令牌")
    void replaceSuccess() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)),
                eq("old-token"), anyString(), eq("30"))).thenReturn(RedisLeaseStore.SCRIPT_OK);

        String token = store().replace(ITEM, "old-token");

        assertNotNull(token);
        assertNotEquals("old-token", token);
    }

    @Test
    @DisplayName("替换时条目不存在或令牌不匹配")
    void replaceFailures() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)),
                anyString(), anyString(), anyString()))
                .thenReturn(RedisLeaseStore.SCRIPT_MISSING, RedisLeaseStore.SCRIPT_MISMATCH);

        assertThrows(ItemNotFoundException.class, () -> store().replace(ITEM, "old-token"));
        assertThrows(VersionMismatchException.class, () -> store().replace(ITEM, "old-token"));
    }

    @Test
    @DisplayName("删除返回码映射")
    void deleteResults() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(KEY)), eq("token")))
                .thenReturn(RedisLeaseStore.SCRIPT_OK, RedisLeaseStore.SCRIPT_MISSING,
                        RedisLeaseStore.SCRIPT_MISMATCH, null);

        RedisLeaseStore store = store();
        assertDoesNotThrow(() -> store.delete(ITEM, "token"));
        assertThrows(ItemNotFoundException.class, () -> store.delete(ITEM, "token"));
        assertThrows(VersionMismatchException.class, () -> store.delete(ITEM, "token"));
        assertThrows(IllegalStateException.class, () -> store.delete(ITEM, "token"));
    }

    @Test
    @DisplayName("单机无副本为强一致")
    void standaloneWithoutReplicasIsStrong() {
        stubReplicationInfo("master", "0");

        assertEquals(ConsistencyLevel.STRONG, store().queryConsistencyLevel());
    }

    @Test
    @DisplayName("主节点挂有副本为有界过期")
    void masterWithReplicasIsBoundedStaleness() {
        stubReplicationInfo("master", "2");

        assertEquals(ConsistencyLevel.BOUNDED_STALENESS, store().queryConsistencyLevel());
    }

    @Test
    @DisplayName("连接到副本为最终一致")
    void replicaConnectionIsEventual() {
        stubReplicationInfo("slave", "0");

        assertEquals(ConsistencyLevel.EVENTUAL, store().queryConsistencyLevel());
    }

    @Test
    @DisplayName("客户端级别高于部署级别时抛出不支持异常")
    void clientLevelAboveDeploymentRejected() {
        stubReplicationInfo("master", "1");
        RedisLeaseStore store = new RedisLeaseStore(redisTemplate, "lease:lock:", ConsistencyLevel.STRONG);

        ConsistencyLevelNotSupportedException ex =
                assertThrows(ConsistencyLevelNotSupportedException.class, store::queryConsistencyLevel);

        assertEquals(ConsistencyLevel.STRONG, ex.getRequested());
        assertEquals(ConsistencyLevel.BOUNDED_STALENESS, ex.getSupported());
        assertEquals(ConsistencyLevel.STRONG, store.clientConsistencyLevel().orElseThrow());
    }

    @Test
    @DisplayName("集群存在副本时为有界过期")
    void clusterWithReplicasIsBoundedStaleness() {
        LettuceConnectionFactory factory = mock(LettuceConnectionFactory.class);
        RedisClusterConnection connection = mock(RedisClusterConnection.class);
        RedisClusterNode master = mock(RedisClusterNode.class);
        RedisClusterNode replica = mock(RedisClusterNode.class);
        when(redisTemplate.getConnectionFactory()).thenReturn(factory);
        when(factory.isClusterAware()).thenReturn(true);
        when(factory.getClusterConnection()).thenReturn(connection);
        when(connection.clusterGetNodes()).thenReturn(List.of(master, replica));
        when(master.isReplica()).thenReturn(false);
        when(replica.isReplica()).thenReturn(true);

        assertEquals(ConsistencyLevel.BOUNDED_STALENESS, store().queryConsistencyLevel());
        verify(connection).close();
    }

    @Test
    @DisplayName("集群只有主节点时为强一致")
    void clusterWithoutReplicasIsStrong() {
        LettuceConnectionFactory factory = mock(LettuceConnectionFactory.class);
        RedisClusterConnection connection = mock(RedisClusterConnection.class);
        RedisClusterNode master = mock(RedisClusterNode.class);
        when(redisTemplate.getConnectionFactory()).thenReturn(factory);
        when(factory.isClusterAware()).thenReturn(true);
        when(factory.getClusterConnection()).thenReturn(connection);
        when(connection.clusterGetNodes()).thenReturn(List.of(master));

        assertEquals(ConsistencyLevel.STRONG, store().queryConsistencyLevel());
    }

    @Test
    @DisplayName("键前缀不能为空")
    void blankPrefixRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RedisLeaseStore(redisTemplate, " ", null));
        assertThrows(NullPointerException.class, () -> new RedisLeaseStore(null, "lease:lock:", null));
    }

    @SuppressWarnings("unchecked")
    private void stubReplicationInfo(String role, String connectedReplicas) {
        Properties info = new Properties();
        info.setProperty("role", role);
        info.setProperty("connected_slaves", connectedReplicas);
        when(redisTemplate.execute(any(RedisCallback.class))).thenReturn(info);
    }
}

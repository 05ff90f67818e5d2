package com.hao.glock.integration.lock.redis;

import com.hao.glock.common.constants.LockConstants;
import com.hao.glock.common.exception.InvalidTtlException;
import com.hao.glock.common.exception.LockHeldByOtherClientException;
import com.hao.glock.common.exception.LockNotOwnedException;
import com.hao.glock.common.exception.LockStoreException;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.core.types.Expiration;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * 基于 Redis 的分布式锁实现
 *
 * 类职责：
 * 通过 SET NX PX、比较删除脚本、比较续期脚本与 MULTI/EXEC 批量读取实现锁协议。
 *
 * 设计目的：
 * 1. 互斥完全依赖 Redis 的原子条件写入，客户端之间不做任何协调。
 * 2. 释放与续期都在服务端先比较 owner 再修改，避免租约过期后误删/误续他人的锁。
 *
 * 核心实现思路：
 * - acquire：SET owner 键 NX PX ttl，成功后写数据键。
 * - release / refresh：执行 {@link RedisLockScripts} 中的原子脚本。
 * - info：MULTI 中依次 GET owner、PTTL owner、GET data，EXEC 一次返回，保证读到同一时刻的状态。
 */
@Slf4j
public class RedisLock implements Lock {

    private static final int INFO_REPLY_SIZE = 3;

    private final String name;
    private final RedisLockClient client;
    private Duration ttl = Duration.ZERO;
    private String data = "";

    RedisLock(String name, RedisLockClient client) {
        this.name = name;
        this.client = client;
    }

    private String ownerKey() {
        return LockConstants.ownerKey(client.getNamespace(), name);
    }

    private String dataKey() {
        return LockConstants.dataKey(client.getNamespace(), name);
    }

    /**
     * 加锁
     *
     * 实现逻辑：
     * 1. 校验 ttl，不合法时直接失败，不访问 Redis。
     * 2. SET owner 键 NX PX，被拒绝说明锁已被持有。
     * 3. 写入数据键；写入失败时用释放脚本回滚 owner 键并抛出存储异常，避免"锁已持有但数据陈旧"。
     */
    @Override
    public void acquire(Duration ttl) {
        if (!LockConstants.isValidTtl(ttl)) {
            throw new InvalidTtlException(ttl);
        }
        StringRedisConnection connection = client.requireConnection();
        String ownerKey = ownerKey();
        String clientId = client.getId();

        Boolean acquired;
        try {
            // SET key value PX ms NX
            acquired = connection.set(ownerKey, clientId, Expiration.milliseconds(ttl.toMillis()), SetOption.SET_IF_ABSENT);
        } catch (DataAccessException e) {
            throw new LockStoreException("加锁失败, lock=" + name, e);
        }
        if (!Boolean.TRUE.equals(acquired)) {
            log.debug("锁已被持有|Lock_held_by_other,key={},clientId={}", ownerKey, clientId);
            throw new LockHeldByOtherClientException(name, clientId);
        }
        this.ttl = ttl;

        try {
            connection.set(dataKey(), data);
        } catch (DataAccessException e) {
            log.warn("锁数据写入失败_回滚加锁|Lock_data_write_fail_rollback,key={},clientId={}", ownerKey, clientId, e);
            rollback(connection, clientId, e);
            throw new LockStoreException("锁数据写入失败, 已回滚加锁, lock=" + name, e);
        }
        log.debug("加锁成功|Lock_acquire_success,key={},clientId={},ttlMs={}", ownerKey, clientId, ttl.toMillis());
    }

    private void rollback(StringRedisConnection connection, String clientId, Exception cause) {
        try {
            RedisLockScripts.execute(connection, RedisLockScripts.RELEASE_SCRIPT, ownerKey(), dataKey(), clientId);
        } catch (DataAccessException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    public void release() {
        StringRedisConnection connection = client.requireConnection();
        String clientId = client.getId();
        boolean released;
        try {
            released = RedisLockScripts.execute(connection, RedisLockScripts.RELEASE_SCRIPT,
                    ownerKey(), dataKey(), clientId);
        } catch (DataAccessException e) {
            throw new LockStoreException("释放锁失败, lock=" + name, e);
        }
        if (!released) {
            log.debug("释放锁失败_非持有者|Lock_release_not_owner,key={},clientId={}", ownerKey(), clientId);
            throw new LockHeldByOtherClientException(name, clientId, false);
        }
        log.debug("释放锁成功|Lock_release_success,key={},clientId={}", ownerKey(), clientId);
    }

    @Override
    public void refreshTtl(Duration ttl) {
        this.ttl = ttl;
        refresh();
    }

    /**
     * 续期
     *
     * 实现逻辑：
     * 1. 校验当前 ttl。
     * 2. 执行续期脚本：owner 匹配时重设过期时间并覆盖数据键，中间不存在 owner 键消失的窗口。
     */
    @Override
    public void refresh() {
        if (!LockConstants.isValidTtl(ttl)) {
            throw new InvalidTtlException(ttl);
        }
        StringRedisConnection connection = client.requireConnection();
        String clientId = client.getId();
        boolean refreshed;
        try {
            refreshed = RedisLockScripts.execute(connection, RedisLockScripts.REFRESH_SCRIPT,
                    ownerKey(), dataKey(), clientId, String.valueOf(ttl.toMillis()), data);
        } catch (DataAccessException e) {
            throw new LockStoreException("续期失败, lock=" + name, e);
        }
        if (!refreshed) {
            log.warn("续期失败_锁已不属于当前客户端|Lock_refresh_not_owner,key={},clientId={}", ownerKey(), clientId);
            throw new LockNotOwnedException(name, clientId);
        }
    }

    /**
     * 查询锁信息
     *
     * 实现逻辑：
     * 1. MULTI 中排入 GET owner、PTTL owner、GET data。
     * 2. EXEC 返回空时视为未加锁。
     * 3. PTTL 大于 0 才视为持有中；-2（键不存在）与 -1（无过期）都按 0 处理。
     */
    @Override
    public LockInfo info() {
        StringRedisConnection connection = client.requireConnection();
        String ownerKey = ownerKey();
        List<Object> reply;
        try {
            connection.multi();
            connection.get(ownerKey);
            connection.pTtl(ownerKey);
            connection.get(dataKey());
            reply = connection.exec();
        } catch (DataAccessException e) {
            discardQuietly(connection, e);
            throw new LockStoreException("查询锁信息失败, lock=" + name, e);
        }

        if (reply == null || reply.isEmpty()) {
            return LockInfo.notAcquired(name);
        }
        if (reply.size() != INFO_REPLY_SIZE) {
            throw new LockStoreException("查询锁信息返回结构异常, lock=" + name + ", size=" + reply.size());
        }

        String owner = asString(reply.get(0));
        long pttl = asLong(reply.get(1));
        String storedData = asString(reply.get(2));
        Duration remaining = pttl > 0 ? Duration.ofMillis(pttl) : Duration.ZERO;
        return new LockInfo(name, pttl > 0, owner, remaining, storedData);
    }

    private void discardQuietly(StringRedisConnection connection, Exception cause) {
        if (!connection.isQueueing()) {
            return;
        }
        try {
            connection.discard();
        } catch (DataAccessException e) {
            cause.addSuppressed(e);
        }
    }

    private String asString(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof byte[]) {
            return new String((byte[]) value, StandardCharsets.UTF_8);
        }
        return value.toString();
    }

    private long asLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(asString(value));
        } catch (NumberFormatException e) {
            throw new LockStoreException("PTTL 返回值无法解析, lock=" + name + ", value=" + value, e);
        }
    }

    @Override
    public void setData(String data) {
        this.data = data == null ? "" : data;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Duration getTtl() {
        return ttl;
    }

    @Override
    public String getData() {
        return data;
    }
}

package com.hao.glock.integration.lock.redis;

import com.hao.glock.common.constants.LockConstants;
import com.hao.glock.common.exception.LockConnectionException;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * 基于 Redis 的锁客户端
 *
 * 类职责：
 * 持有一条独占的 Redis 连接与客户端身份，负责连接的建立、替换与关闭，并创建 {@link RedisLock}。
 *
 * 设计目的：
 * 1. 一个客户端对应一条连接，锁协议的每次调用都是该连接上的同步往返。
 * 2. 身份（客户端 ID）即归属令牌，写入 owner 键用于后续比较。
 *
 * 核心实现思路：
 * - 构造时补齐默认配置并完成首次连接与 PING 探活。
 * - 连接可以为空（未连接状态），此时访问存储的锁操作抛出 {@link LockConnectionException}。
 */
@Slf4j
public class RedisLockClient implements LockClient {

    private final RedisLockOptions options;

    private StringRedisConnection connection;

    /**
     * 创建客户端并立即连接
     *
     * @param options 客户端配置
     * @throws LockConnectionException 无法连接或探活失败
     */
    public RedisLockClient(RedisLockOptions options) {
        this(normalize(options), true);
    }

    private RedisLockClient(RedisLockOptions options, boolean connect) {
        this.options = options;
        if (connect) {
            reconnect();
        }
    }

    /**
     * 补齐默认配置
     *
     * 实现逻辑：
     * 1. 拷贝一份配置，避免与调用方共享可变对象。
     * 2. 逐项填充默认值。
     */
    private static RedisLockOptions normalize(RedisLockOptions source) {
        if (source == null) {
            throw new IllegalArgumentException("options 不能为空");
        }
        RedisLockOptions options = source.toBuilder().build();
        if (!StringUtils.hasText(options.getClientId())) {
            options.setClientId(UUID.randomUUID().toString());
        }
        if (!StringUtils.hasText(options.getNetwork())) {
            options.setNetwork(LettuceDialFunction.NETWORK_TCP);
        }
        if (!StringUtils.hasText(options.getNamespace())) {
            options.setNamespace(LockConstants.DEFAULT_NAMESPACE);
        }
        if (options.getDialOptions() == null) {
            options.setDialOptions(RedisDialOptions.builder().build());
        }
        if (options.getDialFunction() == null) {
            options.setDialFunction(LettuceDialFunction.shared());
        }
        return options;
    }

    @Override
    public RedisLockClient copy() {
        return new RedisLockClient(options.toBuilder().build(), false);
    }

    @Override
    public void close() {
        if (connection == null) {
            return;
        }
        StringRedisConnection current = connection;
        connection = null;
        try {
            current.close();
        } catch (RuntimeException e) {
            log.warn("关闭锁连接失败|Lock_connection_close_fail,clientId={},address={}",
                    options.getClientId(), options.getAddress(), e);
        }
    }

    /**
     * 重新建立连接
     *
     * 实现逻辑：
     * 1. 关闭旧连接。
     * 2. 调用拨号函数建立新连接。
     * 3. PING 探活，失败时关闭新连接并抛出连接异常。
     */
    @Override
    public void reconnect() {
        close();
        StringRedisConnection fresh;
        try {
            fresh = options.getDialFunction().dial(options.getNetwork(), options.getAddress(), options.getDialOptions());
        } catch (RuntimeException e) {
            log.error("锁连接建立失败|Lock_connection_dial_fail,network={},address={}",
                    options.getNetwork(), options.getAddress(), e);
            throw new LockConnectionException("无法连接 Redis: " + options.getAddress(), e);
        }
        if (fresh == null) {
            throw new LockConnectionException("拨号函数返回空连接: " + options.getAddress());
        }
        try {
            fresh.ping();
        } catch (RuntimeException e) {
            log.error("锁连接探活失败|Lock_connection_ping_fail,address={}", options.getAddress(), e);
            try {
                fresh.close();
            } catch (RuntimeException closeError) {
                e.addSuppressed(closeError);
            }
            throw new LockConnectionException("Redis 探活失败: " + options.getAddress(), e);
        }
        connection = fresh;
        log.debug("锁连接就绪|Lock_connection_ready,clientId={},address={}", options.getClientId(), options.getAddress());
    }

    @Override
    public boolean isConnected() {
        return connection != null;
    }

    @Override
    public void setId(String id) {
        options.setClientId(id);
    }

    @Override
    public String getId() {
        return options.getClientId();
    }

    public String getNamespace() {
        return options.getNamespace();
    }

    @Override
    public Lock newLock(String name) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("name 不能为空");
        }
        return new RedisLock(name, this);
    }

    /**
     * 获取当前连接，未连接时抛出异常
     */
    StringRedisConnection requireConnection() {
        if (connection == null) {
            throw new LockConnectionException("锁客户端未连接, clientId=" + options.getClientId());
        }
        return connection;
    }
}

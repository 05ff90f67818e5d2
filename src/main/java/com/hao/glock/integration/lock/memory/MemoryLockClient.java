package com.hao.glock.integration.lock.memory;

import com.hao.glock.common.constants.LockConstants;
import com.hao.glock.common.exception.LockConnectionException;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * 基于进程内存储的锁客户端
 *
 * 类职责：
 * 与 {@link com.hao.glock.integration.lock.redis.RedisLockClient} 提供相同的客户端契约，
 * "连接"即对共享 {@link MemoryLockStore} 的引用。
 *
 * 为什么需要该类：
 * 单元测试与单进程场景下无需部署 Redis，也能复现完整的加锁、续期、过期语义。
 */
@Slf4j
public class MemoryLockClient implements LockClient {

    private final MemoryLockOptions options;

    private MemoryLockStore connection;

    public MemoryLockClient(MemoryLockOptions options) {
        this(normalize(options), true);
    }

    private MemoryLockClient(MemoryLockOptions options, boolean connect) {
        this.options = options;
        if (connect) {
            reconnect();
        }
    }

    private static MemoryLockOptions normalize(MemoryLockOptions source) {
        if (source == null || source.getStore() == null) {
            throw new IllegalArgumentException("store 不能为空");
        }
        MemoryLockOptions options = source.toBuilder().build();
        if (!StringUtils.hasText(options.getClientId())) {
            options.setClientId(UUID.randomUUID().toString());
        }
        if (!StringUtils.hasText(options.getNamespace())) {
            options.setNamespace(LockConstants.DEFAULT_NAMESPACE);
        }
        return options;
    }

    @Override
    public MemoryLockClient copy() {
        return new MemoryLockClient(options.toBuilder().build(), false);
    }

    @Override
    public void reconnect() {
        close();
        MemoryLockStore store = options.getStore();
        try {
            store.ping();
        } catch (LockConnectionException e) {
            log.error("内存锁存储探活失败|Memory_lock_store_ping_fail,clientId={}", options.getClientId(), e);
            throw e;
        }
        connection = store;
    }

    @Override
    public void close() {
        connection = null;
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
        return new MemoryLock(name, this);
    }

    MemoryLockStore requireConnection() {
        if (connection == null) {
            throw new LockConnectionException("锁客户端未连接, clientId=" + options.getClientId());
        }
        return connection;
    }
}

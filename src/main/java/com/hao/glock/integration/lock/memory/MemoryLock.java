package com.hao.glock.integration.lock.memory;

import com.hao.glock.common.constants.LockConstants;
import com.hao.glock.common.exception.InvalidTtlException;
import com.hao.glock.common.exception.LockHeldByOtherClientException;
import com.hao.glock.common.exception.LockNotOwnedException;
import com.hao.glock.common.exception.LockStoreException;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockInfo;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * 基于进程内存储的分布式锁实现
 *
 * 协议与 Redis 后端一致：条件写入 owner 键加锁，比较删除释放，比较续期续约，快照查询。
 */
@Slf4j
public class MemoryLock implements Lock {

    private final String name;
    private final MemoryLockClient client;
    private Duration ttl = Duration.ZERO;
    private String data = "";

    MemoryLock(String name, MemoryLockClient client) {
        this.name = name;
        this.client = client;
    }

    private String ownerKey() {
        return LockConstants.ownerKey(client.getNamespace(), name);
    }

    private String dataKey() {
        return LockConstants.dataKey(client.getNamespace(), name);
    }

    @Override
    public void acquire(Duration ttl) {
        if (!LockConstants.isValidTtl(ttl)) {
            throw new InvalidTtlException(ttl);
        }
        MemoryLockStore store = client.requireConnection();
        String clientId = client.getId();
        if (!store.setIfAbsent(ownerKey(), clientId, ttl)) {
            log.debug("锁已被持有|Lock_held_by_other,key={},clientId={}", ownerKey(), clientId);
            throw new LockHeldByOtherClientException(name, clientId);
        }
        this.ttl = ttl;

        try {
            store.set(dataKey(), data);
        } catch (LockStoreException e) {
            log.warn("锁数据写入失败_回滚加锁|Lock_data_write_fail_rollback,key={},clientId={}", ownerKey(), clientId, e);
            try {
                store.compareAndDelete(ownerKey(), dataKey(), clientId);
            } catch (LockStoreException rollbackError) {
                e.addSuppressed(rollbackError);
            }
            throw new LockStoreException("锁数据写入失败, 已回滚加锁, lock=" + name, e);
        }
    }

    @Override
    public void release() {
        MemoryLockStore store = client.requireConnection();
        String clientId = client.getId();
        if (!store.compareAndDelete(ownerKey(), dataKey(), clientId)) {
            log.debug("释放锁失败_非持有者|Lock_release_not_owner,key={},clientId={}", ownerKey(), clientId);
            throw new LockHeldByOtherClientException(name, clientId, false);
        }
    }

    @Override
    public void refreshTtl(Duration ttl) {
        this.ttl = ttl;
        refresh();
    }

    @Override
    public void refresh() {
        if (!LockConstants.isValidTtl(ttl)) {
            throw new InvalidTtlException(ttl);
        }
        MemoryLockStore store = client.requireConnection();
        String clientId = client.getId();
        if (!store.compareAndRefresh(ownerKey(), dataKey(), clientId, ttl, data)) {
            log.warn("续期失败_锁已不属于当前客户端|Lock_refresh_not_owner,key={},clientId={}", ownerKey(), clientId);
            throw new LockNotOwnedException(name, clientId);
        }
    }

    @Override
    public LockInfo info() {
        MemoryLockStore.Snapshot snapshot = client.requireConnection().snapshot(ownerKey(), dataKey());
        long pttl = snapshot.getPttlMillis();
        return new LockInfo(
                name,
                pttl > 0,
                snapshot.getOwner() == null ? "" : snapshot.getOwner(),
                pttl > 0 ? Duration.ofMillis(pttl) : Duration.ZERO,
                snapshot.getData() == null ? "" : snapshot.getData());
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

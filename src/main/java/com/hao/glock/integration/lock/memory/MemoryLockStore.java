package com.hao.glock.integration.lock.memory;

import com.google.common.base.Ticker;
import com.google.common.math.LongMath;
import com.hao.glock.common.exception.LockConnectionException;
import com.hao.glock.common.exception.LockStoreException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 进程内键值存储（模拟 Redis 的 TTL 与原子脚本语义）
 *
 * 类职责：
 * 为内存后端提供"不存在才写"、"比较后删除"、"比较后续期"与"一致性快照"四个原子操作。
 *
 * 设计目的：
 * 1. 让测试与单进程部署无需真实 Redis，同时保持与 Redis 后端相同的原子性保证。
 * 2. 所有共享同一个 store 的客户端之间互斥，行为等同于连接同一个 Redis 实例。
 *
 * 核心实现思路：
 * - 所有操作在同一把监视器锁内完成，组合检查与修改不可分割。
 * - 过期采用惰性判断：读取时对比 Ticker 时间，过期条目视为不存在并清除。
 * - 每次条件写入前清扫全部已过期条目，长期运行时不会堆积过期的 owner 键。
 *   数据键与 Redis 一致没有过期时间，只在释放时删除。
 * - 过期时刻做饱和加法，超大 TTL 视为极远的未来而不是溢出成过去。
 * - {@link #shutdown()} 模拟存储不可用，便于验证连接与存储异常路径。
 */
@Slf4j
public class MemoryLockStore {

    /** PTTL 语义：键不存在 */
    public static final long PTTL_ABSENT = -2L;

    /** PTTL 语义：键存在但没有过期时间 */
    public static final long PTTL_PERSISTENT = -1L;

    private static final long NO_EXPIRY = Long.MAX_VALUE;

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private final Map<String, Entry> entries = new HashMap<>();
    private final Ticker ticker;
    private boolean available = true;

    public MemoryLockStore() {
        this(Ticker.systemTicker());
    }

    public MemoryLockStore(Ticker ticker) {
        this.ticker = ticker;
    }

    /**
     * 探活，存储不可用时抛出连接异常
     */
    public synchronized void ping() {
        if (!available) {
            throw new LockConnectionException("内存存储不可用");
        }
    }

    /**
     * 不存在才写入并设置过期时间，等价于 SET key value PX ttl NX
     *
     * @return true 表示写入成功
     */
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        checkAvailable();
        purgeExpired();
        if (live(key) != null) {
            return false;
        }
        entries.put(key, new Entry(value, expireAt(ttl)));
        return true;
    }

    /**
     * 覆盖写入，无过期时间，等价于 SET key value
     */
    public synchronized void set(String key, String value) {
        checkAvailable();
        entries.put(key, new Entry(value, NO_EXPIRY));
    }

    /**
     * owner 键的值等于 expected 时删除 owner 键与数据键
     *
     * @return true 表示已删除，false 表示不匹配且未做任何修改
     */
    public synchronized boolean compareAndDelete(String ownerKey, String dataKey, String expected) {
        checkAvailable();
        Entry owner = live(ownerKey);
        if (owner == null || !owner.value.equals(expected)) {
            return false;
        }
        entries.remove(ownerKey);
        entries.remove(dataKey);
        return true;
    }

    /**
     * owner 键的值等于 expected 时重设 owner 键过期时间并覆盖数据键
     *
     * @return true 表示已续期，false 表示不匹配且未做任何修改
     */
    public synchronized boolean compareAndRefresh(String ownerKey, String dataKey, String expected,
                                                  Duration ttl, String data) {
        checkAvailable();
        Entry owner = live(ownerKey);
        if (owner == null || !owner.value.equals(expected)) {
            return false;
        }
        entries.put(ownerKey, new Entry(expected, expireAt(ttl)));
        entries.put(dataKey, new Entry(data, NO_EXPIRY));
        return true;
    }

    /**
     * 在同一时刻读取 owner、owner 剩余毫秒数与数据
     */
    public synchronized Snapshot snapshot(String ownerKey, String dataKey) {
        checkAvailable();
        Entry owner = live(ownerKey);
        Entry data = live(dataKey);
        long pttl;
        if (owner == null) {
            pttl = PTTL_ABSENT;
        } else if (owner.expireAtNanos == NO_EXPIRY) {
            pttl = PTTL_PERSISTENT;
        } else {
            pttl = Duration.ofNanos(owner.expireAtNanos - ticker.read()).toMillis();
        }
        return new Snapshot(owner == null ? null : owner.value, pttl, data == null ? null : data.value);
    }

    /**
     * 模拟存储宕机
     */
    public synchronized void shutdown() {
        available = false;
        log.info("内存锁存储已停止|Memory_lock_store_shutdown,entries={}", entries.size());
    }

    /**
     * 恢复存储可用
     */
    public synchronized void start() {
        available = true;
    }

    /**
     * 当前条目数（含尚未被清扫的过期条目）
     */
    synchronized int size() {
        return entries.size();
    }

    private void checkAvailable() {
        if (!available) {
            throw new LockStoreException("内存存储不可用");
        }
    }

    private Entry live(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(ticker.read())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    private void purgeExpired() {
        long now = ticker.read();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        int purged = before - entries.size();
        if (purged > 0) {
            log.debug("清理过期条目|Memory_lock_store_purge,purged={},remaining={}", purged, entries.size());
        }
    }

    private long expireAt(Duration ttl) {
        long ttlNanos = ttl.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : ttl.toNanos();
        // NO_EXPIRY 保留给无过期时间的键
        return Math.min(LongMath.saturatedAdd(ticker.read(), ttlNanos), NO_EXPIRY - 1);
    }

    private static final class Entry {
        private final String value;
        private final long expireAtNanos;

        private Entry(String value, long expireAtNanos) {
            this.value = value;
            this.expireAtNanos = expireAtNanos;
        }

        private boolean isExpired(long now) {
            return expireAtNanos != NO_EXPIRY && expireAtNanos - now <= 0;
        }
    }

    /**
     * 一致性快照
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PACKAGE)
    public static final class Snapshot {
        private final String owner;
        private final long pttlMillis;
        private final String data;
    }
}

package com.hao.glock.integration.lock;

import java.time.Duration;

/**
 * 分布式锁对象接口
 * <p>
 * 职责：
 * 针对单个命名资源的可租约互斥句柄，负责加锁、续期、释放与状态查询。
 * <p>
 * 状态机：
 * 未持有 --acquire--> 持有 --release / 租约过期--> 未持有；持有状态下可反复 refresh。
 * 锁对象没有终态，可以跨多轮加锁/释放重复使用。所有状态都保存在存储中，
 * 锁对象本地只记录准备（重新）下发的 ttl 与 data。
 * <p>
 * 加锁是非阻塞的：锁不可用时立即失败，等待与退避策略由调用方实现。
 */
public interface Lock {

    /**
     * 尝试加锁，租约时长为 ttl。成功后 ttl 会被记录，供后续 {@link #refresh()} 使用。
     *
     * @param ttl 租约时长，最小 1 毫秒
     * @throws com.hao.glock.common.exception.InvalidTtlException ttl 小于 1 毫秒或超出毫秒范围（不访问存储）
     * @throws com.hao.glock.common.exception.LockHeldByOtherClientException 锁已被持有
     * @throws com.hao.glock.common.exception.LockStoreException 存储通信失败
     */
    void acquire(Duration ttl);

    /**
     * 释放锁。仅当存储中的 owner 等于当前客户端 ID 时才会删除 owner 键与数据键。
     * 连续两次 release 时第二次必然失败，这是预期行为。
     *
     * @throws com.hao.glock.common.exception.LockHeldByOtherClientException 当前客户端不是 owner，不可重试
     * @throws com.hao.glock.common.exception.LockStoreException 存储通信失败
     */
    void release();

    /**
     * 以当前 ttl 续期，同时把当前 data 覆盖写入数据键。
     *
     * @throws com.hao.glock.common.exception.InvalidTtlException 当前 ttl 小于 1 毫秒
     * @throws com.hao.glock.common.exception.LockNotOwnedException 当前客户端不是 owner（通常是已过期）
     * @throws com.hao.glock.common.exception.LockStoreException 存储通信失败
     */
    void refresh();

    /**
     * 设置新的 ttl 后续期，新 ttl 会成为后续 {@link #refresh()} 的 ttl。
     */
    void refreshTtl(Duration ttl);

    /**
     * 查询锁的一致性快照（owner、剩余 ttl、data 在同一时刻读取）。
     * owner 键不存在时返回"未加锁"结果而不是异常。
     *
     * @return 锁信息
     * @throws com.hao.glock.common.exception.LockStoreException 存储通信失败
     */
    LockInfo info();

    /**
     * 设置附带数据。纯本地修改，仅在下一次成功的 acquire 或 refresh 时写入存储。
     */
    void setData(String data);

    String getName();

    Duration getTtl();

    String getData();
}

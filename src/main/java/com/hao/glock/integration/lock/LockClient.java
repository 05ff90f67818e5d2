package com.hao.glock.integration.lock;

/**
 * 分布式锁客户端接口
 * <p>
 * 职责：
 * 代表一条面向后端存储的会话：管理连接生命周期、携带唯一客户端身份、为所有键加命名空间前缀，
 * 并作为 {@link Lock} 的工厂。
 * <p>
 * 设计目的：
 * 统一不同后端（Redis、进程内存储等）的客户端能力，业务代码只依赖该接口，后端在构造时选定。
 * <p>
 * 并发说明：
 * 客户端及其创建的锁不保证线程安全。推荐一个持有者一个客户端，需要同一身份下的独立会话时使用 {@link #copy()}。
 */
public interface LockClient extends AutoCloseable {

    /**
     * 返回一个共享相同配置（网络、地址、命名空间、客户端 ID）但<b>未连接</b>的新客户端。
     * 使用前需调用 {@link #reconnect()}。
     *
     * @return 未连接的客户端副本
     */
    LockClient copy();

    /**
     * 关闭现有连接（不存在时忽略），重新建立连接并探活。
     * 已连接时调用会强制替换连接。
     *
     * @throws com.hao.glock.common.exception.LockConnectionException 建立连接或探活失败
     */
    void reconnect();

    /**
     * 释放连接。未连接时为空操作，从不抛出异常。
     */
    @Override
    void close();

    /**
     * 当前是否持有连接。
     */
    boolean isConnected();

    /**
     * 替换客户端身份。
     * <p>
     * 注意：已用旧 ID 获取的锁不会被重新关联，它们将在逻辑上成为孤儿，直到租约自然过期。
     *
     * @param id 新的客户端 ID
     */
    void setId(String id);

    /**
     * 当前客户端 ID，即写入 owner 键的归属令牌。
     */
    String getId();

    /**
     * 创建一个绑定到当前客户端的锁对象。纯本地构造，不访问存储，也不会自动加锁。
     *
     * @param name 锁名称
     * @return 锁对象
     */
    Lock newLock(String name);
}

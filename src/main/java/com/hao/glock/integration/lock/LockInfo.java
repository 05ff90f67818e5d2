package com.hao.glock.integration.lock;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

/**
 * 锁信息快照
 * <p>
 * 由 {@link Lock#info()} 返回，字段来自同一次一致性读取。
 */
@Data
@AllArgsConstructor
public class LockInfo {

    /**
     * 锁名称
     */
    private String name;

    /**
     * 是否处于持有状态（剩余 ttl > 0）
     */
    private boolean acquired;

    /**
     * 当前持有者客户端 ID，未持有时为空字符串
     */
    private String owner;

    /**
     * 剩余租约时长，未持有时为 0
     */
    private Duration ttl;

    /**
     * 存储中的附带数据
     */
    private String data;

    /**
     * 构造"未加锁"结果
     */
    public static LockInfo notAcquired(String name) {
        return new LockInfo(name, false, "", Duration.ZERO, "");
    }
}

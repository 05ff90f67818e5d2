package com.hao.glock.integration.lock.memory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 内存锁客户端配置
 * <p>
 * 相互竞争的客户端必须共享同一个 {@link MemoryLockStore}。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MemoryLockOptions {

    private String clientId;

    private String namespace;

    private MemoryLockStore store;
}

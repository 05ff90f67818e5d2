package com.hao.glock.integration.lock.redis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Redis 锁客户端配置
 * <p>
 * 未设置的字段在 {@link RedisLockClient} 构造时补默认值：
 * network=tcp，clientId=随机 UUID，namespace=glock，dialFunction=共享的 Lettuce 拨号实现。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RedisLockOptions {

    /**
     * 网络类型，例如 tcp
     */
    private String network;

    /**
     * 地址，例如 localhost:6379
     */
    private String address;

    /**
     * 当前客户端 ID，未设置时自动生成
     */
    private String clientId;

    /**
     * 所有键的命名空间前缀
     */
    private String namespace;

    /**
     * 底层拨号参数
     */
    private RedisDialOptions dialOptions;

    /**
     * 建立连接的函数
     */
    private RedisDialFunction dialFunction;
}

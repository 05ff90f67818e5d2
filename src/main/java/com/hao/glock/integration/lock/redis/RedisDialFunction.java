package com.hao.glock.integration.lock.redis;

import org.springframework.data.redis.connection.StringRedisConnection;

/**
 * 建立 Redis 连接的函数
 * <p>
 * 默认实现为 {@link LettuceDialFunction}；测试或特殊部署可传入自定义实现
 * （例如复用外部已有的连接工厂，或返回 Mock 连接）。
 */
@FunctionalInterface
public interface RedisDialFunction {

    /**
     * 建立一条新连接。返回的连接由调用方独占并负责关闭。
     *
     * @param network 网络类型，tcp 或 unix
     * @param address 地址，tcp 时为 host:port，unix 时为 socket 路径
     * @param options 拨号参数
     * @return 新连接
     */
    StringRedisConnection dial(String network, String address, RedisDialOptions options);
}

package com.hao.glock.config;

import com.hao.glock.integration.lock.LockClient;
import com.hao.glock.integration.lock.memory.MemoryLockClient;
import com.hao.glock.integration.lock.memory.MemoryLockOptions;
import com.hao.glock.integration.lock.memory.MemoryLockStore;
import com.hao.glock.integration.lock.redis.LettuceDialFunction;
import com.hao.glock.integration.lock.redis.RedisDialOptions;
import com.hao.glock.integration.lock.redis.RedisLockClient;
import com.hao.glock.integration.lock.redis.RedisLockOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 分布式锁配置类
 * <p>
 * 类职责：
 * 按 glock.backend 选择后端，构建锁客户端 Bean。
 *
 * 设计目的：
 * 1. 业务代码只注入 {@link LockClient}，后端在配置层一次性选定。
 * 2. Redis 后端的连接参数集中在 glock.* 下，与锁协议代码解耦。
 *
 * 核心实现思路：
 * - redis：构建 Lettuce 拨号函数（连接池 + 命令超时 + 关闭连接共享），客户端启动即连接并探活。
 * - memory：构建进程内存储，客户端共享该存储。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GlockProperties.class)
public class GlockConfig {

    /**
     * Lettuce 拨号函数，容器关闭时销毁连接工厂
     */
    @Bean
    @ConditionalOnProperty(name = "glock.backend", havingValue = "redis", matchIfMissing = true)
    public LettuceDialFunction lettuceDialFunction() {
        return new LettuceDialFunction();
    }

    /**
     * Redis 锁客户端
     *
     * 实现逻辑：
     * 1. 将 glock.* 配置映射为拨号参数与客户端配置。
     * 2. 构造客户端（构造时完成连接与 PING 探活，失败则启动失败）。
     */
    @Bean
    @ConditionalOnProperty(name = "glock.backend", havingValue = "redis", matchIfMissing = true)
    public LockClient redisLockClient(GlockProperties properties, LettuceDialFunction dialFunction) {
        RedisDialOptions dialOptions = RedisDialOptions.builder()
                .connectTimeout(properties.getConnectTimeout())
                .commandTimeout(properties.getCommandTimeout())
                .password(properties.getPassword())
                .database(properties.getDatabase())
                .clientName(properties.getClientName())
                .build();

        RedisLockClient client = new RedisLockClient(RedisLockOptions.builder()
                .network(properties.getNetwork())
                .address(properties.getAddress())
                .clientId(properties.getClientId())
                .namespace(properties.getNamespace())
                .dialOptions(dialOptions)
                .dialFunction(dialFunction)
                .build());
        log.info("Redis锁客户端初始化完成|Redis_lock_client_ready,address={},namespace={},clientId={}",
                properties.getAddress(), client.getNamespace(), client.getId());
        return client;
    }

    @Bean
    @ConditionalOnProperty(name = "glock.backend", havingValue = "memory")
    public MemoryLockStore memoryLockStore() {
        return new MemoryLockStore();
    }

    /**
     * 内存锁客户端
     */
    @Bean
    @ConditionalOnProperty(name = "glock.backend", havingValue = "memory")
    public LockClient memoryLockClient(GlockProperties properties, MemoryLockStore store) {
        MemoryLockClient client = new MemoryLockClient(MemoryLockOptions.builder()
                .clientId(properties.getClientId())
                .namespace(properties.getNamespace())
                .store(store)
                .build());
        log.info("内存锁客户端初始化完成|Memory_lock_client_ready,namespace={},clientId={}",
                client.getNamespace(), client.getId());
        return client;
    }
}

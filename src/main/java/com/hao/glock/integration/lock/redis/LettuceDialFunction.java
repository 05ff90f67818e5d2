package com.hao.glock.integration.lock.redis;

import com.google.common.net.HostAndPort;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.data.redis.connection.DefaultStringRedisConnection;
import org.springframework.data.redis.connection.RedisConfiguration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisSocketConfiguration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Lettuce 的默认拨号实现
 *
 * 类职责：
 * 按 (network, address, 拨号参数) 构建并缓存 LettuceConnectionFactory，每次拨号从工厂取一条独占连接。
 *
 * 设计目的：
 * 1. 连接工厂持有事件循环，属于重量级资源，同一目标只创建一次。
 * 2. 每个锁客户端拿到的是独占物理连接，MULTI/EXEC 与脚本执行不会与其他客户端交错。
 * 3. 不使用连接池：锁客户端长期持有连接，存活客户端数量不受池容量限制。
 *
 * 核心实现思路：
 * - 工厂配置沿用项目原有 RedisConfig 的做法：命令超时 + 建连超时 + 关闭连接共享。
 * - 关闭连接共享后每次 getConnection 都新建一条物理连接，连接关闭即断开。
 * - 工厂在 {@link #destroy()} 时统一销毁。Spring 管理的实例随容器销毁，
 *   {@link #shared()} 实例在 JVM 退出时由关闭钩子销毁。
 * - 缓存键包含拨号参数，每组不同参数各占一个工厂；长期运行的进程应复用同一组参数。
 */
@Slf4j
public class LettuceDialFunction implements RedisDialFunction, DisposableBean {

    public static final String NETWORK_TCP = "tcp";
    public static final String NETWORK_UNIX = "unix";

    private static final int DEFAULT_PORT = 6379;

    private static final LettuceDialFunction SHARED = new LettuceDialFunction();

    static {
        Runtime.getRuntime().addShutdownHook(new Thread(SHARED::destroy, "glock-lettuce-shutdown"));
    }

    private final Map<FactoryKey, LettuceConnectionFactory> factories = new ConcurrentHashMap<>();

    /**
     * 进程级共享实例，供未显式指定拨号函数的客户端使用，JVM 退出时自动销毁
     */
    public static LettuceDialFunction shared() {
        return SHARED;
    }

    @Override
    public StringRedisConnection dial(String network, String address, RedisDialOptions options) {
        LettuceConnectionFactory factory = factories.computeIfAbsent(
                new FactoryKey(network, address, options),
                key -> createFactory(key.network, key.address, key.options));
        return new DefaultStringRedisConnection(factory.getConnection());
    }

    /**
     * 创建并初始化 Lettuce 连接工厂
     *
     * 实现逻辑：
     * 1. 按网络类型构建单机或 Unix Socket 配置。
     * 2. 组装客户端配置（命令超时、建连超时、客户端名称），不配置连接池。
     * 3. 关闭连接共享并初始化工厂。
     */
    private LettuceConnectionFactory createFactory(String network, String address, RedisDialOptions options) {
        RedisConfiguration config = buildServerConfiguration(network, address, options);

        ClientOptions clientOptions = ClientOptions.builder()
                .socketOptions(SocketOptions.builder().connectTimeout(options.getConnectTimeout()).build())
                .build();

        LettuceClientConfiguration.LettuceClientConfigurationBuilder builder =
                LettuceClientConfiguration.builder()
                        .commandTimeout(options.getCommandTimeout())
                        .clientOptions(clientOptions);
        if (StringUtils.hasText(options.getClientName())) {
            builder.clientName(options.getClientName());
        }
        LettuceClientConfiguration clientConfiguration = builder.build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(config, clientConfiguration);
        // 每个锁客户端独占一条物理连接
        factory.setShareNativeConnection(false);
        factory.afterPropertiesSet();
        log.info("锁连接工厂创建完成|Lock_connection_factory_created,network={},address={},database={}",
                network, address, options.getDatabase());
        return factory;
    }

    private RedisConfiguration buildServerConfiguration(String network, String address, RedisDialOptions options) {
        RedisPassword password = StringUtils.hasText(options.getPassword())
                ? RedisPassword.of(options.getPassword())
                : RedisPassword.none();

        if (NETWORK_UNIX.equalsIgnoreCase(network)) {
            RedisSocketConfiguration socket = new RedisSocketConfiguration(address);
            socket.setDatabase(options.getDatabase());
            socket.setPassword(password);
            return socket;
        }
        if (!NETWORK_TCP.equalsIgnoreCase(network)) {
            throw new IllegalArgumentException("不支持的网络类型: " + network);
        }
        HostAndPort hostAndPort = HostAndPort.fromString(address).withDefaultPort(DEFAULT_PORT);
        RedisStandaloneConfiguration standalone =
                new RedisStandaloneConfiguration(hostAndPort.getHost(), hostAndPort.getPort());
        standalone.setDatabase(options.getDatabase());
        standalone.setPassword(password);
        return standalone;
    }

    /**
     * 销毁所有已创建的连接工厂
     */
    @Override
    public void destroy() {
        factories.forEach((key, factory) -> {
            try {
                factory.destroy();
            } catch (RuntimeException e) {
                log.warn("锁连接工厂销毁失败|Lock_connection_factory_destroy_fail,address={}", key.address, e);
            }
        });
        factories.clear();
    }

    /**
     * 已缓存的连接工厂数量
     */
    int factoryCount() {
        return factories.size();
    }

    private static final class FactoryKey {
        private final String network;
        private final String address;
        private final RedisDialOptions options;

        private FactoryKey(String network, String address, RedisDialOptions options) {
            this.network = network;
            this.address = address;
            // 拷贝一份，避免调用方后续修改参数影响缓存键
            this.options = options.toBuilder().build();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof FactoryKey)) {
                return false;
            }
            FactoryKey that = (FactoryKey) o;
            return network.equals(that.network) && address.equals(that.address) && options.equals(that.options);
        }

        @Override
        public int hashCode() {
            return Objects.hash(network, address, options);
        }
    }
}

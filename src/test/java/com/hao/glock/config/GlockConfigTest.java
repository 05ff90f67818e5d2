package com.hao.glock.config;

import com.hao.glock.common.exception.LockConnectionException;
import com.hao.glock.integration.lock.LockClient;
import com.hao.glock.integration.lock.memory.MemoryLockClient;
import com.hao.glock.integration.lock.memory.MemoryLockStore;
import com.hao.glock.integration.lock.redis.LettuceDialFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.NestedExceptionUtils;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 后端选择配置测试
 *
 * 测试目的：
 * 1. glock.backend=memory 时只装配内存后端。
 * 2. glock.backend=redis 时客户端启动即连接，Redis 不可达则容器启动失败。
 */
class GlockConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(GlockConfig.class);

    @Test
    @DisplayName("memory 后端：装配内存存储与客户端，使用配置的 ID 与命名空间")
    void testMemoryBackend() {
        contextRunner
                .withPropertyValues("glock.backend=memory", "glock.client-id=node-1", "glock.namespace=orders")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    LockClient client = context.getBean(LockClient.class);
                    assertInstanceOf(MemoryLockClient.class, client);
                    assertEquals("node-1", client.getId());
                    assertEquals("orders", ((MemoryLockClient) client).getNamespace());
                    assertEquals(1, context.getBeansOfType(MemoryLockStore.class).size());
                    assertTrue(context.getBeansOfType(LettuceDialFunction.class).isEmpty());
                });
    }

    @Test
    @DisplayName("redis 后端：地址不可达时启动失败并给出连接异常")
    void testRedisBackendUnreachable() {
        contextRunner
                .withPropertyValues("glock.backend=redis", "glock.address=127.0.0.1:1", "glock.connect-timeout=200ms")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    boolean connectionError = false;
                    for (Throwable t = failure; t != null; t = t.getCause()) {
                        connectionError |= t instanceof LockConnectionException;
                    }
                    assertTrue(connectionError, "根因应为连接异常: " + NestedExceptionUtils.getMostSpecificCause(failure));
                });
    }
}

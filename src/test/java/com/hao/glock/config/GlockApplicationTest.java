package com.hao.glock.config;

import com.hao.glock.GlockApplication;
import com.hao.glock.common.demo.LockSampleRunner;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockClient;
import com.hao.glock.integration.lock.LockInfo;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 应用上下文集成测试
 *
 * 测试目的：
 * 1. 以内存后端启动完整容器，验证锁客户端可注入、可用。
 * 2. 开启启动示例，验证示例执行完毕后不残留锁。
 */
@Slf4j
@SpringBootTest(classes = GlockApplication.class)
@TestPropertySource(properties = {
        "glock.backend=memory",
        "glock.demo.enabled=true",
        "glock.demo.lock-name=demo-job"
})
class GlockApplicationTest {

    @Autowired
    private LockClient lockClient;

    @Autowired
    private ApplicationContext context;

    @Test
    @DisplayName("启动示例执行后锁已释放")
    void testDemoLeavesNoLock() {
        assertEquals(1, context.getBeansOfType(LockSampleRunner.class).size());

        LockInfo info = lockClient.newLock("demo-job").info();
        log.info("示例结束后锁信息|Demo_lock_info_after_run,info={}", info);
        assertFalse(info.isAcquired());
    }

    @Test
    @DisplayName("注入的客户端可完成加锁与释放")
    void testInjectedClient() {
        Lock lock = lockClient.newLock("context-job");
        lock.setData("from-context");
        lock.acquire(Duration.ofSeconds(5));

        LockInfo info = lock.info();
        assertTrue(info.isAcquired());
        assertEquals(lockClient.getId(), info.getOwner());
        assertEquals("from-context", info.getData());

        lock.release();
    }
}

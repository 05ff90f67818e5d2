package com.hao.glock.common.demo;

import com.hao.glock.common.exception.LockHeldByOtherClientException;
import com.hao.glock.config.GlockProperties;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * 分布式锁启动示例执行器
 *
 * 类职责：
 * 在应用启动时用两个客户端身份演示一次完整的竞争流程，用于验证后端可用性。
 *
 * 核心实现思路：
 * - 主客户端加锁，副本客户端（同配置、不同 ID）加锁失败。
 * - 主客户端续期、释放后，副本客户端加锁成功并释放。
 * - 通过配置项 glock.demo.enabled 控制是否启用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "glock.demo.enabled", havingValue = "true")
public class LockSampleRunner implements CommandLineRunner {

    private final LockClient lockClient;
    private final GlockProperties properties;

    @Override
    public void run(String... args) {
        String lockName = properties.getDemo().getLockName();
        LockClient other = lockClient.copy();
        other.setId("demo-" + UUID.randomUUID());
        other.reconnect();
        try {
            Lock mine = lockClient.newLock(lockName);
            Lock theirs = other.newLock(lockName);

            mine.setData("owner=" + lockClient.getId());
            mine.acquire(Duration.ofSeconds(5));
            log.info("示例加锁成功|Demo_acquire_success,info={}", mine.info());

            try {
                theirs.acquire(Duration.ofSeconds(1));
                log.warn("示例异常_副本客户端不应加锁成功|Demo_unexpected_acquire,clientId={}", other.getId());
            } catch (LockHeldByOtherClientException e) {
                log.info("示例竞争失败符合预期|Demo_contention_expected,clientId={}", other.getId());
            }

            mine.refresh();
            mine.release();
            theirs.acquire(Duration.ofSeconds(1));
            log.info("示例副本客户端加锁成功|Demo_other_acquire_success,info={}", theirs.info());
            theirs.release();
        } finally {
            other.close();
        }
    }
}

package com.hao.glock.integration.lock.memory;

import com.hao.glock.common.exception.LockConnectionException;
import com.hao.glock.integration.lock.Lock;
import com.hao.glock.integration.lock.LockClient;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 内存锁客户端生命周期测试
 */
class MemoryLockClientTest {

    private final MemoryLockStore store = new MemoryLockStore();

    @Test
    @DisplayName("未指定 ID 与命名空间时自动补默认值")
    void testDefaults() {
        MemoryLockClient client = new MemoryLockClient(MemoryLockOptions.builder().store(store).build());

        assertTrue(client.isConnected());
        assertFalse(client.getId().isEmpty());
        assertEquals("glock", client.getNamespace());
        assertNotEquals(client.getId(), new MemoryLockClient(MemoryLockOptions.builder().store(store).build()).getId());
    }

    @Test
    @DisplayName("copy 返回同身份、未连接的客户端")
    void testCopyIsDisconnected() {
        LockClient client = new MemoryLockClient(MemoryLockOptions.builder().clientId("a1").store(store).build());
        LockClient copy = client.copy();

        assertFalse(copy.isConnected());
        assertEquals("a1", copy.getId());

        Lock lock = copy.newLock("job");
        assertThrows(LockConnectionException.class, () -> lock.acquire(Duration.ofSeconds(1)));

        copy.reconnect();
        lock.acquire(Duration.ofSeconds(1));
        // 同一身份，原客户端可以释放副本加的锁
        client.newLock("job").release();
    }

    @Test
    @DisplayName("copy 后修改 ID 不影响原客户端")
    void testCopyHasIndependentOptions() {
        LockClient client = new MemoryLockClient(MemoryLockOptions.builder().clientId("a1").store(store).build());
        LockClient copy = client.copy();
        copy.setId("b2");

        assertEquals("a1", client.getId());
        assertEquals("b2", copy.getId());
    }

    @Test
    @DisplayName("close 幂等，关闭后访问存储抛出连接异常")
    void testCloseIdempotent() {
        LockClient client = new MemoryLockClient(MemoryLockOptions.builder().store(store).build());
        client.close();
        client.close();

        assertFalse(client.isConnected());
        assertThrows(LockConnectionException.class, () -> client.newLock("job").info());
    }

    @Test
    @DisplayName("newLock 不访问存储")
    void testNewLockIsLocal() {
        LockClient client = new MemoryLockClient(MemoryLockOptions.builder().store(store).build());
        client.close();

        Lock lock = client.newLock("job");
        assertEquals("job", lock.getName());
        assertEquals(Duration.ZERO, lock.getTtl());
        assertEquals("", lock.getData());
        assertThrows(IllegalArgumentException.class, () -> client.newLock(" "));
    }

    @Test
    @DisplayName("缺少存储时构造失败")
    void testMissingStore() {
        assertThrows(IllegalArgumentException.class, () -> new MemoryLockClient(MemoryLockOptions.builder().build()));
    }
}

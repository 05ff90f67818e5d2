package com.hao.glock.common.exception;

/**
 * 锁不属于当前客户端
 *
 * 类职责：
 * refresh / release 时，存储中的 owner 与当前客户端 ID 不一致（或 owner 键已过期消失）。
 *
 * 为什么需要该类：
 * 租约过期由存储端驱动且不会通知持有者，持有者只能在下一次 refresh / release
 * 时通过该异常发现自己已失去锁。该情况是预期内的，库不会自动恢复。
 */
public class LockNotOwnedException extends GlockException {

    private final String lockName;
    private final String clientId;

    public LockNotOwnedException(String lockName, String clientId) {
        this("锁不属于当前客户端, lock=" + lockName + ", clientId=" + clientId, lockName, clientId);
    }

    protected LockNotOwnedException(String message, String lockName, String clientId) {
        super(message);
        this.lockName = lockName;
        this.clientId = clientId;
    }

    public String getLockName() {
        return lockName;
    }

    public String getClientId() {
        return clientId;
    }
}

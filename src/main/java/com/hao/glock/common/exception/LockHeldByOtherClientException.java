package com.hao.glock.common.exception;

/**
 * 锁被其他客户端持有
 *
 * 触发场景：
 * 1. acquire 时条件写入（SET NX）被拒绝，说明另一个身份当前持有该锁。
 * 2. release 时比较删除脚本返回 0，当前客户端不是 owner。
 *
 * 继承 {@link LockNotOwnedException}：两种场景对调用方而言都意味着"此刻不拥有该锁"。
 * 可重试标记由抛出方决定：acquire 失败可按调用方的退避策略再次尝试；
 * release 失败说明锁已不属于当前客户端，重试同一次 release 不会成功。
 */
public class LockHeldByOtherClientException extends LockNotOwnedException {

    private final boolean retryable;

    public LockHeldByOtherClientException(String lockName, String clientId) {
        this(lockName, clientId, true);
    }

    public LockHeldByOtherClientException(String lockName, String clientId, boolean retryable) {
        super("锁已被其他客户端持有, lock=" + lockName + ", clientId=" + clientId, lockName, clientId);
        this.retryable = retryable;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}

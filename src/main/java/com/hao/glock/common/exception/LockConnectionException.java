package com.hao.glock.common.exception;

/**
 * 存储连接异常
 *
 * 触发场景：建立连接失败、PING 探活失败，或在未连接的客户端上执行需要访问存储的操作。
 * 调用方可自行 reconnect 后重试。
 */
public class LockConnectionException extends GlockException {

    public LockConnectionException(String message) {
        super(message);
    }

    public LockConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

package com.hao.glock.common.exception;

/**
 * 存储命令执行异常
 *
 * 类职责：
 * 包装存储端通信或协议层面的失败（超时、脚本执行错误、事务返回异常结构等），保留原始 cause。
 *
 * 注意：键不存在不属于该异常，info() 会将其视为"未加锁"的正常结果。
 */
public class LockStoreException extends GlockException {

    public LockStoreException(String message) {
        super(message);
    }

    public LockStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}

package com.hao.glock.common.exception;

/**
 * 分布式锁统一异常
 *
 * 类职责：
 * 作为锁协议所有语义异常与存储异常的公共父类，便于调用方统一捕获。
 *
 * 设计目的：
 * 1. 区分"调用方用法错误"、"锁竞争/归属失败"与"存储通信失败"三类问题。
 * 2. 通过 {@link #isRetryable()} 给出是否值得由调用方重试的提示。
 *
 * 实现思路：
 * - 继承 RuntimeException，属于非受检异常。
 * - 库内部从不自动重试，重试与退避完全交由调用方决定。
 */
public class GlockException extends RuntimeException {

    public GlockException(String message) {
        super(message);
    }

    public GlockException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 标识该异常是否可通过调用方重试解决。
     * 默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}

package com.hao.glock.common.exception;

import java.time.Duration;

/**
 * 租约时长非法异常
 *
 * 触发场景：acquire / refresh 时 ttl 小于最小粒度（1 毫秒），或超出毫秒可表示的范围。
 * 属于调用方用法错误，抛出前不会访问存储。
 */
public class InvalidTtlException extends GlockException {

    private final Duration ttl;

    public InvalidTtlException(Duration ttl) {
        super("ttl 必须在 1ms 与 Long.MAX_VALUE ms 之间, ttl=" + ttl);
        this.ttl = ttl;
    }

    public Duration getTtl() {
        return ttl;
    }
}

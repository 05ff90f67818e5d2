package com.hao.glock.integration.lock.memory;

import com.google.common.base.Ticker;

import java.time.Duration;

/**
 * 手动推进的时钟，用于在测试中模拟租约过期
 */
class ManualTicker extends Ticker {

    private long nanos = 0L;

    @Override
    public synchronized long read() {
        return nanos;
    }

    synchronized void advance(Duration duration) {
        nanos += duration.toNanos();
    }
}

package com.hao.glock.integration.lock.redis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Redis 底层拨号参数
 * <p>
 * 只描述"怎么连"，不关心锁协议。默认值与项目原有的 Lettuce 连接工厂保持一致。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RedisDialOptions {

    /**
     * 建连超时
     */
    @Builder.Default
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * 命令超时，锁协议本身没有超时概念，超时完全取决于连接
     */
    @Builder.Default
    private Duration commandTimeout = Duration.ofSeconds(5);

    private String password;

    @Builder.Default
    private int database = 0;

    /**
     * CLIENT SETNAME 使用的名称，便于在 CLIENT LIST 中识别
     */
    private String clientName;
}

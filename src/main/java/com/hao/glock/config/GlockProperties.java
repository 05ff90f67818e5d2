package com.hao.glock.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 分布式锁配置属性
 *
 * 类职责：
 * 绑定 application.yml 中 glock.* 配置，用于选择后端并构建锁客户端。
 */
@Data
@ConfigurationProperties(prefix = "glock")
public class GlockProperties {

    /**
     * 后端类型
     */
    private Backend backend = Backend.REDIS;

    /**
     * 网络类型：tcp / unix
     */
    private String network = "tcp";

    /**
     * Redis 地址，tcp 时为 host:port，unix 时为 socket 路径
     */
    private String address = "localhost:6379";

    /**
     * 客户端 ID，为空时启动自动生成
     */
    private String clientId;

    /**
     * 键命名空间
     */
    private String namespace = "glock";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration commandTimeout = Duration.ofSeconds(5);

    private String password;

    private int database = 0;

    private String clientName;

    private Demo demo = new Demo();

    public enum Backend {
        REDIS,
        MEMORY
    }

    @Data
    public static class Demo {
        private boolean enabled = false;
        private String lockName = "job-7";
    }
}

package com.hao.glock;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;

/**
 * 分布式锁项目启动入口
 *
 * 类职责：
 * 负责引导 Spring Boot 应用启动与组件扫描。
 *
 * 核心实现思路：
 * - 锁客户端自行管理连接，排除 Spring Boot 的 Redis 自动配置，避免多出一套未使用的连接工厂。
 */
@SpringBootApplication(exclude = {
        RedisAutoConfiguration.class,
        RedisReactiveAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class
})
public class GlockApplication {

    public static void main(String[] args) {
        SpringApplication.run(GlockApplication.class, args);
    }
}

package com.hao.glock.common.constants;

import java.time.Duration;

/**
 * 锁协议常量定义
 *
 * 类职责：
 * 集中管理存储键布局与租约粒度，所有后端共享同一套键规范。
 *
 * 键布局：
 * | 键 | 值 | 过期 |
 * | ---------------------------- | ----------- | ---------- |
 * | {namespace}:{name}           | 持有者客户端 ID | 租约时长（毫秒） |
 * | {namespace}:{name}:data      | 调用方附带数据   | 无          |
 */
public final class LockConstants {

    /**
     * 默认命名空间
     */
    public static final String DEFAULT_NAMESPACE = "glock";

    /**
     * 命名空间与锁名分隔符
     */
    public static final String KEY_SEPARATOR = ":";

    /**
     * 数据键后缀
     */
    public static final String DATA_KEY_SUFFIX = KEY_SEPARATOR + "data";

    /**
     * 租约最小粒度
     */
    public static final Duration MIN_TTL = Duration.ofMillis(1);

    /**
     * 租约上限：租约以 long 毫秒写入存储
     */
    public static final Duration MAX_TTL = Duration.ofMillis(Long.MAX_VALUE);

    private LockConstants() {
        // 禁止实例化
    }

    /**
     * 拼接 owner 键：{namespace}:{name}
     */
    public static String ownerKey(String namespace, String name) {
        return namespace + KEY_SEPARATOR + name;
    }

    /**
     * 拼接数据键：{namespace}:{name}:data
     */
    public static String dataKey(String namespace, String name) {
        return ownerKey(namespace, name) + DATA_KEY_SUFFIX;
    }

    /**
     * 判断租约时长是否落在 [MIN_TTL, MAX_TTL] 内
     */
    public static boolean isValidTtl(Duration ttl) {
        return ttl != null && ttl.compareTo(MIN_TTL) >= 0 && ttl.compareTo(MAX_TTL) <= 0;
    }
}

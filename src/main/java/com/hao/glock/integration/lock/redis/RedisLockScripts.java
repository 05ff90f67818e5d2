package com.hao.glock.integration.lock.redis;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.ReturnType;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * 锁协议的两个原子脚本
 *
 * 类职责：
 * 定义"比较后删除"与"比较后续期"两段 Lua 脚本，并负责在指定连接上执行。
 *
 * 设计目的：
 * 1. 检查 owner 与修改必须在 Redis 端一次性完成，客户端先读后删会与其他客户端的 acquire 竞争。
 * 2. 脚本在类加载时初始化为不可变常量，运行期只读，无需同步。
 *
 * 实现思路：
 * - 优先 EVALSHA 节省带宽，服务端脚本缓存缺失（NOSCRIPT）时退回 EVAL 并顺带加载脚本。
 */
public final class RedisLockScripts {

    // 释放脚本
    // KEYS[1]: owner 键
    // KEYS[2]: 数据键
    // ARGV[1]: 期望的 owner（客户端 ID）
    private static final String RELEASE_SCRIPT_TEXT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    redis.call('del', KEYS[1]) " +
            "    redis.call('del', KEYS[2]) " +
            "    return 1 " +
            "end " +
            "return 0";

    // 续期脚本
    // KEYS[1]: owner 键
    // KEYS[2]: 数据键
    // ARGV[1]: 期望的 owner（客户端 ID）
    // ARGV[2]: 新租约时长（毫秒）
    // ARGV[3]: 新数据
    private static final String REFRESH_SCRIPT_TEXT =
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
            "    redis.call('set', KEYS[1], ARGV[1], 'PX', ARGV[2]) " +
            "    redis.call('set', KEYS[2], ARGV[3]) " +
            "    return 1 " +
            "end " +
            "return 0";

    public static final RedisScript<Long> RELEASE_SCRIPT = RedisScript.of(RELEASE_SCRIPT_TEXT, Long.class);

    public static final RedisScript<Long> REFRESH_SCRIPT = RedisScript.of(REFRESH_SCRIPT_TEXT, Long.class);

    private static final int KEY_COUNT = 2;

    private RedisLockScripts() {
        // 禁止实例化
    }

    /**
     * 在连接上执行脚本
     *
     * 实现逻辑：
     * 1. 先以 EVALSHA 执行。
     * 2. 若服务端返回 NOSCRIPT，以 EVAL 执行完整脚本。
     *
     * @param connection 连接
     * @param script 脚本
     * @param ownerKey owner 键
     * @param dataKey 数据键
     * @param args 脚本参数
     * @return 脚本返回值，1 表示成功，0 表示 owner 不匹配
     */
    public static boolean execute(StringRedisConnection connection, RedisScript<Long> script,
                                  String ownerKey, String dataKey, String... args) {
        String[] keysAndArgs = new String[KEY_COUNT + args.length];
        keysAndArgs[0] = ownerKey;
        keysAndArgs[1] = dataKey;
        System.arraycopy(args, 0, keysAndArgs, KEY_COUNT, args.length);

        Long result;
        try {
            result = connection.evalSha(script.getSha1(), ReturnType.INTEGER, KEY_COUNT, keysAndArgs);
        } catch (DataAccessException e) {
            if (!isNoScriptError(e)) {
                throw e;
            }
            result = connection.eval(script.getScriptAsString(), ReturnType.INTEGER, KEY_COUNT, keysAndArgs);
        }
        return result != null && result == 1L;
    }

    static boolean isNoScriptError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && message.contains("NOSCRIPT")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}

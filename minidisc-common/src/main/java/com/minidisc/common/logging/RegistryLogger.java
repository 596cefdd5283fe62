/**
 * 日志能力接口
 *
 * @date 2026/10/12
 */
package com.minidisc.common.logging;

/**
 * 注册表与发现客户端使用的日志能力
 * 由构造函数显式注入，默认不输出任何内容
 * 消息格式使用 SLF4J 风格的 {} 占位符
 */
public interface RegistryLogger {

    void debug(String format, Object... args);

    void info(String format, Object... args);

    void warn(String format, Object... args);

    void error(String format, Object... args);

    /**
     * 不输出任何日志的实现
     */
    static RegistryLogger noop() {
        return NoopRegistryLogger.INSTANCE;
    }
}

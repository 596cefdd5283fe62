package com.minidisc.common.logging;

/**
 * 空日志实现
 */
final class NoopRegistryLogger implements RegistryLogger {

    static final NoopRegistryLogger INSTANCE = new NoopRegistryLogger();

    private NoopRegistryLogger() {
    }

    @Override
    public void debug(String format, Object... args) {
    }

    @Override
    public void info(String format, Object... args) {
    }

    @Override
    public void warn(String format, Object... args) {
    }

    @Override
    public void error(String format, Object... args) {
    }
}

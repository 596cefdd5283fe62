package com.minidisc.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 将日志能力桥接到 SLF4J
 */
public class Slf4jRegistryLogger implements RegistryLogger {

    private final Logger log;

    public Slf4jRegistryLogger(Logger log) {
        this.log = log;
    }

    public Slf4jRegistryLogger(String name) {
        this(LoggerFactory.getLogger(name));
    }

    @Override
    public void debug(String format, Object... args) {
        log.debug(format, args);
    }

    @Override
    public void info(String format, Object... args) {
        log.info(format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        log.warn(format, args);
    }

    @Override
    public void error(String format, Object... args) {
        log.error(format, args);
    }
}

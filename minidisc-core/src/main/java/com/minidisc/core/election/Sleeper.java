package com.minidisc.core.election;

import java.time.Duration;

/**
 * 退避等待，可替换以便测试
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

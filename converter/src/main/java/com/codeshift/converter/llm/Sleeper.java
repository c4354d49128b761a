package com.codeshift.converter.llm;

import java.time.Duration;

/**
 * Blocks the gateway between retries. Tests swap in a recording fake so
 * backoff schedules can be asserted without real sleeps.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

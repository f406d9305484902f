package com.purchasingpower.testgen.service.resilience;

import java.time.Duration;

/**
 * Blocking pause between attempts. Replaced in tests to avoid real waiting.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

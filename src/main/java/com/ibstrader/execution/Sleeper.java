package com.ibstrader.execution;

import java.time.Duration;

/** Blocking wait between chase polls. */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

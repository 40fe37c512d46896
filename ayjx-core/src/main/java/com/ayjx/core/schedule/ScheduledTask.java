package com.ayjx.core.schedule;

/** Body of a scheduled task. */
@FunctionalInterface
public interface ScheduledTask {

    void run() throws Exception;
}

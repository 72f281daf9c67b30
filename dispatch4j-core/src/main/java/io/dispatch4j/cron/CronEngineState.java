package io.dispatch4j.cron;

public enum CronEngineState {
    BUILDING,
    RUNNING,
    TEARDOWN,
    STOPPED
}

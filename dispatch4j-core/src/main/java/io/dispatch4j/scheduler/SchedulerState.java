package io.dispatch4j.scheduler;

public enum SchedulerState {
    SWEEPING,
    /** Sleeping until the earliest pending job is due, or a recompute signal. */
    SLEEPING,
    /** No pending job; only a recompute signal wakes the worker. */
    WAITING,
    STOPPED
}

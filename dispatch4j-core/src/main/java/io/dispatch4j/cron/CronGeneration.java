package io.dispatch4j.cron;

import io.dispatch4j.core.CronDescriptor;
import io.dispatch4j.utils.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One generation of active cron triggers.
 *
 * <p>Each trigger re-arms itself on a private {@link ScheduledThreadPoolExecutor}. Once
 * {@link #close()} returns no trigger of this generation starts a new firing; a firing that
 * was already running is left to complete.
 */
final class CronGeneration implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronGeneration.class);

    private final long number;
    private final List<Trigger> triggers;
    private final Consumer<CronDescriptor> action;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor executor;
    private final AtomicBoolean active = new AtomicBoolean(false);

    private record Trigger(CronDescriptor descriptor, CronExpressions.Schedule schedule) {
    }

    CronGeneration(long number, List<CronDescriptor> descriptors, ZoneId zone, int threads,
                   Clock clock, Consumer<CronDescriptor> action) {
        this.number = number;
        this.action = Objects.requireNonNull(action, "action must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        List<Trigger> parsed = new ArrayList<>(descriptors.size());
        for (CronDescriptor d : descriptors) {
            try {
                parsed.add(new Trigger(d, CronExpressions.parse(d.scheduleExpression(), zone)));
            } catch (IllegalArgumentException e) {
                log.error("Skipping cron job {} ({}): {}", d.id(), d.scheduleExpression(), e.getMessage());
            }
        }
        this.triggers = Collections.unmodifiableList(parsed);

        this.executor = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            Thread t = new Thread(r);
            t.setName("dispatch.cron-" + number);
            t.setDaemon(true);
            return t;
        });
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    long number() {
        return number;
    }

    int size() {
        return triggers.size();
    }

    List<CronDescriptor> descriptors() {
        return triggers.stream().map(Trigger::descriptor).toList();
    }

    void start() {
        if (!active.compareAndSet(false, true)) {
            return;
        }
        Instant now = clock.instant();
        for (Trigger t : triggers) {
            arm(t, now);
        }
    }

    boolean isActive() {
        return active.get();
    }

    private void arm(Trigger t, Instant after) {
        if (!active.get()) {
            return;
        }
        Instant next = t.schedule().nextFireAfter(after);
        if (next == null) {
            log.info("Cron job {} ({}) has no future fire time.", t.descriptor().id(), t.descriptor().scheduleExpression());
            return;
        }
        try {
            executor.schedule(() -> fire(t, next), delayNanos(clock.instant(), next), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            // closed between the active check and scheduling
            log.debug("Cron generation {} closed, not re-arming {}.", number, t.descriptor().id());
        }
    }

    /**
     * Full-precision delay from {@code now} to {@code next}, never negative.
     */
    static long delayNanos(Instant now, Instant next) {
        Duration d = Duration.between(now, next);
        if (d.isNegative()) {
            return 0L;
        }
        try {
            return d.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void fire(Trigger t, Instant scheduledAt) {
        if (!active.get()) {
            return;
        }
        // Re-arm before running so a slow receiver cannot push back the next fire.
        Instant now = clock.instant();
        arm(t, now.isAfter(scheduledAt) ? now : scheduledAt);
        try {
            action.accept(t.descriptor());
        } catch (RuntimeException e) {
            log.error("Cron job {} failed unexpectedly msg={}", t.descriptor().id(), e.getMessage(), e);
        }
    }

    /**
     * Stop accepting new firings and drop every pending one.
     */
    @Override
    public void close() {
        active.set(false);
        executor.shutdown();
    }
}

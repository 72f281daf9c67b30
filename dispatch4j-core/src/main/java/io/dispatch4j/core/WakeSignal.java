package io.dispatch4j.core;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-slot wake-up hint for one worker.
 *
 * <p>{@link #raise()} never blocks; raises that happen while a signal is already pending
 * coalesce into that one. A signal carries no payload: the woken worker re-reads its state
 * from the store.
 */
public final class WakeSignal {
    private static final Object TOKEN = new Object();

    private final BlockingQueue<Object> slot = new ArrayBlockingQueue<>(1);

    public void raise() {
        slot.offer(TOKEN);
    }

    /**
     * Block until a signal is raised, consuming it.
     */
    public void await() throws InterruptedException {
        slot.take();
    }

    /**
     * Block until a signal is raised or the timeout elapses.
     *
     * @return {@code true} if woken by a signal, {@code false} on timeout
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (timeout.isNegative() || timeout.isZero()) {
            return slot.poll() != null;
        }
        long nanos;
        try {
            nanos = timeout.toNanos();
        } catch (ArithmeticException overflow) {
            // far-future due times
            nanos = Long.MAX_VALUE;
        }
        return slot.poll(nanos, TimeUnit.NANOSECONDS) != null;
    }

    public boolean isRaised() {
        return !slot.isEmpty();
    }
}

package io.dispatch4j.scheduler;

import io.dispatch4j.CallbackSender;
import io.dispatch4j.Worker;
import io.dispatch4j.core.Job;
import io.dispatch4j.core.JobStore;
import io.dispatch4j.core.WakeSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dispatches persisted one-shot jobs when they become due.
 *
 * <p>The worker loop alternates between a sweep (deliver and delete every due job) and a sleep
 * that lasts until the next job's due time, or forever when nothing is pending. Creating or
 * cancelling a job raises the recompute signal, which cuts the sleep short so the next wake
 * time is always derived from the current contents of the store.
 *
 * <p>Typical usage:
 * <pre>{@code
 * OneShotScheduler scheduler = new OneShotScheduler(jobStore, sender);
 * executor.submit(() -> { scheduler.run(); return null; });
 *
 * String id = scheduler.createJob(Instant.now().plusSeconds(30), body);
 * scheduler.cancelJob(id);
 * scheduler.stop();
 * }</pre>
 */
public class OneShotScheduler implements Worker {
    private static final Logger log = LoggerFactory.getLogger(OneShotScheduler.class);

    private final JobStore jobStore;
    private final CallbackSender sender;
    private final Clock clock;

    private final WakeSignal recompute = new WakeSignal();
    private final ReentrantLock sweepLock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean stopRequested = false;

    private volatile SchedulerState state = SchedulerState.SWEEPING;
    private volatile Instant sleepingUntil;

    public OneShotScheduler(JobStore jobStore, CallbackSender sender) {
        this(jobStore, sender, Clock.systemUTC());
    }

    public OneShotScheduler(JobStore jobStore, CallbackSender sender, Clock clock) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public String name() {
        return "scheduler";
    }

    /**
     * Run the sweep/sleep loop on the calling thread until {@link #stop()} is called.
     *
     * @throws io.dispatch4j.core.StoreException if the job store fails; the loop cannot continue
     */
    @Override
    public void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("One-shot scheduler is already running");
        }
        log.info("One-shot scheduler started.");
        try {
            while (!stopRequested) {
                state = SchedulerState.SWEEPING;
                sleepingUntil = null;
                log.debug("Scheduler woke up.");
                sweep();
                if (stopRequested) {
                    break;
                }

                Optional<Instant> next = jobStore.findNextScheduledFor();
                if (next.isEmpty()) {
                    state = SchedulerState.WAITING;
                    log.debug("Scheduler waiting for job.");
                    recompute.await();
                    continue;
                }

                Instant due = next.get();
                sleepingUntil = due;
                state = SchedulerState.SLEEPING;
                log.debug("Scheduler sleeping until {}.", due);
                if (recompute.await(Duration.between(clock.instant(), due))) {
                    log.debug("Scheduler woken by recompute signal.");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            state = SchedulerState.STOPPED;
            sleepingUntil = null;
            log.info("One-shot scheduler stopped.");
        }
    }

    @Override
    public void stop() {
        stopRequested = true;
        recompute.raise();
    }

    /**
     * Deliver and delete every job that is due now.
     *
     * <p>A failed delivery is logged and the job is still deleted. A failed delete aborts the
     * sweep with {@link io.dispatch4j.core.StoreException}.
     *
     * @return number of jobs dispatched
     */
    int sweep() {
        sweepLock.lock();
        try {
            List<Job> due = jobStore.findDue(clock.instant());
            for (Job job : due) {
                deliver(job);
                jobStore.deleteById(job.id());
            }
            if (!due.isEmpty()) {
                log.info("Executed {} jobs.", due.size());
            }
            return due.size();
        } finally {
            sweepLock.unlock();
        }
    }

    private void deliver(Job job) {
        try {
            sender.send(job.body());
            log.info("Executed job {}.", job.id());
        } catch (Exception e) {
            log.warn("Failed to execute job id={} scheduledFor={} msg={}", job.id(), job.scheduledFor(), e.getMessage());
        }
    }

    /**
     * Persist a new job and wake the worker so it can re-derive its sleep target.
     *
     * @param dueTime earliest instant the job may fire
     * @param body    payload forwarded verbatim; may be null
     * @return the new job id
     */
    public String createJob(Instant dueTime, byte[] body) {
        Objects.requireNonNull(dueTime, "dueTime must not be null");
        Job created = jobStore.insert(dueTime, body);
        log.info("New job with id {} scheduledFor={}.", created.id(), created.scheduledFor());
        recompute.raise();
        return created.id();
    }

    /**
     * Delete a pending job. Unknown ids are ignored.
     */
    public void cancelJob(String id) {
        Objects.requireNonNull(id, "id must not be null");
        if (jobStore.deleteById(id)) {
            recompute.raise();
            log.info("Deleted job {}.", id);
        } else {
            log.debug("Delete ignored, no job with id {}.", id);
        }
    }

    public SchedulerState state() {
        return state;
    }

    /**
     * Due time the worker is currently sleeping towards, or {@code null} when not in
     * {@link SchedulerState#SLEEPING}.
     */
    public Instant sleepingUntil() {
        return sleepingUntil;
    }
}

package io.dispatch4j.worker;

import io.dispatch4j.Worker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs a fixed set of {@link Worker}s, one thread each, as a unit.
 *
 * <p>The first worker to finish, normally or exceptionally, takes the whole group down: the
 * remaining workers are asked to stop and, unless the group itself was being stopped, the
 * failure is handed to the failure handler.
 */
public class WorkerGroup {
    private static final Logger log = LoggerFactory.getLogger(WorkerGroup.class);

    private final List<Worker> workers;
    private final Duration shutdownTimeout;
    private final Consumer<Throwable> onFailure;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private ExecutorService executor;
    private Thread supervisor;

    public WorkerGroup(List<? extends Worker> workers, Duration shutdownTimeout, Consumer<Throwable> onFailure) {
        Objects.requireNonNull(workers, "workers must not be null");
        if (workers.isEmpty()) {
            throw new IllegalArgumentException("workers must not be empty");
        }
        this.workers = List.copyOf(workers);
        this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout must not be null");
        this.onFailure = Objects.requireNonNull(onFailure, "onFailure must not be null");
    }

    /**
     * Start every worker. Should be idempotent.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        executor = Executors.newFixedThreadPool(workers.size(), r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });
        ExecutorCompletionService<Worker> completion = new ExecutorCompletionService<>(executor);
        for (Worker w : workers) {
            completion.submit(() -> {
                Thread.currentThread().setName("dispatch." + w.name());
                w.run();
                return w;
            });
        }

        supervisor = new Thread(() -> supervise(completion));
        supervisor.setName("dispatch.supervisor");
        supervisor.setDaemon(true);
        supervisor.start();
        log.info("Worker group started workers={}", workers.stream().map(Worker::name).toList());
    }

    private void supervise(ExecutorCompletionService<Worker> completion) {
        Throwable failure;
        try {
            Future<Worker> first = completion.take();
            try {
                Worker w = first.get();
                failure = stopping.get() ? null : new IllegalStateException("Worker " + w.name() + " exited unexpectedly");
            } catch (ExecutionException e) {
                failure = e.getCause();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }

        boolean requested = stopping.get();
        if (failure != null && !requested) {
            log.error("Worker failed, stopping worker group msg={}", failure.getMessage(), failure);
        }
        shutdownWorkers();
        if (failure != null && !requested) {
            termination.completeExceptionally(failure);
            onFailure.accept(failure);
        } else {
            termination.complete(null);
        }
    }

    /**
     * Ask every worker to stop and wait up to the shutdown timeout for them to exit.
     * Should be idempotent.
     */
    public void stop() {
        if (!started.get() || !stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("Worker group stopping...");
        shutdownWorkers();
        log.info("Worker group stopped.");
    }

    private synchronized void shutdownWorkers() {
        for (Worker w : workers) {
            try {
                w.stop();
            } catch (RuntimeException e) {
                log.warn("Worker {} failed to stop msg={}", w.name(), e.getMessage(), e);
            }
        }
        if (executor == null || executor.isTerminated()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Workers did not stop within {}, interrupting.", shutdownTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /**
     * Block until the group has terminated.
     *
     * @throws ExecutionException wrapping the first worker failure
     * @throws TimeoutException   if the group is still running after {@code timeout}
     */
    public void await(Duration timeout) throws InterruptedException, ExecutionException, TimeoutException {
        termination.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return started.get() && !termination.isDone();
    }
}

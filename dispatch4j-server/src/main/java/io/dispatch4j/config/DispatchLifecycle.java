package io.dispatch4j.config;

import io.dispatch4j.worker.WorkerGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.SmartLifecycle;

import java.util.function.Consumer;

/**
 * Bridges the scheduling workers' start/stop lifecycle with the Spring container lifecycle.
 */
public class DispatchLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(DispatchLifecycle.class);

    private final WorkerGroup workerGroup;
    private volatile boolean running = false;

    public DispatchLifecycle(WorkerGroup workerGroup) {
        this.workerGroup = workerGroup;
    }

    @Override
    public void start() {
        workerGroup.start();
        running = true;
    }

    @Override
    public void stop() {
        workerGroup.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running && workerGroup.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /**
     * Failure handler that closes the application and exits the JVM with status 1.
     *
     * <p>Runs on its own thread: the caller is the worker supervisor, which the context close
     * would otherwise wait on.
     */
    static Consumer<Throwable> exitOnFailure(ApplicationContext context) {
        return failure -> {
            Thread exit = new Thread(() -> {
                log.error("Scheduling worker failed, shutting down msg={}", failure.getMessage());
                int code = SpringApplication.exit(context, () -> 1);
                System.exit(code);
            });
            exit.setName("dispatch.exit");
            exit.start();
        };
    }
}

package io.dispatch4j;

/**
 * A long-lived background task.
 *
 * <p>{@link #run()} blocks the calling thread until the worker is stopped or fails.
 * {@link #stop()} may be called from any thread and only asks the worker to finish;
 * it does not wait for {@link #run()} to return.
 */
public interface Worker {
    String name();

    void run() throws Exception;

    void stop();
}

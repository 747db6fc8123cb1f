package io.downloader4j;

/**
 * Callback notification API.
 *
 * <p>A notifier consumes jobs whose download has concluded and posts the outcome back to each
 * job's callback URL:
 * <ul>
 *   <li>{@link #start()} requeues callbacks left in progress by a previous run, then starts dispatching</li>
 *   <li>{@link #stop()} stops taking new work and waits for in-flight deliveries to finish</li>
 * </ul>
 */
public interface Notifier {
    void start();

    void stop();

    boolean isRunning();
}

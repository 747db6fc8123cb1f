package io.downloader4j.config;

import io.downloader4j.Notifier;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the notifier with the Spring container and stops it before the store goes away.
 */
public class NotifierLifecycle implements SmartLifecycle {
    private final Notifier notifier;

    public NotifierLifecycle(Notifier notifier) {
        this.notifier = notifier;
    }

    @Override
    public void start() {
        notifier.start();
    }

    @Override
    public void stop() {
        notifier.stop();
    }

    @Override
    public boolean isRunning() {
        return notifier.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}

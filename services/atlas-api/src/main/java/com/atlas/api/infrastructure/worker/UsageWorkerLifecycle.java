package com.atlas.api.infrastructure.worker;

import com.atlas.api.domain.usage.UsageStreamConsumer;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Runs the {@link UsageStreamConsumer} on a dedicated thread for the lifetime of the application
 * context.
 * <p>
 * Runs in the last lifecycle phase, so it starts after the web server and stops first. Stop waits
 * up to the shutdown timeout for the in-flight batch to commit and acknowledge.
 */
public class UsageWorkerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(UsageWorkerLifecycle.class);

    private final Supplier<UsageStreamConsumer> consumers;
    private final Duration shutdownTimeout;

    private UsageStreamConsumer consumer;
    private Thread thread;

    public UsageWorkerLifecycle(Supplier<UsageStreamConsumer> consumers, Duration shutdownTimeout) {
        this.consumers = consumers;
        this.shutdownTimeout = shutdownTimeout;
    }

    @Override
    public synchronized void start() {
        if (thread != null) {
            return;
        }
        consumer = consumers.get();
        thread = new Thread(consumer, "usage-worker");
        thread.setUncaughtExceptionHandler((t, e) -> log.error("Usage worker thread died", e));
        thread.start();
    }

    @Override
    public synchronized void stop() {
        if (thread == null) {
            return;
        }
        if (!consumer.stop(shutdownTimeout)) {
            log.warn("Usage worker did not finish its batch within {}; interrupting", shutdownTimeout);
            thread.interrupt();
        }
        thread = null;
        consumer = null;
    }

    @Override
    public synchronized boolean isRunning() {
        return thread != null;
    }
}

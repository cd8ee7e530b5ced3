package com.atlas.api.domain.usage;

import com.atlas.eventmodel.StreamMessage;
import com.atlas.observability.CorrelationContext;
import com.atlas.observability.CorrelationContextHolder;
import com.atlas.observability.SensitiveDataRedactor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-running consumer that folds usage and scan-request events into tenant counters.
 * <p>
 * Each poll is processed as one batch:
 * <ol>
 *   <li>every message is applied inside its own savepoint; a failing message is logged and rolled
 *       back without affecting the others</li>
 *   <li>the batch transaction commits</li>
 *   <li>every message is acknowledged in arrival order, whether or not it was applied or the
 *       commit succeeded</li>
 * </ol>
 * Delivery is at least once up to the ack; after the ack a failed message is gone for good.
 * <p>
 * {@link #run()} loops until {@link #stop(Duration)} is called. Stop is observed between batches,
 * so an in-flight batch always finishes its commit and acks. Connection failures pause for the
 * configured backoff and retry forever.
 * <p>
 * Streams whose consumer group could not be created, or whose group disappeared, are remembered;
 * group creation is retried for them before the next read.
 */
public class UsageStreamConsumer implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(UsageStreamConsumer.class);

    private final StreamBroker broker;
    private final UsageStore store;
    private final UsageAggregator aggregator;
    private final UsageWorkerSettings settings;
    private final UsageMetrics metrics;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();
    // Only touched by the polling thread.
    private final Set<String> streamsWithoutGroup;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean running;

    public UsageStreamConsumer(StreamBroker broker, UsageStore store, UsageAggregator aggregator,
                               UsageWorkerSettings settings, UsageMetrics metrics) {
        this.broker = broker;
        this.store = store;
        this.aggregator = aggregator;
        this.settings = settings;
        this.metrics = metrics;
        this.streamsWithoutGroup = new LinkedHashSet<>(settings.streams());
    }

    @Override
    public void run() {
        running = true;
        log.info("Usage worker started: group={} consumer={} streams={}",
                settings.group(), settings.consumer(), settings.streams());
        try {
            ensureGroups();
            while (!isStopRequested()) {
                pollOnce();
            }
        } finally {
            running = false;
            finished.countDown();
            log.info("Usage worker stopped");
        }
    }

    /**
     * Requests the loop to exit and waits for the current batch to complete.
     *
     * @return true if the loop exited within {@code timeout}
     */
    public boolean stop(Duration timeout) {
        stopSignal.countDown();
        try {
            return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Creates the consumer group on every stream still lacking one; failures other than "exists"
     * are logged and retried on the next poll.
     *
     * @return true if every stream has its group
     */
    boolean ensureGroups() {
        for (String stream : List.copyOf(streamsWithoutGroup)) {
            try {
                broker.ensureGroup(stream, settings.group());
                streamsWithoutGroup.remove(stream);
            } catch (StreamConnectionException e) {
                metrics.connectionError();
                log.warn("Failed to create consumer group {} on {}: {}", settings.group(), stream, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Failed to create consumer group {} on {}: {}", settings.group(), stream, e.getMessage());
            }
        }
        return streamsWithoutGroup.isEmpty();
    }

    /** One poll: make sure the groups exist, read, process, or back off on failure. */
    void pollOnce() {
        if (!streamsWithoutGroup.isEmpty() && !ensureGroups()) {
            log.warn("Consumer group {} still missing on {}, retrying in {}", settings.group(), streamsWithoutGroup,
                    settings.backoff());
            backoff();
            return;
        }
        try {
            List<StreamMessage> messages = broker.readGroup(settings.group(), settings.consumer(),
                    settings.streams(), settings.batchSize(), settings.block());
            if (!messages.isEmpty()) {
                processBatch(messages);
            }
        } catch (MissingConsumerGroupException e) {
            log.warn("Consumer group {} is missing, recreating: {}", settings.group(), e.getMessage());
            streamsWithoutGroup.addAll(settings.streams());
        } catch (StreamConnectionException e) {
            metrics.connectionError();
            log.warn("Usage worker connection error, retrying in {}: {}", settings.backoff(), e.getMessage());
            backoff();
        } catch (RuntimeException e) {
            log.error("Usage worker poll failed, retrying in {}", settings.backoff(), e);
            backoff();
        }
    }

    /**
     * Applies, commits and acknowledges one batch.
     *
     * @return number of messages whose increments were committed
     */
    int processBatch(List<StreamMessage> messages) {
        return metrics.timeBatch(() -> applyCommitAndAck(messages));
    }

    private int applyCommitAndAck(List<StreamMessage> messages) {
        List<UsageDelta> applied = new ArrayList<>();
        try {
            store.inTransaction(batch -> {
                for (StreamMessage message : messages) {
                    CorrelationContextHolder.runWithContext(CorrelationContext.start(message.id()),
                            () -> applyOne(batch, message, applied));
                }
            });
            applied.forEach(metrics::committed);
            return applied.size();
        } catch (RuntimeException e) {
            metrics.rolledBack(applied.size());
            log.error("Usage batch of {} message(s) failed to commit; acknowledging anyway", messages.size(), e);
            return 0;
        } finally {
            for (StreamMessage message : messages) {
                acknowledge(message);
            }
        }
    }

    private void applyOne(UsageBatch batch, StreamMessage message, List<UsageDelta> applied) {
        try {
            batch.isolated(() -> {
                UsageDelta delta = aggregator.apply(batch, message);
                CorrelationContextHolder.update(ctx -> ctx.withTenant(delta.tenantId()));
                applied.add(delta);
                if (delta.tokens() > 0) {
                    log.info("Tracked {} tokens for tenant {}", delta.tokens(), delta.tenantId());
                } else if (delta.scans() > 0) {
                    log.info("Tracked scan request for tenant {}", delta.tenantId());
                }
            });
        } catch (RuntimeException e) {
            metrics.failed();
            log.error("Usage worker error processing {} from {}: {} fields={}", message.id(), message.stream(),
                    e.getMessage(), redactor.redact(message.fields()));
        }
    }

    private void acknowledge(StreamMessage message) {
        try {
            broker.ack(message.stream(), settings.group(), message.id());
        } catch (RuntimeException e) {
            log.warn("Failed to acknowledge {} on {}: {}", message.id(), message.stream(), e.getMessage());
        }
    }

    private boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    private void backoff() {
        try {
            // Returns early when stop is requested.
            stopSignal.await(settings.backoff().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopSignal.countDown();
        }
    }
}

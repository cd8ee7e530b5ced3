package com.atlas.api.domain.usage;

import com.atlas.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.util.function.Supplier;

/**
 * Counters and the batch timer published by the usage worker.
 */
public final class UsageMetrics {

    private final Counter applied;
    private final Counter failed;
    private final Counter rolledBack;
    private final Counter tokens;
    private final Counter scans;
    private final Counter connectionErrors;
    private final Timer batches;

    public UsageMetrics(MetricFactory metrics) {
        String messages = "atlas.usage.messages";
        this.applied = metrics.counter(messages, "Usage messages processed", "outcome", "applied");
        this.failed = metrics.counter(messages, "Usage messages processed", "outcome", "failed");
        this.rolledBack = metrics.counter(messages, "Usage messages processed", "outcome", "rolled_back");
        this.tokens = metrics.counter("atlas.usage.tokens", "Tokens added to tenant usage");
        this.scans = metrics.counter("atlas.usage.scans", "Scans added to tenant usage");
        this.connectionErrors = metrics.counter("atlas.usage.connection.errors",
                "Stream broker connection failures");
        this.batches = metrics.timer("atlas.usage.batch.duration",
                "Time to apply, commit and acknowledge one usage batch");
    }

    <T> T timeBatch(Supplier<T> batch) {
        return batches.record(batch);
    }

    void committed(UsageDelta delta) {
        applied.increment();
        tokens.increment(delta.tokens());
        scans.increment(delta.scans());
    }

    void failed() {
        failed.increment();
    }

    void rolledBack(int count) {
        rolledBack.increment(count);
    }

    void connectionError() {
        connectionErrors.increment();
    }
}

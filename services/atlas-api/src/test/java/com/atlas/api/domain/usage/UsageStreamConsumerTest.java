package com.atlas.api.domain.usage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.atlas.eventmodel.StreamMessage;
import com.atlas.eventmodel.UsageStreams;
import com.atlas.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("UsageStreamConsumer")
class UsageStreamConsumerTest {

    private static final String GROUP = "test-group";

    private StreamBroker broker;
    private InMemoryUsageStore store;
    private SimpleMeterRegistry registry;
    private UsageStreamConsumer consumer;

    @BeforeEach
    void setUp() {
        broker = mock(StreamBroker.class);
        store = new InMemoryUsageStore();
        registry = new SimpleMeterRegistry();
        consumer = consumer(Duration.ofMillis(20));
    }

    private UsageStreamConsumer consumer(Duration backoff) {
        return consumer(UsageStreams.USAGE, UsageStreams.SCAN_REQUESTS, backoff);
    }

    private UsageStreamConsumer consumer(String usageStream, String scanStream, Duration backoff) {
        var settings = new UsageWorkerSettings(GROUP, "worker-test", usageStream, scanStream, 10,
                Duration.ofMillis(10), backoff);
        var aggregator = new UsageAggregator(new TenantIdExtractor(), usageStream, scanStream);
        return new UsageStreamConsumer(broker, store, aggregator, settings,
                new UsageMetrics(new MetricFactory(registry, "atlas-api-test")));
    }

    private static StreamMessage usage(String id, String payload) {
        return new StreamMessage(UsageStreams.USAGE, id, Map.of(UsageStreams.PAYLOAD_FIELD, payload));
    }

    private static StreamMessage scan(String id, String payload) {
        return new StreamMessage(UsageStreams.SCAN_REQUESTS, id, Map.of(UsageStreams.PAYLOAD_FIELD, payload));
    }

    private double messages(String outcome) {
        return registry.get("atlas.usage.messages").tag("outcome", outcome).counter().count();
    }

    @Nested
    @DisplayName("processBatch")
    class ProcessBatch {

        @Test
        @DisplayName("applies, commits and acknowledges every message in order")
        void appliesAll() {
            var first = usage("1-0", "{\"tenant_id\":\"acme\",\"tokens_used\":100}");
            var second = usage("2-0", "{\"metadata\":{\"tenant_id\":\"acme\"},\"tokens_used\":50}");
            var third = scan("3-0", "{\"tenant_id\":\"acme\"}");

            int committed = consumer.processBatch(List.of(first, second, third));

            assertThat(committed).isEqualTo(3);
            var view = store.findUsage("acme").orElseThrow();
            assertThat(view.tokenCount()).isEqualTo(150);
            assertThat(view.scansCount()).isEqualTo(1);
            assertThat(view.planTier()).isEqualTo("free");
            var acks = inOrder(broker);
            acks.verify(broker).ack(UsageStreams.USAGE, GROUP, "1-0");
            acks.verify(broker).ack(UsageStreams.USAGE, GROUP, "2-0");
            acks.verify(broker).ack(UsageStreams.SCAN_REQUESTS, GROUP, "3-0");
            assertThat(messages("applied")).isEqualTo(3);
            assertThat(registry.get("atlas.usage.tokens").counter().count()).isEqualTo(150);
            assertThat(registry.get("atlas.usage.batch.duration").timer().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("counts messages from configured stream names")
        void configuredStreamNames() {
            var custom = consumer("prod.ai.usage", "prod.scan.requests", Duration.ofMillis(20));
            var tokens = new StreamMessage("prod.ai.usage", "1-0",
                    Map.of(UsageStreams.PAYLOAD_FIELD, "{\"tenant_id\":\"acme\",\"tokens_used\":100}"));
            var scanRequest = new StreamMessage("prod.scan.requests", "2-0",
                    Map.of(UsageStreams.PAYLOAD_FIELD, "{\"tenant_id\":\"acme\"}"));

            int committed = custom.processBatch(List.of(tokens, scanRequest));

            assertThat(committed).isEqualTo(2);
            var view = store.findUsage("acme").orElseThrow();
            assertThat(view.tokenCount()).isEqualTo(100);
            assertThat(view.scansCount()).isEqualTo(1);
            verify(broker).ack("prod.ai.usage", GROUP, "1-0");
            verify(broker).ack("prod.scan.requests", GROUP, "2-0");
            assertThat(messages("failed")).isZero();
        }

        @Test
        @DisplayName("a failing message is rolled back alone and still acknowledged")
        void isolatesFailure() {
            var good = usage("1-0", "{\"tenant_id\":\"acme\",\"tokens_used\":10}");
            var bad = usage("2-0", "{\"tenant_id\":\"globex\",\"tokens_used\":-1}");
            var alsoGood = scan("3-0", "{}");

            int committed = consumer.processBatch(List.of(good, bad, alsoGood));

            assertThat(committed).isEqualTo(2);
            assertThat(store.findUsage("acme").orElseThrow().tokenCount()).isEqualTo(10);
            assertThat(store.findUsage("globex")).isEmpty();
            assertThat(store.findUsage("default").orElseThrow().scansCount()).isEqualTo(1);
            verify(broker).ack(UsageStreams.USAGE, GROUP, "2-0");
            assertThat(messages("failed")).isEqualTo(1);
        }

        @Test
        @DisplayName("a failed commit applies nothing but acknowledges everything")
        void commitFailure() {
            store.failNextCommit();

            int committed = consumer.processBatch(List.of(
                    usage("1-0", "{\"tenant_id\":\"acme\",\"tokens_used\":10}"), scan("2-0", "{}")));

            assertThat(committed).isZero();
            assertThat(store.findUsage("acme")).isEmpty();
            verify(broker).ack(UsageStreams.USAGE, GROUP, "1-0");
            verify(broker).ack(UsageStreams.SCAN_REQUESTS, GROUP, "2-0");
            assertThat(messages("rolled_back")).isEqualTo(2);
        }

        @Test
        @DisplayName("an ack failure does not stop the remaining acks")
        void ackFailure() {
            doThrow(new StreamConnectionException("gone", null))
                    .when(broker).ack(UsageStreams.USAGE, GROUP, "1-0");

            consumer.processBatch(List.of(usage("1-0", "{}"), scan("2-0", "{}")));

            verify(broker).ack(UsageStreams.SCAN_REQUESTS, GROUP, "2-0");
            assertThat(store.commits()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("polling")
    class Polling {

        @Test
        @DisplayName("connection errors are counted and retried after backoff")
        void connectionError() {
            when(broker.readGroup(anyString(), anyString(), anyList(), anyInt(), any()))
                    .thenThrow(new StreamConnectionException("refused", null));

            consumer.pollOnce();

            assertThat(registry.get("atlas.usage.connection.errors").counter().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("an empty read commits nothing")
        void emptyRead() {
            when(broker.readGroup(anyString(), anyString(), anyList(), anyInt(), any())).thenReturn(List.of());

            consumer.pollOnce();

            assertThat(store.commits()).isZero();
        }

        @Test
        @DisplayName("a failed group creation does not stop the other streams")
        void ensureGroupsTolerant() {
            doThrow(new StreamConnectionException("refused", null))
                    .when(broker).ensureGroup(eq(UsageStreams.USAGE), anyString());

            assertThat(consumer.ensureGroups()).isFalse();

            verify(broker).ensureGroup(UsageStreams.SCAN_REQUESTS, GROUP);
            assertThat(registry.get("atlas.usage.connection.errors").counter().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("group creation is retried until it succeeds, then reading resumes")
        void recoversFromStartupOutage() {
            doThrow(new StreamConnectionException("refused", null))
                    .doThrow(new StreamConnectionException("refused", null))
                    .doNothing()
                    .when(broker).ensureGroup(eq(UsageStreams.USAGE), anyString());
            when(broker.readGroup(anyString(), anyString(), anyList(), anyInt(), any()))
                    .thenReturn(List.of(usage("1-0", "{\"tenant_id\":\"acme\",\"tokens_used\":7}")));

            consumer.ensureGroups();
            consumer.pollOnce();

            verify(broker, never()).readGroup(anyString(), anyString(), anyList(), anyInt(), any());
            verify(broker, times(1)).ensureGroup(UsageStreams.SCAN_REQUESTS, GROUP);

            consumer.pollOnce();

            verify(broker, times(3)).ensureGroup(UsageStreams.USAGE, GROUP);
            verify(broker, times(1)).ensureGroup(UsageStreams.SCAN_REQUESTS, GROUP);
            assertThat(store.findUsage("acme").orElseThrow().tokenCount()).isEqualTo(7);

            consumer.pollOnce();

            verify(broker, times(3)).ensureGroup(UsageStreams.USAGE, GROUP);
        }

        @Test
        @DisplayName("a read against a missing group recreates every group before the next read")
        void recreatesMissingGroup() {
            when(broker.readGroup(anyString(), anyString(), anyList(), anyInt(), any()))
                    .thenThrow(new MissingConsumerGroupException("NOGROUP", null))
                    .thenReturn(List.of(scan("1-0", "{\"tenant_id\":\"acme\"}")));
            assertThat(consumer.ensureGroups()).isTrue();

            consumer.pollOnce();
            consumer.pollOnce();

            verify(broker, times(2)).ensureGroup(UsageStreams.USAGE, GROUP);
            verify(broker, times(2)).ensureGroup(UsageStreams.SCAN_REQUESTS, GROUP);
            assertThat(store.findUsage("acme").orElseThrow().scansCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("runs until stopped and reports completion")
        void runAndStop() throws Exception {
            when(broker.readGroup(anyString(), anyString(), anyList(), anyInt(), any())).thenReturn(List.of());
            Thread thread = new Thread(consumer, "usage-worker-test");
            thread.start();
            waitUntilRunning(consumer);

            assertThat(consumer.stop(Duration.ofSeconds(5))).isTrue();

            thread.join(5000);
            assertThat(consumer.isRunning()).isFalse();
            verify(broker).ensureGroup(UsageStreams.USAGE, GROUP);
            verify(broker).ensureGroup(UsageStreams.SCAN_REQUESTS, GROUP);
        }

        @Test
        @DisplayName("stop interrupts a long backoff")
        void stopDuringBackoff() throws Exception {
            var slow = consumer(Duration.ofMinutes(5));
            when(broker.readGroup(anyString(), anyString(), anyList(), anyInt(), any()))
                    .thenThrow(new StreamConnectionException("refused", null));
            Thread thread = new Thread(slow, "usage-worker-test");
            thread.start();
            waitUntilRunning(slow);

            assertThat(slow.stop(Duration.ofSeconds(5))).isTrue();
            thread.join(5000);
            assertThat(thread.isAlive()).isFalse();
        }

        private void waitUntilRunning(UsageStreamConsumer target) throws InterruptedException {
            long deadline = System.currentTimeMillis() + 5000;
            while (!target.isRunning() && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            assertThat(target.isRunning()).isTrue();
        }
    }
}

package com.atlas.api.config;

import com.atlas.api.domain.usage.StreamBroker;
import com.atlas.api.domain.usage.TenantIdExtractor;
import com.atlas.api.domain.usage.UsageAggregator;
import com.atlas.api.domain.usage.UsageMetrics;
import com.atlas.api.domain.usage.UsageStore;
import com.atlas.api.domain.usage.UsageStreamConsumer;
import com.atlas.api.domain.usage.UsageWorkerSettings;
import com.atlas.api.infrastructure.redis.RedisStreamBroker;
import com.atlas.api.infrastructure.worker.UsageWorkerLifecycle;
import com.atlas.observability.MetricFactory;
import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

/**
 * Stream broker and usage worker wiring.
 * <p>
 * The broker is always created because webhook ingestion publishes scan requests; the consumer
 * loop only runs with {@code atlas.usage-worker.enabled=true}.
 */
@Configuration
public class UsageWorkerConfig {

    /** Extra socket time on top of the poll block so blocking reads do not time out client-side. */
    private static final int SOCKET_TIMEOUT_MARGIN_MS = 2000;

    @Bean(destroyMethod = "close")
    public RedisStreamBroker streamBroker(UsageWorkerProperties worker) {
        JedisPoolConfig poolConfig = new JedisPoolConfig();
        poolConfig.setMaxTotal(8);
        poolConfig.setTestWhileIdle(true);
        int timeout = (int) worker.block().toMillis() + SOCKET_TIMEOUT_MARGIN_MS;
        return new RedisStreamBroker(new JedisPool(poolConfig, URI.create(worker.redisUrl()), timeout));
    }

    @Bean
    public UsageAggregator usageAggregator(UsageWorkerSettings settings) {
        return new UsageAggregator(new TenantIdExtractor(), settings.usageStream(), settings.scanStream());
    }

    @Bean
    public UsageMetrics usageMetrics(MetricFactory metricFactory) {
        return new UsageMetrics(metricFactory);
    }

    @Bean
    public UsageWorkerSettings usageWorkerSettings(UsageWorkerProperties worker) {
        return new UsageWorkerSettings(worker.group(), worker.consumer(), worker.usageStream(),
                worker.scanStream(), worker.batchSize(), worker.block(), worker.backoff());
    }

    @Bean
    @ConditionalOnProperty(prefix = "atlas.usage-worker", name = "enabled", havingValue = "true")
    public UsageWorkerLifecycle usageWorkerLifecycle(StreamBroker broker, UsageStore store,
                                                     UsageAggregator aggregator, UsageWorkerSettings settings,
                                                     UsageMetrics metrics, UsageWorkerProperties worker) {
        return new UsageWorkerLifecycle(
                () -> new UsageStreamConsumer(broker, store, aggregator, settings, metrics),
                worker.shutdownTimeout());
    }
}

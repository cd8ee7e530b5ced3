package com.atlas.api.config;

import com.atlas.api.domain.usage.UsageStore;
import com.atlas.api.domain.webhook.WebhookEventStore;
import com.atlas.api.infrastructure.persistence.JdbcApiKeyRegistry;
import com.atlas.api.infrastructure.persistence.JdbcUsageStore;
import com.atlas.api.infrastructure.persistence.JdbcWebhookEventStore;
import com.atlas.security.ApiKeyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JDBC-backed stores. The schema is applied by Flyway from {@code atlas-database}.
 */
@Configuration
public class PersistenceConfig {

    @Bean
    public UsageStore usageStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new JdbcUsageStore(jdbcTemplate, transactionTemplate);
    }

    @Bean
    public WebhookEventStore webhookEventStore(JdbcTemplate jdbcTemplate) {
        return new JdbcWebhookEventStore(jdbcTemplate);
    }

    @Bean
    public ApiKeyRegistry apiKeyRegistry(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        return new JdbcApiKeyRegistry(jdbcTemplate, transactionTemplate);
    }
}

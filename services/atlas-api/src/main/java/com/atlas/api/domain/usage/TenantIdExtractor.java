package com.atlas.api.domain.usage;

import com.atlas.eventmodel.UsageStreams;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Finds the tenant a usage payload belongs to by trying an ordered list of field paths.
 * <p>
 * Rules: {@code tenant_id}, then {@code metadata.tenant_id}, then {@link UsageStreams#DEFAULT_TENANT}.
 * A rule matches only a non-blank textual value.
 */
public final class TenantIdExtractor {

    /** One lookup rule; empty when the payload does not carry the field. */
    @FunctionalInterface
    public interface Rule extends Function<JsonNode, Optional<String>> {
    }

    private static final List<Rule> DEFAULT_RULES = List.of(
            path("tenant_id"),
            path("metadata", "tenant_id"));

    private final List<Rule> rules;
    private final String fallback;

    public TenantIdExtractor() {
        this(DEFAULT_RULES, UsageStreams.DEFAULT_TENANT);
    }

    public TenantIdExtractor(List<Rule> rules, String fallback) {
        this.rules = List.copyOf(rules);
        this.fallback = fallback;
    }

    public String extract(JsonNode payload) {
        for (Rule rule : rules) {
            Optional<String> tenant = rule.apply(payload);
            if (tenant.isPresent()) {
                return tenant.get();
            }
        }
        return fallback;
    }

    /** Rule matching the textual value at the given nested field path. */
    public static Rule path(String... fields) {
        return payload -> {
            JsonNode node = payload;
            for (String field : fields) {
                node = node.path(field);
            }
            if (node.isTextual() && !node.asText().isBlank()) {
                return Optional.of(node.asText());
            }
            return Optional.empty();
        };
    }
}

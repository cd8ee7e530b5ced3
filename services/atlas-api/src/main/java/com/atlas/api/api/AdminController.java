package com.atlas.api.api;

import com.atlas.api.domain.usage.TenantUsageView;
import com.atlas.api.domain.usage.UsageStore;
import com.atlas.api.infrastructure.web.CurrentIdentity;
import com.atlas.api.infrastructure.web.InvalidRequestException;
import com.atlas.api.infrastructure.web.RequiresRole;
import com.atlas.observability.SensitiveDataRedactor;
import com.atlas.security.ApiKeyRegistry;
import com.atlas.security.Identity;
import com.atlas.security.Role;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Platform administration: API-key management and cross-tenant usage statistics.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiresRole(Role.ADMIN)
public class AdminController {

    static final int STATS_LIMIT = 50;
    static final String KEY_PREFIX = "atlas_";

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final ApiKeyRegistry apiKeys;
    private final UsageStore usage;

    public AdminController(ApiKeyRegistry apiKeys, UsageStore usage) {
        this.apiKeys = apiKeys;
        this.usage = usage;
    }

    /**
     * @param key      the key to register; generated when omitted
     * @param tenantId pins the key to one tenant when set
     */
    public record ApiKeyRequest(
            String key,
            @NotBlank String id,
            @NotBlank String username,
            @NotBlank String role,
            String email,
            @JsonProperty("tenant_id") String tenantId) {
    }

    public record ApiKeyResponse(String key, String id, String username, String role,
                                 @JsonProperty("tenant_id") String tenantId) {
    }

    public record TenantStats(String name, String plan, long scans, long tokens) {

        static TenantStats from(TenantUsageView view) {
            return new TenantStats(view.name(), view.planTier(), view.scansCount(), view.tokenCount());
        }
    }

    @PostMapping("/api-keys")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiKeyResponse registerKey(@Valid @RequestBody ApiKeyRequest request, @CurrentIdentity Identity admin) {
        if (Role.fromString(request.role()).isEmpty()) {
            throw new InvalidRequestException("role must be one of viewer, auditor, admin");
        }
        String key = request.key() == null || request.key().isBlank() ? generateKey() : request.key();
        Map<String, String> metadata = request.tenantId() == null || request.tenantId().isBlank()
                ? Map.of()
                : Map.of(Identity.TENANT_ID, request.tenantId());
        apiKeys.register(key, new Identity(request.id(), request.username(), request.role(), request.email(), metadata));
        log.info("{} registered API key {} for {} ({})", admin.username(), SensitiveDataRedactor.mask(key),
                request.username(), request.role());
        return new ApiKeyResponse(key, request.id(), request.username(), request.role(),
                metadata.get(Identity.TENANT_ID));
    }

    @DeleteMapping("/api-keys/{key}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeKey(@PathVariable String key, @CurrentIdentity Identity admin) {
        if (!apiKeys.remove(key)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "API key not found");
        }
        log.info("{} removed API key {}", admin.username(), SensitiveDataRedactor.mask(key));
    }

    @GetMapping("/cross-org-stats")
    public Map<String, List<TenantStats>> crossOrgStats() {
        return Map.of("tenants", usage.topByScans(STATS_LIMIT).stream().map(TenantStats::from).toList());
    }

    private static String generateKey() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return KEY_PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}

package com.vcc.admission.config;

import com.vcc.admission.model.FailurePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "admission")
@Validated
public class AdmissionProperties {

    @Min(1)
    private int windowSeconds = 60;

    @Min(1)
    private long ipLimit = 100;

    // Paths never throttled (health checks, docs, admin API)
    private List<String> skipPaths = new ArrayList<>(List.of(
            "/health", "/actuator", "/docs", "/redoc", "/openapi.json", "/favicon.ico", "/admin"));

    @Valid
    private IdentityConfig identity = new IdentityConfig();

    @Valid
    private QuotaConfig quota = new QuotaConfig();

    @Valid
    private StoreConfig store = new StoreConfig();

    @Valid
    private CacheConfig cache = new CacheConfig();

    @Valid
    private AdminConfig admin = new AdminConfig();

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public long getIpLimit() {
        return ipLimit;
    }

    public void setIpLimit(long ipLimit) {
        this.ipLimit = ipLimit;
    }

    public List<String> getSkipPaths() {
        return skipPaths;
    }

    public void setSkipPaths(List<String> skipPaths) {
        this.skipPaths = skipPaths;
    }

    public IdentityConfig getIdentity() {
        return identity;
    }

    public void setIdentity(IdentityConfig identity) {
        this.identity = identity;
    }

    public QuotaConfig getQuota() {
        return quota;
    }

    public void setQuota(QuotaConfig quota) {
        this.quota = quota;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    public AdminConfig getAdmin() {
        return admin;
    }

    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Per-role limits for the identity layer.
     */
    public static class IdentityConfig {
        // Role used when a principal carries a role with no configured limit
        @NotBlank
        private String defaultRole = "user";

        // role -> requests per window ("unlimited" allowed)
        private Map<String, String> roleLimits = new LinkedHashMap<>();

        public String getDefaultRole() {
            return defaultRole;
        }

        public void setDefaultRole(String defaultRole) {
            this.defaultRole = defaultRole;
        }

        public Map<String, String> getRoleLimits() {
            return roleLimits;
        }

        public void setRoleLimits(Map<String, String> roleLimits) {
            this.roleLimits = roleLimits;
        }
    }

    /**
     * Organization quota layer configuration.
     */
    public static class QuotaConfig {
        private String upgradeUrl = "/pricing";

        // Bound on the plan and usage lookup at admission
        @Min(1)
        private long timeoutMillis = 2000;

        // Endpoints that draw on an organization quota
        @Valid
        private List<QuotaEndpoint> endpoints = new ArrayList<>();

        public String getUpgradeUrl() {
            return upgradeUrl;
        }

        public void setUpgradeUrl(String upgradeUrl) {
            this.upgradeUrl = upgradeUrl;
        }

        public long getTimeoutMillis() {
            return timeoutMillis;
        }

        public void setTimeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
        }

        public List<QuotaEndpoint> getEndpoints() {
            return endpoints;
        }

        public void setEndpoints(List<QuotaEndpoint> endpoints) {
            this.endpoints = endpoints;
        }
    }

    /**
     * One quota-relevant endpoint: method plus path prefix mapped to a resource type.
     */
    public static class QuotaEndpoint {
        @NotBlank
        private String method = "POST";

        @NotBlank
        private String pathPrefix;

        @NotBlank
        private String resource;

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public String getPathPrefix() {
            return pathPrefix;
        }

        public void setPathPrefix(String pathPrefix) {
            this.pathPrefix = pathPrefix;
        }

        public String getResource() {
            return resource;
        }

        public void setResource(String resource) {
            this.resource = resource;
        }
    }

    /**
     * Window counter store configuration.
     */
    public static class StoreConfig {
        // redis (shared across instances) or memory (single instance)
        @Pattern(regexp = "redis|memory", message = "Store type must be redis or memory")
        private String type = "redis";

        @Min(1)
        private long timeoutMillis = 250;

        @NotNull
        private FailurePolicy failurePolicy = FailurePolicy.FAIL_OPEN;

        // Stale windows are kept this long past their end to tolerate clock skew
        @Min(0)
        private long graceSeconds = 120;

        @Min(1000)
        private long compactionIntervalMillis = 60_000;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public long getTimeoutMillis() {
            return timeoutMillis;
        }

        public void setTimeoutMillis(long timeoutMillis) {
            this.timeoutMillis = timeoutMillis;
        }

        public FailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public long getGraceSeconds() {
            return graceSeconds;
        }

        public void setGraceSeconds(long graceSeconds) {
            this.graceSeconds = graceSeconds;
        }

        public long getCompactionIntervalMillis() {
            return compactionIntervalMillis;
        }

        public void setCompactionIntervalMillis(long compactionIntervalMillis) {
            this.compactionIntervalMillis = compactionIntervalMillis;
        }
    }

    /**
     * Cache configuration for Redis.
     */
    public static class CacheConfig {
        // Redis key prefix
        private String keyPrefix = "adm:";

        // Organization plan cache TTL in seconds
        private int planTtlSeconds = 60;

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public int getPlanTtlSeconds() {
            return planTtlSeconds;
        }

        public void setPlanTtlSeconds(int planTtlSeconds) {
            this.planTtlSeconds = planTtlSeconds;
        }
    }

    /**
     * Admin API configuration.
     */
    public static class AdminConfig {
        // Header name for admin API key
        private String apiKeyHeader = "X-Admin-Api-Key";

        // List of valid admin API keys
        private List<String> adminApiKeys = new ArrayList<>();

        public String getApiKeyHeader() {
            return apiKeyHeader;
        }

        public void setApiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }

        public List<String> getAdminApiKeys() {
            return adminApiKeys;
        }

        public void setAdminApiKeys(List<String> adminApiKeys) {
            this.adminApiKeys = adminApiKeys;
        }
    }
}

package com.vcc.admission.web;

import com.vcc.admission.config.AdmissionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Guards the admin introspection API with a shared API key header.
 * Requests without a configured key are refused, so the admin surface is closed by default.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AdminSecurityFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(AdminSecurityFilter.class);

    private static final String ADMIN_PATH_PREFIX = "/admin";

    private final String apiKeyHeader;
    private final List<String> adminApiKeys;

    public AdminSecurityFilter(AdmissionProperties properties) {
        AdmissionProperties.AdminConfig adminConfig = properties.getAdmin();
        this.apiKeyHeader = adminConfig != null && adminConfig.getApiKeyHeader() != null
                ? adminConfig.getApiKeyHeader()
                : "X-Admin-Api-Key";
        this.adminApiKeys = adminConfig != null && adminConfig.getAdminApiKeys() != null
                ? adminConfig.getAdminApiKeys().stream().filter(k -> k != null && !k.isBlank()).toList()
                : List.of();

        if (!adminApiKeys.isEmpty()) {
            log.info("AdminSecurityFilter configured with {} admin keys", adminApiKeys.size());
        } else {
            log.warn("AdminSecurityFilter: no admin API keys configured, admin endpoints are closed");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();
        if (!path.equals(ADMIN_PATH_PREFIX) && !path.startsWith(ADMIN_PATH_PREFIX + "/")) {
            return chain.filter(exchange);
        }

        if (adminApiKeys.isEmpty()) {
            return unauthorized(exchange, "Admin API not configured");
        }

        String providedKey = exchange.getRequest().getHeaders().getFirst(apiKeyHeader);
        if (providedKey == null || providedKey.isBlank()) {
            return unauthorized(exchange, "Missing " + apiKeyHeader + " header");
        }

        if (!isValidKey(providedKey)) {
            log.warn("Invalid admin API key from {}", ClientIpResolver.resolve(exchange.getRequest()));
            return unauthorized(exchange, "Invalid admin API key");
        }

        String actor = "admin:" + maskKey(providedKey);
        exchange.getAttributes().put(AdmissionAttributes.ADMIN_ACTOR, actor);

        log.debug("Admin request authenticated: {} {}", actor, path);
        return chain.filter(exchange);
    }

    private boolean isValidKey(String providedKey) {
        byte[] provided = providedKey.getBytes(StandardCharsets.UTF_8);
        boolean match = false;
        for (String key : adminApiKeys) {
            match |= MessageDigest.isEqual(provided, key.getBytes(StandardCharsets.UTF_8));
        }
        return match;
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        String body = String.format("{\"error\":\"Unauthorized\",\"message\":\"%s\"}", message);
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);

        return exchange.getResponse().writeWith(
                Mono.just(exchange.getResponse().bufferFactory().wrap(bytes))
        );
    }

    /**
     * First 8 chars of the key, enough to tell operators apart in audit records.
     */
    private static String maskKey(String key) {
        if (key.length() < 8) {
            return "****";
        }
        return key.substring(0, 8) + "...";
    }
}

package com.vcc.admission.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.dto.DenyResponse;
import com.vcc.admission.model.AdmissionDecision;
import com.vcc.admission.model.AdmissionRequest;
import com.vcc.admission.model.LayerOutcome;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.OrganizationTarget;
import com.vcc.admission.model.QuotaReservation;
import com.vcc.admission.model.ResourceType;
import com.vcc.admission.model.UsageView;
import com.vcc.admission.model.VerifiedPrincipal;
import com.vcc.admission.service.QuotaResolver;
import com.vcc.admission.service.ThrottleOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Request-path admission gate.
 *
 * Runs after the identity provider's filter (which places the verified principal in
 * {@link AdmissionAttributes#PRINCIPAL}) and before any handler. Denied requests get a
 * 429 with a JSON body and never reach business logic. Admitted quota-relevant requests
 * hold a reserved unit, settled once the handler has produced its response.
 */
@Component
@Order(0)
public class AdmissionWebFilter implements WebFilter {
    private static final Logger log = LoggerFactory.getLogger(AdmissionWebFilter.class);

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";
    static final String HEADER_QUOTA_LIMIT = "X-Quota-Limit";
    static final String HEADER_QUOTA_REMAINING = "X-Quota-Remaining";
    static final String HEADER_QUOTA_RESET = "X-Quota-Reset";

    private final ThrottleOrchestrator orchestrator;
    private final QuotaResolver quotaResolver;
    private final QuotaEndpointRegistry endpointRegistry;
    private final ObjectMapper objectMapper;
    private final List<String> skipPaths;

    public AdmissionWebFilter(ThrottleOrchestrator orchestrator,
                              QuotaResolver quotaResolver,
                              QuotaEndpointRegistry endpointRegistry,
                              ObjectMapper objectMapper,
                              AdmissionProperties properties) {
        this.orchestrator = orchestrator;
        this.quotaResolver = quotaResolver;
        this.endpointRegistry = endpointRegistry;
        this.objectMapper = objectMapper;
        this.skipPaths = properties.getSkipPaths() != null ? List.copyOf(properties.getSkipPaths()) : List.of();
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getPath().value();

        // CORS preflight and infrastructure paths are never throttled
        if (HttpMethod.OPTIONS.equals(request.getMethod()) || isSkipped(path)) {
            return chain.filter(exchange);
        }

        VerifiedPrincipal principal = exchange.getAttribute(AdmissionAttributes.PRINCIPAL);
        OrganizationTarget target = resolveTarget(request.getMethod(), path, principal);
        AdmissionRequest admissionRequest = new AdmissionRequest(
                ClientIpResolver.resolve(request),
                principal,
                target,
                path,
                request.getHeaders().getFirst(HttpHeaders.USER_AGENT));

        return orchestrator.admit(admissionRequest)
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        return deny(exchange, decision);
                    }
                    applyHeaders(exchange.getResponse().getHeaders(), decision);
                    if (target == null) {
                        return chain.filter(exchange);
                    }
                    QuotaReservation reservation = decision.reservation();
                    return chain.filter(exchange)
                            .onErrorResume(e -> settle(exchange, target, reservation, false)
                                    .then(Mono.<Void>error(e)))
                            .then(Mono.defer(() -> settle(exchange, target, reservation, isSuccess(exchange))));
                });
    }

    private boolean isSkipped(String path) {
        for (String skip : skipPaths) {
            if (path.equals(skip) || path.startsWith(skip.endsWith("/") ? skip : skip + "/")) {
                return true;
            }
        }
        return false;
    }

    private OrganizationTarget resolveTarget(HttpMethod method, String path, VerifiedPrincipal principal) {
        // Individual accounts have no organization quota
        if (principal == null || !principal.hasOrganization()) {
            return null;
        }
        return endpointRegistry.match(method, path)
                .map(resourceType -> new OrganizationTarget(principal.organizationId(), resourceType))
                .orElse(null);
    }

    /**
     * Reconcile the unit reserved at admission with what the handler consumed: a failed
     * request or one reporting zero units gives the reservation back, one reporting more
     * units meters the difference. Without a reservation (fail-open) consumed units are
     * metered in full. Failures here are logged and never turn a served response into an
     * error.
     */
    private Mono<Void> settle(ServerWebExchange exchange,
                              OrganizationTarget target,
                              QuotaReservation reservation,
                              boolean succeeded) {
        long consumed = succeeded ? billableUnits(exchange) : 0L;
        long held = reservation != null ? reservation.units() : 0L;
        ResourceType resourceType = target.resourceType();

        Mono<UsageView> adjustment;
        if (consumed > held) {
            adjustment = quotaResolver.consume(target.organizationId(), resourceType, consumed - held);
        } else if (consumed < held) {
            adjustment = quotaResolver.release(reservation, held - consumed);
        } else {
            return Mono.empty();
        }
        return adjustment
                .doOnError(e -> log.error("Failed to settle {} {} for organization {} (reserved {}): {}",
                        consumed, resourceType.code(), target.organizationId(), held, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    private static boolean isSuccess(ServerWebExchange exchange) {
        HttpStatusCode status = exchange.getResponse().getStatusCode();
        return status == null || status.is2xxSuccessful();
    }

    private static long billableUnits(ServerWebExchange exchange) {
        Object units = exchange.getAttribute(AdmissionAttributes.BILLABLE_UNITS);
        if (units instanceof Number number) {
            return Math.max(0L, number.longValue());
        }
        return 1L;
    }

    private Mono<Void> deny(ServerWebExchange exchange, AdmissionDecision decision) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        applyDenyHeaders(response.getHeaders(), decision);

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(DenyResponse.from(decision));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize denial: {}", e.getMessage());
            bytes = String.format("{\"error\":\"%s\"}", decision.error()).getBytes(StandardCharsets.UTF_8);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(bytes)));
    }

    private static void applyDenyHeaders(HttpHeaders headers, AdmissionDecision decision) {
        LayerOutcome rejecting = decision.layer(decision.rejectingLayer());
        if (decision.rejectingLayer() == LayerScope.ORGANIZATION) {
            if (decision.limit() != null) {
                headers.set(HEADER_QUOTA_LIMIT, String.valueOf(decision.limit()));
            }
            headers.set(HEADER_QUOTA_REMAINING, "0");
            if (rejecting != null && rejecting.resetAt() != null) {
                headers.set(HEADER_QUOTA_RESET, String.valueOf(rejecting.resetAt().getEpochSecond()));
            }
        } else {
            if (decision.limit() != null) {
                headers.set(HEADER_LIMIT, String.valueOf(decision.limit()));
            }
            headers.set(HEADER_REMAINING, "0");
            if (rejecting != null && rejecting.resetAt() != null) {
                headers.set(HEADER_RESET, String.valueOf(rejecting.resetAt().getEpochSecond()));
            }
        }
        if (decision.retryAfterSeconds() != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
        }
    }

    /**
     * Rate-limit headers describe the identity window when one was counted, else the IP
     * window. Quota headers appear on quota-relevant requests with a finite limit.
     */
    private static void applyHeaders(HttpHeaders headers, AdmissionDecision decision) {
        LayerOutcome window = decision.layer(LayerScope.IDENTITY);
        if (window == null || window.limit() == null) {
            window = decision.layer(LayerScope.IP);
        }
        if (window != null && window.limit() != null) {
            headers.set(HEADER_LIMIT, String.valueOf(window.limit()));
            headers.set(HEADER_REMAINING, String.valueOf(window.remaining()));
            if (window.resetAt() != null) {
                headers.set(HEADER_RESET, String.valueOf(window.resetAt().getEpochSecond()));
            }
        }

        LayerOutcome quota = decision.layer(LayerScope.ORGANIZATION);
        if (quota != null && quota.limit() != null) {
            headers.set(HEADER_QUOTA_LIMIT, String.valueOf(quota.limit()));
            headers.set(HEADER_QUOTA_REMAINING, String.valueOf(quota.remaining()));
            if (quota.resetAt() != null) {
                headers.set(HEADER_QUOTA_RESET, String.valueOf(quota.resetAt().getEpochSecond()));
            }
        }
    }
}

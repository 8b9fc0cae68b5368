package com.vcc.admission.web;

import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps request method and path to the resource type a request draws on. Unknown
 * resource names fail startup.
 */
@Component
public class QuotaEndpointRegistry {
    private static final Logger log = LoggerFactory.getLogger(QuotaEndpointRegistry.class);

    private record Route(HttpMethod method, String pathPrefix, ResourceType resourceType) {
    }

    private final List<Route> routes;

    public QuotaEndpointRegistry(AdmissionProperties properties) {
        List<Route> parsed = new ArrayList<>();
        for (AdmissionProperties.QuotaEndpoint endpoint : properties.getQuota().getEndpoints()) {
            if (endpoint.getPathPrefix() == null || endpoint.getPathPrefix().isBlank()) {
                throw new AdmissionConfigurationException("Quota endpoint is missing a path prefix");
            }
            HttpMethod method = HttpMethod.valueOf(endpoint.getMethod().trim().toUpperCase(Locale.ROOT));
            ResourceType resourceType = ResourceType.fromCode(endpoint.getResource());
            parsed.add(new Route(method, endpoint.getPathPrefix().trim(), resourceType));
        }
        // Longest prefix wins
        parsed.sort(Comparator.comparingInt((Route r) -> r.pathPrefix().length()).reversed());
        this.routes = List.copyOf(parsed);
        log.info("QuotaEndpointRegistry loaded {} quota endpoints", routes.size());
    }

    public Optional<ResourceType> match(HttpMethod method, String path) {
        if (method == null || path == null) {
            return Optional.empty();
        }
        for (Route route : routes) {
            if (route.method().equals(method) && matchesPrefix(path, route.pathPrefix())) {
                return Optional.of(route.resourceType());
            }
        }
        return Optional.empty();
    }

    private static boolean matchesPrefix(String path, String prefix) {
        if (!path.startsWith(prefix)) {
            return false;
        }
        return path.length() == prefix.length()
                || prefix.endsWith("/")
                || path.charAt(prefix.length()) == '/';
    }
}

package com.vcc.admission.service;

import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.ResolvableType;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reads plan limits from {@code admission.plans}, binding them fresh from the
 * {@link Environment} on every load so a reload picks up property sources that changed
 * since startup (an external config file, a refreshed config server source).
 */
@Component
public class ConfiguredPlanLimitProvider implements PlanLimitProvider {

    static final String PLANS_PREFIX = "admission.plans";

    private static final Bindable<Map<String, Map<String, String>>> PLANS_TYPE = Bindable.of(
            ResolvableType.forClassWithGenerics(Map.class,
                    ResolvableType.forClass(String.class),
                    ResolvableType.forClassWithGenerics(Map.class, String.class, String.class)));

    private final Environment environment;

    public ConfiguredPlanLimitProvider(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Map<String, Map<String, String>> loadPlanLimits() {
        return Binder.get(environment)
                .bind(PLANS_PREFIX, PLANS_TYPE)
                .orElseGet(Map::of);
    }
}

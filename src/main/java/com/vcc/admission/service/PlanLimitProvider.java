package com.vcc.admission.service;

import java.util.Map;

/**
 * Source of the plan/limit reference data owned by billing.
 * Returns plan tier to resource type to limit, where a limit is a non-negative integer or
 * {@code unlimited}.
 */
public interface PlanLimitProvider {

    Map<String, Map<String, String>> loadPlanLimits();
}

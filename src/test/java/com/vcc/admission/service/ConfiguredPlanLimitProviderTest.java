package com.vcc.admission.service;

import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.model.PlanTier;
import com.vcc.admission.model.QuotaLimit;
import com.vcc.admission.model.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfiguredPlanLimitProviderTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("admission.plans.free.calculations", "100")
                .withProperty("admission.plans.free.comparisons", "50")
                .withProperty("admission.plans.pro.calculations", "1000")
                .withProperty("admission.plans.pro.comparisons", "500")
                .withProperty("admission.plans.enterprise.calculations", "10000")
                .withProperty("admission.plans.enterprise.comparisons", "unlimited");
    }

    @Test
    void testBindsPlansFromEnvironment() {
        Map<String, Map<String, String>> plans = new ConfiguredPlanLimitProvider(environment).loadPlanLimits();

        assertEquals("100", plans.get("free").get("calculations"));
        assertEquals("unlimited", plans.get("enterprise").get("comparisons"));
    }

    @Test
    void testReloadPicksUpChangedLimits() {
        PlanLimitTable table = new PlanLimitTable(new ConfiguredPlanLimitProvider(environment));
        assertEquals(QuotaLimit.of(100), table.limitFor(PlanTier.FREE, ResourceType.CALCULATIONS));

        environment.setProperty("admission.plans.free.calculations", "250");
        environment.setProperty("admission.plans.pro.comparisons", "unlimited");
        table.reload();

        assertEquals(QuotaLimit.of(250), table.limitFor(PlanTier.FREE, ResourceType.CALCULATIONS));
        assertTrue(table.limitFor(PlanTier.PRO, ResourceType.COMPARISONS).unlimited());
    }

    @Test
    void testMissingPlansFailsStartup() {
        assertThrows(AdmissionConfigurationException.class,
                () -> new PlanLimitTable(new ConfiguredPlanLimitProvider(new MockEnvironment())));
    }
}

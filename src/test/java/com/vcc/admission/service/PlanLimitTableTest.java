package com.vcc.admission.service;

import com.vcc.admission.TestProperties;
import com.vcc.admission.config.AdmissionConfigurationException;
import com.vcc.admission.model.PlanTier;
import com.vcc.admission.model.QuotaLimit;
import com.vcc.admission.model.ResourceType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PlanLimitTableTest {

    @Test
    void testLoadsDefaultPlans() {
        PlanLimitTable table = new PlanLimitTable(TestProperties::defaultPlans);

        assertEquals(QuotaLimit.of(100), table.limitFor(PlanTier.FREE, ResourceType.CALCULATIONS));
        assertEquals(QuotaLimit.of(50), table.limitFor(PlanTier.FREE, ResourceType.COMPARISONS));
        assertEquals(QuotaLimit.of(1000), table.limitFor(PlanTier.PRO, ResourceType.CALCULATIONS));
        assertEquals(QuotaLimit.of(10000), table.limitFor(PlanTier.ENTERPRISE, ResourceType.CALCULATIONS));
        assertTrue(table.limitFor(PlanTier.ENTERPRISE, ResourceType.COMPARISONS).unlimited());
    }

    @Test
    void testUnknownTierFailsStartup() {
        Map<String, Map<String, String>> plans = new HashMap<>(TestProperties.defaultPlans());
        plans.put("platinum", Map.of("calculations", "1", "comparisons", "1"));

        assertThrows(AdmissionConfigurationException.class, () -> new PlanLimitTable(() -> plans));
    }

    @Test
    void testUnknownResourceFailsStartup() {
        Map<String, Map<String, String>> plans = new HashMap<>(TestProperties.defaultPlans());
        plans.put("free", Map.of("calculations", "100", "comparisons", "50", "exports", "5"));

        assertThrows(AdmissionConfigurationException.class, () -> new PlanLimitTable(() -> plans));
    }

    @Test
    void testMissingCombinationFailsStartup() {
        Map<String, Map<String, String>> plans = new HashMap<>(TestProperties.defaultPlans());
        plans.put("pro", Map.of("calculations", "1000"));

        AdmissionConfigurationException e = assertThrows(AdmissionConfigurationException.class,
                () -> new PlanLimitTable(() -> plans));
        assertTrue(e.getMessage().contains("comparisons"));
    }

    @Test
    void testReloadSwapsTable() {
        AtomicReference<Map<String, Map<String, String>>> source =
                new AtomicReference<>(TestProperties.defaultPlans());
        PlanLimitTable table = new PlanLimitTable(source::get);

        Map<String, Map<String, String>> raised = new HashMap<>(TestProperties.defaultPlans());
        raised.put("free", Map.of("calculations", "200", "comparisons", "50"));
        source.set(raised);

        assertEquals(6, table.reload());
        assertEquals(QuotaLimit.of(200), table.limitFor(PlanTier.FREE, ResourceType.CALCULATIONS));
    }

    @Test
    void testInvalidReloadKeepsCurrentTable() {
        AtomicReference<Map<String, Map<String, String>>> source =
                new AtomicReference<>(TestProperties.defaultPlans());
        PlanLimitTable table = new PlanLimitTable(source::get);

        source.set(Map.of("free", Map.of("calculations", "-1")));

        assertThrows(AdmissionConfigurationException.class, table::reload);
        assertEquals(QuotaLimit.of(100), table.limitFor(PlanTier.FREE, ResourceType.CALCULATIONS));
    }

    @Test
    void testSnapshotIsImmutable() {
        PlanLimitTable table = new PlanLimitTable(TestProperties::defaultPlans);

        assertThrows(UnsupportedOperationException.class,
                () -> table.snapshot().get(PlanTier.FREE).put(ResourceType.CALCULATIONS, QuotaLimit.of(1)));
    }
}

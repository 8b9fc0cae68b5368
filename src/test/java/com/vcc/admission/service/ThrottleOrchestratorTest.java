package com.vcc.admission.service;

import com.vcc.admission.MutableClock;
import com.vcc.admission.TestProperties;
import com.vcc.admission.config.AdmissionProperties;
import com.vcc.admission.model.AdmissionDecision;
import com.vcc.admission.model.AdmissionRequest;
import com.vcc.admission.model.BillingPeriod;
import com.vcc.admission.model.FailurePolicy;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.OrganizationTarget;
import com.vcc.admission.model.PlanTier;
import com.vcc.admission.model.QuotaLimit;
import com.vcc.admission.model.QuotaReservation;
import com.vcc.admission.model.ResourceType;
import com.vcc.admission.model.UsageView;
import com.vcc.admission.model.VerifiedPrincipal;
import com.vcc.admission.store.InMemoryWindowCounterStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ThrottleOrchestratorTest {

    private static final String IP = "203.0.113.7";
    private static final String ORG = "org-1";
    private static final String ENDPOINT = "/api/v1/calculations";

    @Mock
    private QuotaResolver quotaResolver;

    @Mock
    private ViolationRecorder violationRecorder;

    private final MutableClock clock = MutableClock.at("2024-03-10T12:00:00Z");

    private ThrottleOrchestrator orchestrator(AdmissionProperties properties) {
        WindowCounter windowCounter = new WindowCounter(new InMemoryWindowCounterStore(clock), clock, properties);
        return new ThrottleOrchestrator(windowCounter, new RoleLimitTable(properties), quotaResolver,
                violationRecorder, clock, properties);
    }

    private ThrottleOrchestrator orchestrator() {
        return orchestrator(TestProperties.defaults());
    }

    private static AdmissionRequest withPrincipal(String userId, String role, OrganizationTarget target) {
        return new AdmissionRequest(IP, new VerifiedPrincipal(userId, role, target != null ? ORG : null),
                target, ENDPOINT, "test-agent");
    }

    private static AdmissionRequest anonymous(String endpoint) {
        return new AdmissionRequest(IP, null, null, endpoint, null);
    }

    private UsageView usage(long used, QuotaLimit limit) {
        Instant now = clock.instant();
        return UsageView.of(ORG, ResourceType.CALCULATIONS, PlanTier.FREE, used, limit,
                BillingPeriod.containing(now), now);
    }

    private QuotaReservation granted(long usedAfter, QuotaLimit limit) {
        UsageView view = usage(usedAfter, limit);
        return new QuotaReservation(ORG, ResourceType.CALCULATIONS, view.periodStart(), 1, true, view);
    }

    private QuotaReservation refused(long used, QuotaLimit limit) {
        UsageView view = usage(used, limit);
        return new QuotaReservation(ORG, ResourceType.CALCULATIONS, view.periodStart(), 0, false, view);
    }

    private void givenReservation(Mono<QuotaReservation> reservation) {
        when(quotaResolver.reserve(ORG, ResourceType.CALCULATIONS, ThrottleOrchestrator.RESERVED_UNITS))
                .thenReturn(reservation);
    }

    @Test
    void testHundredFirstRequestFromIpIsRejected() {
        ThrottleOrchestrator orchestrator = orchestrator();
        clock.advance(Duration.ofSeconds(5));

        for (int i = 0; i < 100; i++) {
            assertTrue(orchestrator.admit(anonymous("/api/v1/tariffs")).block().allowed());
        }

        AdmissionDecision decision = orchestrator.admit(anonymous("/api/v1/tariffs")).block();
        assertFalse(decision.allowed());
        assertEquals(LayerScope.IP, decision.rejectingLayer());
        assertEquals(AdmissionDecision.ERROR_RATE_LIMITED, decision.error());
        assertEquals(100L, decision.limit());
        assertEquals(100, decision.used());
        assertTrue(decision.retryAfterSeconds() >= 1 && decision.retryAfterSeconds() <= 60);
        assertNull(decision.upgradeUrl());

        verify(violationRecorder).record(IP, LayerScope.IP, 100, 101, "/api/v1/tariffs", null);
    }

    @Test
    void testIpCounterResetsInNextWindow() {
        AdmissionProperties properties = TestProperties.defaults();
        properties.setIpLimit(2);
        ThrottleOrchestrator orchestrator = orchestrator(properties);

        orchestrator.admit(anonymous("/")).block();
        orchestrator.admit(anonymous("/")).block();
        assertFalse(orchestrator.admit(anonymous("/")).block().allowed());

        clock.advance(Duration.ofSeconds(60));
        assertTrue(orchestrator.admit(anonymous("/")).block().allowed());
    }

    @Test
    void testIdentityLimitFollowsRole() {
        ThrottleOrchestrator orchestrator = orchestrator();

        for (int i = 0; i < 50; i++) {
            assertTrue(orchestrator.admit(withPrincipal("viewer-1", "viewer", null)).block().allowed());
        }
        AdmissionDecision decision = orchestrator.admit(withPrincipal("viewer-1", "viewer", null)).block();

        assertFalse(decision.allowed());
        assertEquals(LayerScope.IDENTITY, decision.rejectingLayer());
        assertEquals(50L, decision.limit());
        assertTrue(decision.message().contains("viewer"));
        verify(violationRecorder).record("viewer-1", LayerScope.IDENTITY, 50, 51, ENDPOINT, "test-agent");
    }

    @Test
    void testSuperadminSkipsIdentityCounter() {
        AdmissionProperties properties = TestProperties.defaults();
        properties.setIpLimit(1000);
        ThrottleOrchestrator orchestrator = orchestrator(properties);

        for (int i = 0; i < 600; i++) {
            assertTrue(orchestrator.admit(withPrincipal("root", "superadmin", null)).block().allowed());
        }
        AdmissionDecision decision = orchestrator.admit(withPrincipal("root", "superadmin", null)).block();
        assertNull(decision.layer(LayerScope.IDENTITY).limit());
    }

    @Test
    void testIdentityRejectionNeverTouchesQuota() {
        ThrottleOrchestrator orchestrator = orchestrator();
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.just(granted(1, QuotaLimit.of(100))));

        for (int i = 0; i < 50; i++) {
            orchestrator.admit(withPrincipal("viewer-1", "viewer", target)).block();
        }
        AdmissionDecision decision = orchestrator.admit(withPrincipal("viewer-1", "viewer", target)).block();

        assertEquals(LayerScope.IDENTITY, decision.rejectingLayer());
        assertNull(decision.layer(LayerScope.ORGANIZATION));
        verify(quotaResolver, times(50)).reserve(ORG, ResourceType.CALCULATIONS, ThrottleOrchestrator.RESERVED_UNITS);
        verify(quotaResolver, never()).consume(anyString(), any(), anyLong());
    }

    @Test
    void testIpRejectionStopsEvaluation() {
        AdmissionProperties properties = TestProperties.defaults();
        properties.setIpLimit(1);
        ThrottleOrchestrator orchestrator = orchestrator(properties);
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.just(granted(1, QuotaLimit.of(100))));

        orchestrator.admit(withPrincipal("user-1", "user", target)).block();
        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertEquals(LayerScope.IP, decision.rejectingLayer());
        assertNull(decision.layer(LayerScope.IDENTITY));
        verify(quotaResolver, times(1)).reserve(ORG, ResourceType.CALCULATIONS, ThrottleOrchestrator.RESERVED_UNITS);
    }

    @Test
    void testQuotaExceededCarriesUpgradeUrl() {
        ThrottleOrchestrator orchestrator = orchestrator();
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.just(refused(100, QuotaLimit.of(100))));

        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertFalse(decision.allowed());
        assertEquals(LayerScope.ORGANIZATION, decision.rejectingLayer());
        assertEquals(AdmissionDecision.ERROR_QUOTA_EXCEEDED, decision.error());
        assertEquals(100L, decision.limit());
        assertEquals(100, decision.used());
        assertEquals("/pricing", decision.upgradeUrl());
        assertEquals(21, decision.resetsInDays());
        assertNull(decision.retryAfterSeconds());
        assertNull(decision.reservation());
        verify(violationRecorder).record(ORG, LayerScope.ORGANIZATION, 100, 101, ENDPOINT, "test-agent");
    }

    @Test
    void testQuotaWarningZoneStillAdmits() {
        ThrottleOrchestrator orchestrator = orchestrator();
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.just(granted(91, QuotaLimit.of(100))));

        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertTrue(decision.allowed());
        assertEquals(91, decision.layer(LayerScope.ORGANIZATION).used());
        assertEquals(1, decision.reservation().units());
        verifyNoInteractions(violationRecorder);
    }

    @Test
    void testUnlimitedQuotaAlwaysAdmits() {
        ThrottleOrchestrator orchestrator = orchestrator();
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.just(granted(1_000_001, QuotaLimit.unlimitedLimit())));

        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertTrue(decision.allowed());
        assertNull(decision.layer(LayerScope.ORGANIZATION).limit());
    }

    @Test
    void testQuotaFailureFailsOpen() {
        ThrottleOrchestrator orchestrator = orchestrator(TestProperties.withFailurePolicy(FailurePolicy.FAIL_OPEN));
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.error(new IllegalStateException("database down")));

        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertTrue(decision.allowed());
        assertTrue(decision.layer(LayerScope.ORGANIZATION).degraded());
        assertNull(decision.reservation());
    }

    @Test
    void testQuotaFailureFailsClosed() {
        ThrottleOrchestrator orchestrator = orchestrator(TestProperties.withFailurePolicy(FailurePolicy.FAIL_CLOSED));
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.error(new IllegalStateException("database down")));

        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertFalse(decision.allowed());
        assertEquals(AdmissionDecision.ERROR_UNAVAILABLE, decision.error());
        assertEquals(LayerScope.ORGANIZATION, decision.rejectingLayer());
        verifyNoInteractions(violationRecorder);
    }

    @Test
    void testAdmittedDecisionListsEveryLayer() {
        ThrottleOrchestrator orchestrator = orchestrator();
        OrganizationTarget target = new OrganizationTarget(ORG, ResourceType.CALCULATIONS);
        givenReservation(Mono.just(granted(11, QuotaLimit.of(100))));

        AdmissionDecision decision = orchestrator.admit(withPrincipal("user-1", "user", target)).block();

        assertTrue(decision.allowed());
        assertEquals(3, decision.layers().size());
        assertEquals(99, decision.layer(LayerScope.IP).remaining());
        assertEquals(99, decision.layer(LayerScope.IDENTITY).remaining());
        assertEquals(89, decision.layer(LayerScope.ORGANIZATION).remaining());
    }
}

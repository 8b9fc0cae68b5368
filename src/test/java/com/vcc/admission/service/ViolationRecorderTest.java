package com.vcc.admission.service;

import com.vcc.admission.MutableClock;
import com.vcc.admission.entity.ViolationEntity;
import com.vcc.admission.model.LayerScope;
import com.vcc.admission.model.ViolatorSummary;
import com.vcc.admission.repository.ViolationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ViolationRecorderTest {

    @Mock
    private ViolationRepository violationRepository;

    private final MutableClock clock = MutableClock.at("2024-03-10T12:00:00Z");
    private ViolationRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new ViolationRecorder(violationRepository, clock);
    }

    @Test
    void testRecordsViolationFields() {
        when(violationRepository.save(any(ViolationEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        recorder.record("10.0.0.1", LayerScope.IP, 100, 101, "/api/v1/tariffs", "curl/8.0");

        ArgumentCaptor<ViolationEntity> saved = ArgumentCaptor.forClass(ViolationEntity.class);
        verify(violationRepository).save(saved.capture());
        ViolationEntity entity = saved.getValue();
        assertEquals("10.0.0.1", entity.getSubject());
        assertEquals("ip", entity.getScope());
        assertEquals("ip_rate", entity.getViolationType());
        assertEquals(100, entity.getLimitValue());
        assertEquals(101, entity.getObservedCount());
        assertEquals("/api/v1/tariffs", entity.getEndpoint());
        assertEquals("curl/8.0", entity.getUserAgent());
        assertEquals(clock.instant(), entity.getCreatedAt());
    }

    @Test
    void testFailedWriteNeverReachesCaller() {
        when(violationRepository.save(any(ViolationEntity.class)))
                .thenReturn(Mono.error(new IllegalStateException("database down")));

        assertDoesNotThrow(() ->
                recorder.record("org-1", LayerScope.ORGANIZATION, 100, 101, "/api/v1/calculations", null));
    }

    @Test
    void testLongUserAgentIsTruncated() {
        when(violationRepository.save(any(ViolationEntity.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        recorder.record("user-1", LayerScope.IDENTITY, 50, 51, "/x", "a".repeat(800));

        ArgumentCaptor<ViolationEntity> saved = ArgumentCaptor.forClass(ViolationEntity.class);
        verify(violationRepository).save(saved.capture());
        assertEquals(500, saved.getValue().getUserAgent().length());
        assertEquals("user_rate", saved.getValue().getViolationType());
    }

    @Test
    void testTopViolatorsUsesTrailingWindow() {
        ViolatorSummary summary = new ViolatorSummary("10.0.0.1", "ip", 12L, clock.instant());
        when(violationRepository.findTopViolators(Instant.parse("2024-03-03T12:00:00Z"), 20))
                .thenReturn(Flux.just(summary));

        StepVerifier.create(recorder.topViolators(Duration.ofDays(7), 20))
                .expectNext(summary)
                .verifyComplete();
    }

    @Test
    void testSearchDefaultsToLastDayAndClampsLimit() {
        when(violationRepository.search(eq("user-1"), eq("user"),
                eq(Instant.parse("2024-03-09T12:00:00Z")), eq(Instant.parse("2024-03-10T12:00:00Z")), eq(1000)))
                .thenReturn(Flux.empty());

        StepVerifier.create(recorder.search("user-1", LayerScope.IDENTITY, null, null, 50_000))
                .verifyComplete();
    }
}

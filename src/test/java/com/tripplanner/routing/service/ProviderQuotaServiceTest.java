package com.tripplanner.routing.service;

import com.tripplanner.routing.config.RoutingProperties;
import com.tripplanner.routing.model.Provider;
import com.tripplanner.routing.model.dto.UsageSummary;
import com.tripplanner.routing.model.entity.ProviderUsageEntity;
import com.tripplanner.routing.model.entity.ProviderUsageId;
import com.tripplanner.routing.repo.ProviderUsageRepository;
import com.tripplanner.routing.util.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

class ProviderQuotaServiceTest {

    private static final ProviderUsageId STADIA_JUNE = new ProviderUsageId("2025-06", "stadia");

    private ProviderUsageRepository repository;
    private RoutingProperties properties;
    private ProviderQuotaService service;

    @BeforeEach
    void setUp() {
        repository = mock(ProviderUsageRepository.class);
        properties = new RoutingProperties();
        properties.getStadia().setKey("sk-test-1234");
        service = new ProviderQuotaService(repository, properties,
                new MutableClock(Instant.parse("2025-06-30T23:59:00Z")));
    }

    // ===== Quota decision =====

    @Test
    void testShouldUsePrimaryHosted_BelowQuota() {
        when(repository.findById(STADIA_JUNE)).thenReturn(Optional.of(new ProviderUsageEntity(STADIA_JUNE, 9_999)));

        assertTrue(service.shouldUsePrimaryHosted());
    }

    @Test
    void testShouldUsePrimaryHosted_NoRowYet() {
        when(repository.findById(STADIA_JUNE)).thenReturn(Optional.empty());

        assertTrue(service.shouldUsePrimaryHosted());
    }

    @Test
    void testShouldUsePrimaryHosted_QuotaReached() {
        when(repository.findById(STADIA_JUNE)).thenReturn(Optional.of(new ProviderUsageEntity(STADIA_JUNE, 10_000)));

        assertFalse(service.shouldUsePrimaryHosted());
    }

    @Test
    void testShouldUsePrimaryHosted_NoKey() {
        properties.getStadia().setKey(null);

        assertFalse(service.shouldUsePrimaryHosted());
        verifyNoInteractions(repository);
    }

    @Test
    void testShouldUsePrimaryHosted_UnreadableCounterFailsClosed() {
        when(repository.findById(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertFalse(service.shouldUsePrimaryHosted());
    }

    // ===== Recording =====

    @Test
    void testRecordUsage_IncrementsExistingRow() {
        when(repository.increment("2025-06", "osrm")).thenReturn(1);

        service.recordUsage(Provider.OSRM);

        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void testRecordUsage_CreatesFirstRowOfMonth() {
        when(repository.increment("2025-06", "stadia")).thenReturn(0);

        service.recordUsage(Provider.STADIA);

        verify(repository).saveAndFlush(argThat((ProviderUsageEntity e) -> e.getId().equals(STADIA_JUNE) && e.getCallCount() == 1));
    }

    @Test
    void testRecordUsage_ConcurrentInsertRetriesIncrement() {
        when(repository.increment("2025-06", "stadia")).thenReturn(0).thenReturn(1);
        when(repository.saveAndFlush(any())).thenThrow(new DataIntegrityViolationException("duplicate key"));

        service.recordUsage(Provider.STADIA);

        verify(repository, times(2)).increment("2025-06", "stadia");
    }

    // ===== Summary =====

    @Test
    void testSummary() {
        when(repository.findByIdMonth("2025-06")).thenReturn(List.of(
                new ProviderUsageEntity(STADIA_JUNE, 1_234),
                new ProviderUsageEntity(new ProviderUsageId("2025-06", "osrm"), 7)));

        UsageSummary summary = service.summary();

        assertEquals("2025-06", summary.getMonth());
        assertEquals(List.of("stadia", "valhalla", "osrm"),
                summary.getProviders().stream().map(UsageSummary.ProviderUsage::getProvider).toList());
        UsageSummary.ProviderUsage stadia = summary.getProviders().get(0);
        assertEquals(1_234, stadia.getCount());
        assertEquals(10_000L, stadia.getQuota());
        assertEquals(8_766L, stadia.getRemaining());
        assertEquals(0, summary.getProviders().get(1).getCount());
        assertNull(summary.getProviders().get(2).getQuota());
        assertEquals(7, summary.getProviders().get(2).getCount());
    }
}

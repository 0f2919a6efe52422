package me.golemcore.quota.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QuotaModelTest {

    // ===== Codes =====

    @Test
    void shouldResolveCodesIgnoringCase() {
        assertEquals(QuotaWindow.FIVE_HOURS, QuotaWindow.fromCode("5H"));
        assertEquals(QuotaEntityType.PROVIDER, QuotaEntityType.fromCode("Provider"));
        assertEquals(ResetMode.ROLLING, ResetMode.fromCode("rolling"));
    }

    @Test
    void shouldRejectUnknownCodes() {
        assertThrows(IllegalArgumentException.class, () -> QuotaWindow.fromCode("hourly"));
        assertThrows(IllegalArgumentException.class, () -> QuotaEntityType.fromCode("team"));
        assertThrows(IllegalArgumentException.class, () -> ResetMode.fromCode("sliding"));
    }

    // ===== Leases =====

    @Test
    void shouldExpireLeaseAfterTtl() {
        BudgetLease lease = BudgetLease.builder()
                .snapshotAtMs(1_000)
                .ttlSeconds(10)
                .build();

        assertFalse(lease.isExpired(10_999));
        assertTrue(lease.isExpired(11_000));
    }

    @Test
    void shouldMapDecrementResultsToOutcomes() {
        assertEquals(AdmissionOutcome.Status.ALLOWED, LeaseDecrementResult.decremented(1.0).toOutcomeStatus());
        assertEquals(AdmissionOutcome.Status.DENIED, LeaseDecrementResult.insufficient().toOutcomeStatus());
        assertFalse(LeaseDecrementResult.insufficient().isSuccess());
    }

    // ===== Outcomes =====

    @Test
    void shouldTreatUnknownAsFailOpenAdmission() {
        AdmissionOutcome unknown = AdmissionOutcome.unknown();

        assertTrue(unknown.isAllowed());
        assertTrue(unknown.isFailOpen());
        assertNull(unknown.getReason());
        assertFalse(AdmissionOutcome.denied("no", 2, 1).isAllowed());
    }
}

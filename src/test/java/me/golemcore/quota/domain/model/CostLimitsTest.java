package me.golemcore.quota.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CostLimitsTest {

    @Test
    void shouldListConfiguredLimitsInEvaluationOrder() {
        CostLimits limits = CostLimits.builder()
                .monthly(100.0)
                .fiveHour(10.0)
                .weekly(50.0)
                .build();

        List<CostLimits.Limit> configured = limits.configured();

        assertEquals(List.of(
                new CostLimits.Limit(QuotaWindow.FIVE_HOURS, 10.0),
                new CostLimits.Limit(QuotaWindow.WEEKLY, 50.0),
                new CostLimits.Limit(QuotaWindow.MONTHLY, 100.0)), configured);
    }

    @Test
    void shouldTreatMissingOrNonPositiveAsUnlimited() {
        CostLimits limits = CostLimits.builder()
                .fiveHour(0.0)
                .weekly(-5.0)
                .build();

        assertTrue(limits.configured().isEmpty());
    }
}

package me.golemcore.quota.adapter.outbound.settings;

import me.golemcore.quota.domain.model.QuotaSettings;
import me.golemcore.quota.domain.model.QuotaWindow;
import me.golemcore.quota.infrastructure.config.QuotaProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PropertiesQuotaSettingsAdapterTest {

    private QuotaProperties properties;
    private PropertiesQuotaSettingsAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new QuotaProperties();
        adapter = new PropertiesQuotaSettingsAdapter(properties);
    }

    @Test
    void shouldExposeDefaults() {
        QuotaSettings settings = adapter.getQuotaSettings();

        assertEquals(10, settings.getRefreshIntervalSeconds());
        assertEquals(0.05, settings.leasePercentFor(QuotaWindow.FIVE_HOURS), 1e-9);
        assertEquals(0.05, settings.leasePercentFor(QuotaWindow.MONTHLY), 1e-9);
        assertNull(settings.getLeaseCapUsd());
    }

    @Test
    void shouldMapPerWindowPercents() {
        QuotaProperties.LeaseProperties lease = properties.getLease();
        lease.setPercent5h(0.1);
        lease.setPercentDaily(0.2);
        lease.setPercentWeekly(0.3);
        lease.setPercentMonthly(0.4);
        lease.setCapUsd(2.5);

        QuotaSettings settings = adapter.getQuotaSettings();

        assertEquals(0.1, settings.leasePercentFor(QuotaWindow.FIVE_HOURS), 1e-9);
        assertEquals(0.2, settings.leasePercentFor(QuotaWindow.DAILY), 1e-9);
        assertEquals(0.3, settings.leasePercentFor(QuotaWindow.WEEKLY), 1e-9);
        assertEquals(0.4, settings.leasePercentFor(QuotaWindow.MONTHLY), 1e-9);
        assertEquals(2.5, settings.getLeaseCapUsd().doubleValue(), 1e-9);
    }

    @Test
    void shouldReplaceNonPositiveRefreshInterval() {
        properties.getLease().setRefreshIntervalSeconds(0);

        assertEquals(QuotaSettings.DEFAULT_REFRESH_INTERVAL_SECONDS,
                adapter.getQuotaSettings().getRefreshIntervalSeconds());
    }

    @Test
    void shouldReflectPropertyChangesOnEveryRead() {
        assertEquals(10, adapter.getQuotaSettings().getRefreshIntervalSeconds());

        properties.getLease().setRefreshIntervalSeconds(30);

        assertEquals(30, adapter.getQuotaSettings().getRefreshIntervalSeconds());
    }
}

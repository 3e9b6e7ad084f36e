package com.courtdata.scraper.health;

import com.courtdata.scraper.service.store.CaseRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * <code>caseStore</code> component of <code>/actuator/health</code>: the
 * history and case tables answer queries.
 */
@Component("caseStore")
@RequiredArgsConstructor
public class CaseStoreHealthIndicator implements HealthIndicator {

    private final CaseRecordStore store;

    @Override
    public Health health() {
        return store.isAvailable() ? Health.up().build() : Health.down().build();
    }
}

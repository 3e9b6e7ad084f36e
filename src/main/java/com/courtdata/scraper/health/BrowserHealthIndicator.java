package com.courtdata.scraper.health;

import com.courtdata.scraper.config.BrowserProperties;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Reports whether a browser can be started, as the <code>browser</code>
 * component of <code>/actuator/health</code>. Starting a browser is slow, so
 * the probe result is reused for <code>court.browser.health-cache-ttl</code>.
 */
@Slf4j
@Component("browser")
public class BrowserHealthIndicator implements HealthIndicator {

    private final BrowserSessionManager sessions;
    private final BrowserProperties props;
    private final Clock clock;

    private volatile Probe last;

    public BrowserHealthIndicator(final BrowserSessionManager sessions,
                                  final BrowserProperties props,
                                  final Clock clock) {
        this.sessions = sessions;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Probe probe = current();
        Health.Builder builder = probe.up() ? Health.up() : Health.down();
        return builder
                .withDetail("headless", props.isHeadless())
                .withDetail("checkedAt", probe.at().toString())
                .build();
    }

    private Probe current() {
        Probe cached = last;
        Instant now = clock.instant();
        if (cached != null && cached.at().plus(props.getHealthCacheTtl()).isAfter(now)) {
            return cached;
        }
        boolean up = sessions.probe();
        if (!up) {
            log.warn("Browser backend is not available");
        }
        Probe fresh = new Probe(up, now);
        last = fresh;
        return fresh;
    }

    private record Probe(boolean up, Instant at) {
    }
}

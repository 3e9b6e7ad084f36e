package com.courtdata.scraper.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the browser session settings under the <code>court.browser</code> prefix.
 * <p>
 * Example YAML:
 * <pre>{@code
 * court:
 *   browser:
 *     headless: true
 *     page-load-timeout: 30s
 *     launch-args: [--no-sandbox, --disable-dev-shm-usage]
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "court.browser")
@Getter
@Setter
public class BrowserProperties {

    /** Run the browser without a visible window. */
    private boolean headless = true;

    /** Upper bound for every page load and element wait. */
    private Duration pageLoadTimeout = Duration.ofSeconds(30);

    /** User agent announced to the court site. */
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/128.0 Safari/537.36";

    /** Extra command-line switches for the browser process. */
    private List<String> launchArgs = new ArrayList<>(List.of(
            "--no-sandbox", "--disable-dev-shm-usage", "--disable-gpu"));

    /** How long a health probe result is reused before the backend is probed again. */
    private Duration healthCacheTtl = Duration.ofMinutes(1);

}

package com.courtdata.scraper.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Limits applied when proxying order PDFs from the court host
 * (<code>court.pdf</code> prefix).
 */
@Component
@ConfigurationProperties(prefix = "court.pdf")
@Getter
@Setter
public class PdfProperties {

    /** Total time allowed for one download. */
    private Duration timeout = Duration.ofSeconds(30);

    /** Time allowed to open the TCP connection. */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Largest PDF accepted, in bytes. */
    private int maxBytes = 20 * 1024 * 1024;

    /** Concurrent connections to the court host. */
    private int maxConnections = 10;

}

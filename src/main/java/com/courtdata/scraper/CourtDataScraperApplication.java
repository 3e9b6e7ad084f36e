package com.courtdata.scraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * The main entry point for the Court Data Scraper application.
 *
 * <p>This Spring Boot application exposes RESTful endpoints for:
 * <ul>
 *   <li>case-status searches against the court records site,</li>
 *   <li>CAPTCHA hand-off for searches waiting on a human-supplied code,</li>
 *   <li>search history, stored cases and order/judgment PDF downloads.</li>
 * </ul>
 * It wires together the Playwright browser session manager, the challenge
 * resolver, the jsoup result parser and the JPA case store behind a single
 * search orchestrator.</p>
 *
 * <p>Usage:
 * <pre>{@code
 *   // From the command line:
 *   mvn spring-boot:run
 *
 *   // Or run the JAR:
 *   java -jar target/court-data-scraper-1.0.0-SNAPSHOT.jar
 * }</pre>
 *
 * <p>Once started, the application listens on the configured port (default
 * 8080) and serves requests under <code>/api/</code>.</p>
 */
@SpringBootApplication
public class CourtDataScraperApplication {

    /**
     * Bootstrap method to launch the Spring Boot application.
     *
     * @param args command-line arguments (ignored)
     */
    public static void main(final String[] args) {
        SpringApplication.run(CourtDataScraperApplication.class, args);
    }
}

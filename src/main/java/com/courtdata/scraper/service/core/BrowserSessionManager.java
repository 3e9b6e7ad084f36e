package com.courtdata.scraper.service.core;

import java.util.Optional;

/**
 * Lifecycle and page primitives of a remote browsing session.
 * <p>
 * Every page operation fails with {@link NavigationException} when the page
 * does not load within the configured timeout, and with
 * {@link PageStructureException} when a selector matches nothing.
 * </p>
 */
public interface BrowserSessionManager {

    /**
     * Starts a fresh browser context with the configured timeout, user agent
     * and launch arguments.
     *
     * @return a new session; close it when done
     * @throws NavigationException when the browser cannot be started
     */
    BrowserSession open();

    /**
     * Loads {@code url} and waits for the document to be ready.
     */
    void navigate(BrowserSession session, String url);

    /** @return HTML of the current page */
    String pageContent(BrowserSession session);

    /** @return URL of the current page */
    String currentUrl(BrowserSession session);

    /** @return {@code true} when at least one element matches {@code selector} */
    boolean isPresent(BrowserSession session, String selector);

    /** Types {@code value} into the first element matching {@code selector}. */
    void fill(BrowserSession session, String selector, String value);

    /** Picks the option whose visible label equals {@code label}. */
    void selectOption(BrowserSession session, String selector, String label);

    /** Clicks the first match and waits for any resulting page load. */
    void click(BrowserSession session, String selector);

    /** @return the attribute of the first match, empty when absent or blank */
    Optional<String> attribute(BrowserSession session, String selector, String name);

    /** @return PNG screenshot of the first match */
    byte[] screenshot(BrowserSession session, String selector);

    /**
     * Releases the session. Safe to call more than once.
     */
    default void close(final BrowserSession session) {
        if (session != null) {
            session.close();
        }
    }

    /**
     * @return {@code true} when a browser can currently be started
     */
    boolean probe();
}

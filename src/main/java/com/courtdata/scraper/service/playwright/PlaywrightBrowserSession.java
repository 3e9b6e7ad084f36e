package com.courtdata.scraper.service.playwright;

import com.courtdata.scraper.service.core.BrowserSession;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import lombok.extern.slf4j.Slf4j;

/**
 * One Playwright driver, browser, context and page, torn down together.
 */
@Slf4j
final class PlaywrightBrowserSession extends BrowserSession {

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;
    private final Page page;

    PlaywrightBrowserSession(final Playwright playwright, final Browser browser,
                             final BrowserContext context, final Page page) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
        this.page = page;
    }

    Page page() {
        ensureOpen();
        return page;
    }

    @Override
    protected void release() {
        try {
            context.close();
            browser.close();
        } catch (PlaywrightException ex) {
            log.warn("Browser of session {} did not close cleanly: {}", getId(), ex.getMessage());
        } finally {
            playwright.close();
        }
        log.debug("Browser session {} closed", getId());
    }
}

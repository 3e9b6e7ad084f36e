package com.courtdata.scraper.service.playwright;

import com.courtdata.scraper.config.BrowserProperties;
import com.courtdata.scraper.service.core.BrowserSession;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import com.courtdata.scraper.service.core.NavigationException;
import com.courtdata.scraper.service.core.PageStructureException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.SelectOption;
import com.microsoft.playwright.options.WaitUntilState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * <h2>PlaywrightSessionManager</h2>
 *
 * <p>Drives a headless Chromium through
 * <a href="https://playwright.dev/java/">Playwright for Java</a>. Each
 * {@link #open()} starts its own driver and browser so that concurrent
 * searches never share cookies, CAPTCHA state or a page.</p>
 *
 * <ul>
 *   <li>Page loads and element waits are bounded by
 *       <code>court.browser.page-load-timeout</code>.</li>
 *   <li>Playwright failures are translated into {@link NavigationException}
 *       (load/transport) or {@link PageStructureException} (missing element).</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlaywrightSessionManager implements BrowserSessionManager {

    private static final int SERVER_ERROR = 500;

    private final BrowserProperties props;

    @Override
    public BrowserSession open() {
        Playwright playwright = null;
        try {
            playwright = Playwright.create();
            Browser browser = playwright.chromium().launch(launchOptions());
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(props.getUserAgent()));
            double timeout = timeoutMillis();
            context.setDefaultTimeout(timeout);
            context.setDefaultNavigationTimeout(timeout);
            PlaywrightBrowserSession session =
                    new PlaywrightBrowserSession(playwright, browser, context, context.newPage());
            log.debug("Opened browser session {}", session.getId());
            return session;
        } catch (PlaywrightException ex) {
            if (playwright != null) {
                playwright.close();
            }
            throw new NavigationException("Browser could not be started", ex);
        }
    }

    @Override
    public void navigate(final BrowserSession session, final String url) {
        Page page = page(session);
        try {
            Response rsp = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout(timeoutMillis()));
            if (rsp != null && rsp.status() >= SERVER_ERROR) {
                throw new NavigationException("HTTP " + rsp.status() + " for " + url);
            }
        } catch (TimeoutError ex) {
            throw new NavigationException("Timed out loading " + url, ex);
        } catch (PlaywrightException ex) {
            throw new NavigationException("Failed to load " + url, ex);
        }
    }

    @Override
    public String pageContent(final BrowserSession session) {
        try {
            return page(session).content();
        } catch (PlaywrightException ex) {
            throw new NavigationException("Page content unavailable", ex);
        }
    }

    @Override
    public String currentUrl(final BrowserSession session) {
        return page(session).url();
    }

    @Override
    public boolean isPresent(final BrowserSession session, final String selector) {
        try {
            return page(session).locator(selector).count() > 0;
        } catch (PlaywrightException ex) {
            throw new NavigationException("Page not readable while looking for " + selector, ex);
        }
    }

    @Override
    public void fill(final BrowserSession session, final String selector, final String value) {
        Locator el = first(session, selector);
        run(selector, () -> el.fill(value));
    }

    @Override
    public void selectOption(final BrowserSession session, final String selector, final String label) {
        Locator el = first(session, selector);
        run(selector, () -> el.selectOption(new SelectOption().setLabel(label)));
    }

    @Override
    public void click(final BrowserSession session, final String selector) {
        Locator el = first(session, selector);
        Page page = page(session);
        run(selector, () -> {
            el.click();
            page.waitForLoadState(LoadState.LOAD,
                    new Page.WaitForLoadStateOptions().setTimeout(timeoutMillis()));
        });
    }

    @Override
    public Optional<String> attribute(final BrowserSession session, final String selector,
                                      final String name) {
        Locator el = first(session, selector);
        try {
            return Optional.ofNullable(el.getAttribute(name)).filter(StringUtils::isNotBlank);
        } catch (PlaywrightException ex) {
            throw new NavigationException("Attribute " + name + " of " + selector + " unreadable", ex);
        }
    }

    @Override
    public byte[] screenshot(final BrowserSession session, final String selector) {
        Locator el = first(session, selector);
        try {
            return el.screenshot();
        } catch (PlaywrightException ex) {
            throw new NavigationException("Screenshot of " + selector + " failed", ex);
        }
    }

    @Override
    public boolean probe() {
        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(launchOptions())) {
            return browser.isConnected();
        } catch (PlaywrightException ex) {
            log.warn("Browser probe failed: {}", ex.getMessage());
            return false;
        }
    }

    /* ------------------------------------------------------------------ */
    /* helpers                                                            */
    /* ------------------------------------------------------------------ */

    private BrowserType.LaunchOptions launchOptions() {
        return new BrowserType.LaunchOptions()
                .setHeadless(props.isHeadless())
                .setArgs(props.getLaunchArgs())
                .setTimeout(timeoutMillis());
    }

    private double timeoutMillis() {
        return (double) props.getPageLoadTimeout().toMillis();
    }

    private static Page page(final BrowserSession session) {
        if (!(session instanceof PlaywrightBrowserSession pw)) {
            throw new IllegalArgumentException("Not a Playwright session: " + session);
        }
        return pw.page();
    }

    private static Locator first(final BrowserSession session, final String selector) {
        Locator all = page(session).locator(selector);
        int count;
        try {
            count = all.count();
        } catch (PlaywrightException ex) {
            throw new NavigationException("Page not readable while looking for " + selector, ex);
        }
        if (count == 0) {
            throw new PageStructureException("No element matches " + selector);
        }
        return all.first();
    }

    private static void run(final String selector, final Runnable action) {
        try {
            action.run();
        } catch (TimeoutError ex) {
            throw new NavigationException("Timed out acting on " + selector, ex);
        } catch (PlaywrightException ex) {
            throw new NavigationException("Browser action on " + selector + " failed", ex);
        }
    }
}

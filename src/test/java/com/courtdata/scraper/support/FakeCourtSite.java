package com.courtdata.scraper.support;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.service.core.BrowserSession;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import com.courtdata.scraper.service.core.NavigationException;
import com.courtdata.scraper.service.core.PageStructureException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Scripted stand-in for the court site. Renders the search form, optionally
 * guarded by a CAPTCHA, and answers a submission with a configured page.
 */
public class FakeCourtSite implements BrowserSessionManager {

    private final CourtSiteCfg cfg;
    private final List<FakeSession> opened = new CopyOnWriteArrayList<>();
    private final List<String> submittedCodes = new CopyOnWriteArrayList<>();
    private final AtomicInteger challengeSerial = new AtomicInteger();
    private final AtomicInteger navigations = new AtomicInteger();
    private final AtomicInteger navigationFailures = new AtomicInteger();

    private volatile String resultPage = CourtPages.load("case-result.html");
    private volatile boolean challenge;
    private volatile Predicate<String> accepts = code -> true;
    private volatile String imageSrc;

    public FakeCourtSite(final CourtSiteCfg cfg) {
        this.cfg = cfg;
    }

    /** Page shown after an accepted submission. */
    public FakeCourtSite respondWith(final String html) {
        this.resultPage = html;
        return this;
    }

    /** Puts a CAPTCHA on the form; {@code accepts} decides which codes pass. */
    public FakeCourtSite requireChallenge(final Predicate<String> accepts) {
        this.challenge = true;
        this.accepts = accepts;
        return this;
    }

    /** Overrides the {@code src} the CAPTCHA image reports. */
    public FakeCourtSite imageSrc(final String src) {
        this.imageSrc = src;
        return this;
    }

    /** The next {@code count} navigations fail. */
    public FakeCourtSite failNavigations(final int count) {
        navigationFailures.set(count);
        return this;
    }

    public List<String> submittedCodes() {
        return List.copyOf(submittedCodes);
    }

    public List<FakeSession> sessions() {
        return List.copyOf(opened);
    }

    public int navigations() {
        return navigations.get();
    }

    @Override
    public BrowserSession open() {
        FakeSession session = new FakeSession();
        opened.add(session);
        return session;
    }

    @Override
    public void navigate(final BrowserSession session, final String url) {
        FakeSession s = cast(session);
        navigations.incrementAndGet();
        if (navigationFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new NavigationException("Timeout 30000ms exceeded navigating to " + url);
        }
        s.fields.clear();
        s.page = CourtPages.searchForm(challenge ? challengeSerial.incrementAndGet() : 0, null);
    }

    @Override
    public String pageContent(final BrowserSession session) {
        return cast(session).page;
    }

    @Override
    public String currentUrl(final BrowserSession session) {
        cast(session);
        return cfg.searchUrl();
    }

    @Override
    public boolean isPresent(final BrowserSession session, final String selector) {
        return !Jsoup.parse(cast(session).page).select(selector).isEmpty();
    }

    @Override
    public void fill(final BrowserSession session, final String selector, final String value) {
        FakeSession s = cast(session);
        requirePresent(s, selector);
        s.fields.put(selector, value);
    }

    @Override
    public void selectOption(final BrowserSession session, final String selector, final String label) {
        FakeSession s = cast(session);
        requirePresent(s, selector);
        s.fields.put(selector, label);
    }

    @Override
    public void click(final BrowserSession session, final String selector) {
        FakeSession s = cast(session);
        requirePresent(s, selector);
        if (selector.equals(cfg.getChallenge().getRefresh())) {
            s.page = CourtPages.searchForm(challengeSerial.incrementAndGet(), null);
            return;
        }
        if (!selector.equals(cfg.getForm().getSubmit())) {
            return;
        }
        if (!challenge) {
            s.page = resultPage;
            return;
        }
        String code = s.fields.getOrDefault(cfg.getChallenge().getInput(), "");
        submittedCodes.add(code);
        s.page = accepts.test(code)
                ? resultPage
                : CourtPages.searchForm(challengeSerial.incrementAndGet(), "Invalid Captcha");
    }

    @Override
    public Optional<String> attribute(final BrowserSession session, final String selector, final String name) {
        Element el = Jsoup.parse(cast(session).page).selectFirst(selector);
        if (el != null && imageSrc != null && "src".equals(name)
                && selector.equals(cfg.getChallenge().getImage())) {
            return Optional.of(imageSrc);
        }
        return Optional.ofNullable(el).map(e -> e.attr(name)).filter(v -> !v.isBlank());
    }

    @Override
    public byte[] screenshot(final BrowserSession session, final String selector) {
        requirePresent(cast(session), selector);
        return new byte[] {(byte) 0x89, 'P', 'N', 'G'};
    }

    @Override
    public boolean probe() {
        return true;
    }

    private static void requirePresent(final FakeSession s, final String selector) {
        if (Jsoup.parse(s.page).select(selector).isEmpty()) {
            throw new PageStructureException("No element matches " + selector);
        }
    }

    private static FakeSession cast(final BrowserSession session) {
        FakeSession s = (FakeSession) session;
        s.checkOpen();
        return s;
    }

    /** Session state: the current page and the values typed into it. */
    public static final class FakeSession extends BrowserSession {

        private final Map<String, String> fields = new ConcurrentHashMap<>();
        private final AtomicInteger releases = new AtomicInteger();
        private volatile String page = "<html><body></body></html>";

        public Map<String, String> fields() {
            return Map.copyOf(fields);
        }

        public int releases() {
            return releases.get();
        }

        private void checkOpen() {
            ensureOpen();
        }

        @Override
        protected void release() {
            releases.incrementAndGet();
        }
    }
}

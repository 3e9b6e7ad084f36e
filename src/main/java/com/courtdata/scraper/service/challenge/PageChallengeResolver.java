package com.courtdata.scraper.service.challenge;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.parser.CaseResultParser;
import com.courtdata.scraper.parser.PageKind;
import com.courtdata.scraper.service.core.BrowserSession;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import com.courtdata.scraper.service.core.PageStructureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link ChallengeResolver} working on the court site's search form through a
 * {@link BrowserSessionManager}. Selectors and verdict markers come from
 * <code>court.site.challenge</code>.
 * <p>
 * The image reference is the absolute {@code src} of the CAPTCHA element; when
 * the element has no usable {@code src} (inline text or a canvas) a PNG
 * screenshot of it is returned as a data URI instead.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PageChallengeResolver implements ChallengeResolver {

    private static final String DATA_PNG = "data:image/png;base64,";

    private final BrowserSessionManager sessions;
    private final CourtSiteCfg cfg;
    private final CaseResultParser parser;
    private final Clock clock;

    @Override
    public Optional<ChallengeArtifact> extractChallenge(final BrowserSession session) {
        String image = cfg.getChallenge().getImage();
        if (!sessions.isPresent(session, image)) {
            return Optional.empty();
        }
        String reference = sessions.attribute(session, image, "src")
                .flatMap(src -> absolute(sessions.currentUrl(session), src))
                .orElseGet(() -> DATA_PNG + Base64.getEncoder()
                        .encodeToString(sessions.screenshot(session, image)));
        ChallengeArtifact artifact = new ChallengeArtifact(UUID.randomUUID(), reference, clock.instant());
        log.debug("Challenge {} presented", artifact.challengeId());
        return Optional.of(artifact);
    }

    @Override
    public ChallengeOutcome submitResponse(final BrowserSession session, final String code) {
        CourtSiteCfg.Challenge ch = cfg.getChallenge();
        sessions.fill(session, ch.getInput(), StringUtils.trimToEmpty(code));
        sessions.click(session, cfg.getForm().getSubmit());

        String html = sessions.pageContent(session);
        String text = Jsoup.parse(html).text().toLowerCase(Locale.ROOT);
        if (containsAny(text, ch.getExpiredMarkers())) {
            return ChallengeOutcome.EXPIRED;
        }
        if (containsAny(text, ch.getRejectedMarkers())) {
            return ChallengeOutcome.REJECTED;
        }
        if (sessions.isPresent(session, ch.getImage()) && !hasOutcome(html, text)) {
            return ChallengeOutcome.REJECTED;
        }
        return ChallengeOutcome.ACCEPTED;
    }

    @Override
    public ChallengeArtifact refresh(final BrowserSession session) {
        String refresh = cfg.getChallenge().getRefresh();
        if (StringUtils.isNotBlank(refresh) && sessions.isPresent(session, refresh)) {
            sessions.click(session, refresh);
        }
        return extractChallenge(session)
                .orElseThrow(() -> new PageStructureException("No CAPTCHA on the page after refresh"));
    }

    /** The page moved on: results, a site verdict, or a result still loading. */
    private boolean hasOutcome(final String html, final String text) {
        PageKind kind = parser.classify(html);
        return kind == PageKind.RESULT || kind == PageKind.NO_RECORD || kind == PageKind.ERROR
                || containsAny(text, cfg.getMarkers().getLoading());
    }

    /** Empty when the page or image URL cannot be parsed; the caller falls back to a screenshot. */
    private static Optional<String> absolute(final String pageUrl, final String src) {
        if (src.startsWith("data:")) {
            return Optional.of(src);
        }
        try {
            return Optional.of(URI.create(pageUrl).resolve(src.trim()).toString());
        } catch (IllegalArgumentException ex) {
            log.debug("CAPTCHA src {} is not a valid URI: {}", src, ex.getMessage());
            return Optional.empty();
        }
    }

    private static boolean containsAny(final String text, final List<String> markers) {
        return markers.stream().anyMatch(m -> text.contains(m.toLowerCase(Locale.ROOT)));
    }
}

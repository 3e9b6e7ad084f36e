package com.courtdata.scraper.service.challenge;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.service.core.BrowserSession;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import com.courtdata.scraper.service.core.PageStructureException;
import com.courtdata.scraper.support.CourtPages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Page challenge resolver")
class PageChallengeResolverTest {

    private static final Instant NOW = Instant.parse("2024-06-01T10:00:00Z");

    @Mock
    private BrowserSessionManager sessions;

    private final BrowserSession session = mock(BrowserSession.class);
    private final CourtSiteCfg cfg = CourtPages.siteCfg();
    private PageChallengeResolver resolver;
    private String image;

    @BeforeEach
    void setUp() {
        resolver = new PageChallengeResolver(sessions, cfg, CourtPages.parser(cfg),
                Clock.fixed(NOW, ZoneOffset.UTC));
        image = cfg.getChallenge().getImage();
    }

    @Test
    @DisplayName("no CAPTCHA on the page")
    void noChallenge() {
        when(sessions.isPresent(session, image)).thenReturn(false);

        assertThat(resolver.extractChallenge(session)).isEmpty();
    }

    @Test
    @DisplayName("image source is resolved against the page URL")
    void imageSource() {
        when(sessions.isPresent(session, image)).thenReturn(true);
        when(sessions.attribute(session, image, "src")).thenReturn(Optional.of("captcha/7.png?t=1"));
        when(sessions.currentUrl(session)).thenReturn("https://court.test/app/");

        ChallengeArtifact artifact = resolver.extractChallenge(session).orElseThrow();

        assertThat(artifact.imageReference()).isEqualTo("https://court.test/app/captcha/7.png?t=1");
        assertThat(artifact.issuedAt()).isEqualTo(NOW);
        assertThat(artifact.challengeId()).isNotNull();
    }

    @Test
    @DisplayName("an element without src is captured as a PNG data URI")
    void screenshotFallback() {
        when(sessions.isPresent(session, image)).thenReturn(true);
        when(sessions.attribute(session, image, "src")).thenReturn(Optional.empty());
        when(sessions.screenshot(session, image)).thenReturn(new byte[] {1, 2, 3});

        ChallengeArtifact artifact = resolver.extractChallenge(session).orElseThrow();

        assertThat(artifact.imageReference()).isEqualTo("data:image/png;base64,AQID");
    }

    @Test
    @DisplayName("code is typed then the form submitted; a result page means ACCEPTED")
    void accepted() {
        when(sessions.pageContent(session)).thenReturn(CourtPages.load("case-result.html"));
        when(sessions.isPresent(session, image)).thenReturn(false);

        assertThat(resolver.submitResponse(session, " AB12 ")).isEqualTo(ChallengeOutcome.ACCEPTED);

        InOrder order = inOrder(sessions);
        order.verify(sessions).fill(session, cfg.getChallenge().getInput(), "AB12");
        order.verify(sessions).click(session, cfg.getForm().getSubmit());
    }

    @Test
    @DisplayName("a 'no record' verdict still means the code was accepted")
    void acceptedNoRecord() {
        when(sessions.pageContent(session)).thenReturn(CourtPages.load("no-record.html"));
        when(sessions.isPresent(session, image)).thenReturn(false);

        assertThat(resolver.submitResponse(session, "AB12")).isEqualTo(ChallengeOutcome.ACCEPTED);
    }

    @Test
    void rejectedByMessage() {
        when(sessions.pageContent(session)).thenReturn(CourtPages.searchForm(2, "Invalid Captcha"));

        assertThat(resolver.submitResponse(session, "XXXX")).isEqualTo(ChallengeOutcome.REJECTED);
    }

    @Test
    void expired() {
        when(sessions.pageContent(session))
                .thenReturn(CourtPages.searchForm(2, "Your session has expired. Please try again."));

        assertThat(resolver.submitResponse(session, "AB12")).isEqualTo(ChallengeOutcome.EXPIRED);
    }

    @Test
    @DisplayName("the form coming back with a new CAPTCHA and no message is a rejection")
    void silentlyRejected() {
        when(sessions.pageContent(session)).thenReturn(CourtPages.searchForm(2, null));
        when(sessions.isPresent(session, image)).thenReturn(true);

        assertThat(resolver.submitResponse(session, "AB12")).isEqualTo(ChallengeOutcome.REJECTED);
    }

    @Test
    @DisplayName("refresh clicks the refresh control and reads the new artifact")
    void refresh() {
        String refresh = cfg.getChallenge().getRefresh();
        when(sessions.isPresent(session, refresh)).thenReturn(true);
        when(sessions.isPresent(session, image)).thenReturn(true);
        when(sessions.attribute(session, image, "src")).thenReturn(Optional.of("/app/captcha/9.png"));
        when(sessions.currentUrl(session)).thenReturn("https://court.test/app/");

        ChallengeArtifact artifact = resolver.refresh(session);

        verify(sessions).click(session, refresh);
        assertThat(artifact.imageReference()).isEqualTo("https://court.test/app/captcha/9.png");
    }

    @Test
    @DisplayName("refresh fails when the page carries no CAPTCHA afterwards")
    void refreshWithoutChallenge() {
        when(sessions.isPresent(session, cfg.getChallenge().getRefresh())).thenReturn(false);
        when(sessions.isPresent(session, image)).thenReturn(false);

        assertThatThrownBy(() -> resolver.refresh(session)).isInstanceOf(PageStructureException.class);
        verify(sessions, never()).click(eq(session), anyString());
    }
}

package com.courtdata.scraper.service.search;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.config.Resilience4jConfig;
import com.courtdata.scraper.config.SearchProperties;
import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.domain.OrderEntry;
import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.domain.SearchOutcome;
import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.exception.AttemptTimeoutException;
import com.courtdata.scraper.exception.CaseNotFoundException;
import com.courtdata.scraper.exception.ChallengeExhaustedException;
import com.courtdata.scraper.exception.ChallengeTimeoutException;
import com.courtdata.scraper.exception.FailureKind;
import com.courtdata.scraper.exception.ResultParseException;
import com.courtdata.scraper.exception.SearchCancelledException;
import com.courtdata.scraper.exception.SearchValidationException;
import com.courtdata.scraper.exception.SiteUnreachableException;
import com.courtdata.scraper.parser.CaseResultParser;
import com.courtdata.scraper.service.challenge.ChallengeArtifact;
import com.courtdata.scraper.service.challenge.ChallengeCodeSource;
import com.courtdata.scraper.service.challenge.ChallengeExchange;
import com.courtdata.scraper.service.challenge.PageChallengeResolver;
import com.courtdata.scraper.service.store.CaseRecordStore;
import com.courtdata.scraper.support.CourtPages;
import com.courtdata.scraper.support.FakeCourtSite;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Case search orchestrator")
class CaseSearchOrchestratorTest {

    private static final CaseSearchRequest EXAMPLE = new CaseSearchRequest("W.P.(C)", "1234", 2023);

    @Mock
    private CaseRecordStore store;

    private final Clock clock = Clock.systemUTC();
    private final List<SearchState> states = new ArrayList<>();
    private final List<ChallengeArtifact> shown = new ArrayList<>();

    private CourtSiteCfg cfg;
    private SearchProperties props;
    private FakeCourtSite site;

    @BeforeEach
    void setUp() {
        cfg = CourtPages.siteCfg();
        props = new SearchProperties();
        props.getBackoff().setInitial(Duration.ofMillis(1));
        props.getBackoff().setMax(Duration.ofMillis(5));
        props.setChallengeWait(Duration.ofMillis(200));
        site = new FakeCourtSite(cfg);
    }

    private CaseSearchOrchestrator orchestrator() {
        Resilience4jConfig r4j = new Resilience4jConfig();
        IntervalFunction backoff = r4j.challengeBackoff(props);
        RetryRegistry retries = RetryRegistry.ofDefaults();
        CaseResultParser parser = CourtPages.parser(cfg);
        return new CaseSearchOrchestrator(
                site,
                new PageChallengeResolver(site, cfg, parser, clock),
                new CourtSearchForm(site, cfg),
                new SearchInputValidator(cfg, props, clock),
                parser,
                store,
                props,
                r4j.navigationRetry(retries, props, backoff),
                r4j.resultPollRetry(retries, props, backoff),
                r4j.courtSiteCircuitBreaker(CircuitBreakerRegistry.ofDefaults(), props),
                backoff,
                clock);
    }

    private SearchContext context(final CaseSearchRequest request, final ChallengeCodeSource codes) {
        return new SearchContext(UUID.randomUUID(), request, (artifact, timeout) -> {
            shown.add(artifact);
            return codes.nextCode(artifact, timeout);
        }, (id, state, challenge) -> states.add(state), null);
    }

    private SearchAttempt loggedAttempt() {
        ArgumentCaptor<SearchAttempt> captor = ArgumentCaptor.forClass(SearchAttempt.class);
        verify(store).logAttempt(captor.capture());
        return captor.getValue();
    }

    private static ChallengeCodeSource noCodeExpected() {
        return (artifact, timeout) -> {
            throw new AssertionError("no code should be requested");
        };
    }

    private static void pause(final long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    private void assertSessionsReleased() {
        assertThat(site.sessions()).allSatisfy(s -> {
            assertThat(s.isClosed()).isTrue();
            assertThat(s.releases()).isEqualTo(1);
        });
    }

    @Nested
    @DisplayName("successful runs")
    class Success {

        @Test
        @DisplayName("page without CAPTCHA yields the parsed record and one SUCCESS attempt")
        void noChallenge() {
            CaseRecord record = orchestrator().search(context(EXAMPLE, noCodeExpected()));

            assertThat(record.key().id()).isEqualTo("W.P.(C)/1234/2023");
            assertThat(record.petitioner()).isEqualTo("X");
            assertThat(record.respondent()).isEqualTo("Y");
            assertThat(record.orders()).extracting(OrderEntry::orderDate)
                    .containsExactly(LocalDate.of(2023, 5, 1));

            verify(store).upsertCase(record);
            SearchAttempt attempt = loggedAttempt();
            assertThat(attempt.getOutcome()).isEqualTo(SearchOutcome.SUCCESS);
            assertThat(attempt.getCaseId()).isEqualTo("W.P.(C)/1234/2023");
            assertThat(attempt.getChallengeSubmissions()).isZero();
            assertThat(attempt.getErrorKind()).isNull();

            assertThat(states).containsExactly(SearchState.FORM_FILLED, SearchState.SUBMITTED,
                    SearchState.RESULT_READY, SearchState.SUCCESS);
            assertSessionsReleased();
        }

        @Test
        @DisplayName("pre-supplied code is submitted without asking for another")
        void preSuppliedCode() {
            site.requireChallenge("AB12"::equals);
            CaseSearchRequest request = new CaseSearchRequest("W.P.(C)", "1234", 2023, "AB12");

            CaseRecord record = orchestrator().search(context(request, noCodeExpected()));

            assertThat(record.petitioner()).isEqualTo("X");
            assertThat(site.submittedCodes()).containsExactly("AB12");
            assertThat(loggedAttempt().getChallengeSubmissions()).isEqualTo(1);
            assertThat(states).containsExactly(SearchState.FORM_FILLED, SearchState.SUBMITTED,
                    SearchState.CHALLENGE_PENDING, SearchState.CHALLENGE_RESOLVED,
                    SearchState.RESULT_READY, SearchState.SUCCESS);
        }

        @Test
        @DisplayName("a rejected code is retried once with a fresh artifact")
        void rejectedThenAccepted() {
            site.requireChallenge("GOOD"::equals);
            Iterator<String> codes = List.of("BAD", "GOOD").iterator();

            orchestrator().search(context(EXAMPLE, (artifact, timeout) -> codes.next()));

            assertThat(site.submittedCodes()).containsExactly("BAD", "GOOD");
            assertThat(shown).hasSize(2);
            assertThat(shown.get(0).challengeId()).isNotEqualTo(shown.get(1).challengeId());
            assertThat(shown.get(1).imageReference()).startsWith(CourtPages.BASE_URL + "/app/captcha/");
            assertThat(loggedAttempt().getChallengeSubmissions()).isEqualTo(2);
        }

        @Test
        @DisplayName("an image src that is not a valid URI is shown as a screenshot")
        void malformedImageSrc() {
            site.requireChallenge("AB12"::equals).imageSrc("/app/captcha image|1.png");

            CaseRecord record = orchestrator().search(context(EXAMPLE, (artifact, timeout) -> "AB12"));

            assertThat(record.petitioner()).isEqualTo("X");
            assertThat(shown).singleElement()
                    .satisfies(a -> assertThat(a.imageReference()).startsWith("data:image/png;base64,"));
            assertThat(loggedAttempt().getOutcome()).isEqualTo(SearchOutcome.SUCCESS);
            assertSessionsReleased();
        }

        @Test
        @DisplayName("a standalone context answers the CAPTCHA with the request's own code")
        void standaloneContext() {
            site.requireChallenge("AB12"::equals);

            CaseRecord record = orchestrator()
                    .search(SearchContext.of(new CaseSearchRequest("W.P.(C)", "1234", 2023, "AB12")));

            assertThat(record.respondent()).isEqualTo("Y");
            assertThat(site.submittedCodes()).containsExactly("AB12");
        }

        @Test
        @DisplayName("transient navigation failures are retried")
        void transientNavigationFailure() {
            site.failNavigations(2);

            orchestrator().search(context(EXAMPLE, noCodeExpected()));

            assertThat(site.navigations()).isEqualTo(3);
            assertThat(loggedAttempt().getOutcome()).isEqualTo(SearchOutcome.SUCCESS);
        }

        @Test
        @DisplayName("case type is canonicalised and leading zeros dropped")
        void normalisedKey() {
            CaseRecord record = orchestrator().search(
                    context(new CaseSearchRequest(" w.p.(c) ", "001234", 2023), noCodeExpected()));

            assertThat(record.key().id()).isEqualTo("W.P.(C)/1234/2023");
            assertThat(loggedAttempt().getCaseNumber()).isEqualTo("1234");
        }
    }

    @Nested
    @DisplayName("failing runs")
    class Failure {

        @Test
        @DisplayName("codes are never submitted beyond the retry budget")
        void budgetExhausted() {
            site.requireChallenge(code -> false);

            assertThatThrownBy(() -> orchestrator().search(context(EXAMPLE, (a, t) -> "WRONG")))
                    .isInstanceOf(ChallengeExhaustedException.class);

            assertThat(site.submittedCodes()).hasSize(3);
            SearchAttempt attempt = loggedAttempt();
            assertThat(attempt.getOutcome()).isEqualTo(SearchOutcome.CAPTCHA_REQUIRED);
            assertThat(attempt.getErrorKind()).isEqualTo(FailureKind.CHALLENGE_EXHAUSTED);
            assertThat(attempt.getChallengeSubmissions()).isEqualTo(3);
            assertThat(states).last().isEqualTo(SearchState.FAILED);
            verify(store, never()).upsertCase(any());
            assertSessionsReleased();
        }

        @Test
        @DisplayName("no code within the wait ends in a TIMEOUT attempt")
        void challengeTimeout() {
            site.requireChallenge(code -> true);
            props.setChallengeWait(Duration.ofMillis(50));
            ChallengeExchange exchange = new ChallengeExchange();
            UUID id = UUID.randomUUID();
            SearchContext ctx = new SearchContext(id, EXAMPLE,
                    (artifact, timeout) -> exchange.awaitCode(id, artifact, timeout), null, null);

            assertThatThrownBy(() -> orchestrator().search(ctx))
                    .isInstanceOf(ChallengeTimeoutException.class);

            SearchAttempt attempt = loggedAttempt();
            assertThat(attempt.getId()).isEqualTo(id);
            assertThat(attempt.getOutcome()).isEqualTo(SearchOutcome.TIMEOUT);
            assertThat(attempt.getErrorKind()).isEqualTo(FailureKind.CHALLENGE_TIMEOUT);
            assertThat(site.submittedCodes()).isEmpty();
            assertSessionsReleased();
        }

        @Test
        @DisplayName("a site that never loads is reported unreachable")
        void siteDown() {
            site.failNavigations(10);

            assertThatThrownBy(() -> orchestrator().search(context(EXAMPLE, noCodeExpected())))
                    .isInstanceOf(SiteUnreachableException.class);

            assertThat(site.navigations()).isEqualTo(props.getNavigationAttempts());
            SearchAttempt attempt = loggedAttempt();
            assertThat(attempt.getOutcome()).isEqualTo(SearchOutcome.FAILURE);
            assertThat(attempt.getErrorKind()).isEqualTo(FailureKind.SITE_UNREACHABLE);
            assertSessionsReleased();
        }

        @Test
        @DisplayName("invalid input is rejected before a session is opened")
        void validationOpensNoSession() {
            CaseSearchRequest request = new CaseSearchRequest("W.P.(C)", "12A4", 2023);

            assertThatThrownBy(() -> orchestrator().search(context(request, noCodeExpected())))
                    .isInstanceOf(SearchValidationException.class);

            assertThat(site.sessions()).isEmpty();
            SearchAttempt attempt = loggedAttempt();
            assertThat(attempt.getErrorKind()).isEqualTo(FailureKind.VALIDATION_ERROR);
            assertThat(attempt.getCaseNumber()).isEqualTo("12A4");
            assertThat(attempt.getCaseYear()).isEqualTo(2023);
            assertThat(states).containsExactly(SearchState.FAILED);
        }

        @Test
        @DisplayName("cancellation while waiting for a code tears the session down")
        void cancelledWhilePending() {
            site.requireChallenge(code -> true);
            AtomicBoolean cancelled = new AtomicBoolean();
            SearchContext ctx = new SearchContext(UUID.randomUUID(), EXAMPLE, (artifact, timeout) -> {
                cancelled.set(true);
                return "AB12";
            }, null, cancelled::get);

            assertThatThrownBy(() -> orchestrator().search(ctx))
                    .isInstanceOf(SearchCancelledException.class);

            assertThat(site.submittedCodes()).isEmpty();
            assertThat(loggedAttempt().getErrorKind()).isEqualTo(FailureKind.CANCELLED);
            assertSessionsReleased();
        }

        @Test
        @DisplayName("a maintenance page is a parse error")
        void maintenancePage() {
            site.respondWith(CourtPages.load("maintenance.html"));

            assertThatThrownBy(() -> orchestrator().search(context(EXAMPLE, noCodeExpected())))
                    .isInstanceOf(ResultParseException.class);

            assertThat(loggedAttempt().getErrorKind()).isEqualTo(FailureKind.PARSE_ERROR);
            verify(store, never()).upsertCase(any());
        }

        @Test
        @DisplayName("'no record found' is reported as case not found")
        void noRecord() {
            site.respondWith(CourtPages.load("no-record.html"));

            assertThatThrownBy(() -> orchestrator().search(context(EXAMPLE, noCodeExpected())))
                    .isInstanceOf(CaseNotFoundException.class);

            assertThat(loggedAttempt().getOutcome()).isEqualTo(SearchOutcome.FAILURE);
        }

        @Test
        @DisplayName("running past the attempt budget ends in TIMEOUT")
        void attemptBudgetSpent() {
            site.requireChallenge(code -> true);
            props.setAttemptBudget(Duration.ofMillis(1));

            assertThatThrownBy(() -> orchestrator().search(context(EXAMPLE, (artifact, timeout) -> {
                pause(20);
                return "AB12";
            }))).isInstanceOf(AttemptTimeoutException.class);

            SearchAttempt attempt = loggedAttempt();
            assertThat(attempt.getOutcome()).isEqualTo(SearchOutcome.TIMEOUT);
            assertThat(attempt.getErrorKind()).isEqualTo(FailureKind.SITE_UNREACHABLE);
        }
    }

    @Test
    @DisplayName("an unexpected runtime error still ends in one failed attempt and a closed session")
    void unexpectedError() {
        when(store.upsertCase(any())).thenThrow(new IllegalArgumentException("boom"));

        assertThatThrownBy(() -> orchestrator().search(context(EXAMPLE, noCodeExpected())))
                .isInstanceOf(ResultParseException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);

        SearchAttempt attempt = loggedAttempt();
        assertThat(attempt.getOutcome()).isEqualTo(SearchOutcome.FAILURE);
        assertThat(attempt.getErrorKind()).isEqualTo(FailureKind.PARSE_ERROR);
        assertThat(states).endsWith(SearchState.FAILED);
        assertSessionsReleased();
    }

    @Test
    @DisplayName("a standalone context without a code fails with a challenge timeout")
    void standaloneContextWithoutCode() {
        site.requireChallenge(code -> true);

        assertThatThrownBy(() -> orchestrator().search(SearchContext.of(EXAMPLE)))
                .isInstanceOf(ChallengeTimeoutException.class);
        assertThat(loggedAttempt().getOutcome()).isEqualTo(SearchOutcome.TIMEOUT);
    }

    @Test
    @DisplayName("a missing field leaves the record partial instead of failing")
    void partialRecord() {
        site.respondWith(CourtPages.load("case-result-dl.html"));

        CaseRecord record = orchestrator().search(
                context(new CaseSearchRequest("LPA", "12", 2021), noCodeExpected()));

        assertThat(record.nextHearingDate()).isNull();
        assertThat(record.unknownFields()).containsExactly(CaseField.NEXT_HEARING_DATE);
        assertThat(record.petitioner()).isEqualTo("RAM KUMAR");
    }
}

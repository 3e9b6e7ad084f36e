package com.courtdata.scraper.service.search;

import com.courtdata.scraper.config.SearchProperties;
import com.courtdata.scraper.domain.CaseKey;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.domain.SearchOutcome;
import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.exception.AttemptTimeoutException;
import com.courtdata.scraper.exception.CaseSearchException;
import com.courtdata.scraper.exception.CaseStoreException;
import com.courtdata.scraper.exception.ChallengeExhaustedException;
import com.courtdata.scraper.exception.ResultParseException;
import com.courtdata.scraper.exception.SearchCancelledException;
import com.courtdata.scraper.exception.SiteUnreachableException;
import com.courtdata.scraper.parser.CaseResultParser;
import com.courtdata.scraper.parser.PageKind;
import com.courtdata.scraper.service.challenge.ChallengeArtifact;
import com.courtdata.scraper.service.challenge.ChallengeOutcome;
import com.courtdata.scraper.service.challenge.ChallengeResolver;
import com.courtdata.scraper.service.core.BrowserSession;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import com.courtdata.scraper.service.core.NavigationException;
import com.courtdata.scraper.service.core.PageStructureException;
import com.courtdata.scraper.service.store.CaseRecordStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * <h2>Case Search Orchestrator</h2>
 *
 * <p>Runs one case lookup against the court site as a state machine:</p>
 * <pre>{@code
 * INIT -> FORM_FILLED -> SUBMITTED -> CHALLENGE_PENDING -> CHALLENGE_RESOLVED
 *      -> RESULT_READY -> SUCCESS
 *                    \-> FAILED (from any state)
 * }</pre>
 *
 * <ul>
 *   <li>The request is validated before a browser is started.</li>
 *   <li>Navigation is retried with exponential backoff behind the
 *       <code>courtSite</code> circuit breaker.</li>
 *   <li>A CAPTCHA is answered with the pre-supplied code first, then with
 *       codes from the run's {@link com.courtdata.scraper.service.challenge.ChallengeCodeSource}.
 *       Every rejected or expired code costs one unit of
 *       <code>court.search.challenge-retry-budget</code>; each retry starts
 *       from a freshly loaded form and a fresh artifact.</li>
 *   <li>Cancellation and the overall attempt budget are checked at every
 *       transition.</li>
 *   <li>Every run, whatever its ending, produces exactly one attempt row and
 *       closes its browser session.</li>
 * </ul>
 */
@Slf4j
@Service
public class CaseSearchOrchestrator {

    private static final int MAX_DETAIL = 2000;

    private final BrowserSessionManager sessions;
    private final ChallengeResolver challenges;
    private final CourtSearchForm form;
    private final SearchInputValidator validator;
    private final CaseResultParser parser;
    private final CaseRecordStore store;
    private final SearchProperties props;
    private final Retry navigationRetry;
    private final Retry resultPollRetry;
    private final CircuitBreaker siteBreaker;
    private final IntervalFunction challengeBackoff;
    private final Clock clock;

    public CaseSearchOrchestrator(final BrowserSessionManager sessions,
                                  final ChallengeResolver challenges,
                                  final CourtSearchForm form,
                                  final SearchInputValidator validator,
                                  final CaseResultParser parser,
                                  final CaseRecordStore store,
                                  final SearchProperties props,
                                  @Qualifier("navigationRetry") final Retry navigationRetry,
                                  @Qualifier("resultPollRetry") final Retry resultPollRetry,
                                  final CircuitBreaker siteBreaker,
                                  final IntervalFunction challengeBackoff,
                                  final Clock clock) {
        this.sessions = sessions;
        this.challenges = challenges;
        this.form = form;
        this.validator = validator;
        this.parser = parser;
        this.store = store;
        this.props = props;
        this.navigationRetry = navigationRetry;
        this.resultPollRetry = resultPollRetry;
        this.siteBreaker = siteBreaker;
        this.challengeBackoff = challengeBackoff;
        this.clock = clock;
    }

    /**
     * Runs a lookup to completion on the calling thread.
     *
     * @param ctx request plus the caller's hooks
     * @return the stored case record
     * @throws CaseSearchException describing why the run failed; the attempt
     *                             has already been recorded
     */
    public CaseRecord search(final SearchContext ctx) {
        Run run = new Run(ctx, clock.instant());
        log.info("Search {} started for {}", ctx.attemptId(), ctx.request());
        try {
            CaseRecord record = execute(run);
            run.caseId = record.key().id();
            record(run, SearchOutcome.SUCCESS, null);
            run.enter(SearchState.SUCCESS, null);
            log.info("Search {} succeeded for {} after {} challenge submission(s)",
                    ctx.attemptId(), run.caseId, run.submissions);
            return record;
        } catch (CaseSearchException ex) {
            throw fail(run, ex);
        } catch (NavigationException | CallNotPermittedException ex) {
            throw fail(run, new SiteUnreachableException("Court site unreachable: " + ex.getMessage(), ex));
        } catch (PageStructureException ex) {
            throw fail(run, new ResultParseException("Unexpected page structure: " + ex.getMessage(), ex));
        } catch (IllegalStateException ex) {
            throw fail(run, new SiteUnreachableException("Browser session failed: " + ex.getMessage(), ex));
        } catch (RuntimeException ex) {
            log.error("Search {} hit an unexpected error", ctx.attemptId(), ex);
            throw fail(run, new ResultParseException("Unexpected error while reading the court site: "
                    + ex.getClass().getSimpleName(), ex));
        }
    }

    private CaseRecord execute(final Run run) {
        CaseKey key = validator.validate(run.ctx.request());
        run.key = key;
        checkpoint(run, SearchState.FORM_FILLED, null);

        try (BrowserSession session = sessions.open()) {
            openForm(session);
            form.populate(session, key);

            Optional<ChallengeArtifact> challenge = challenges.extractChallenge(session);
            if (challenge.isEmpty()) {
                form.submit(session);
                checkpoint(run, SearchState.SUBMITTED, null);
            } else {
                checkpoint(run, SearchState.SUBMITTED, null);
                resolveChallenge(run, session, challenge.get());
                checkpoint(run, SearchState.CHALLENGE_RESOLVED, null);
            }

            awaitResult(session);
            checkpoint(run, SearchState.RESULT_READY, null);

            CaseRecord record = parser.parse(sessions.pageContent(session)).withKey(key);
            store.upsertCase(record);
            return record;
        }
    }

    /**
     * Answers the CAPTCHA until the site accepts a code or the budget is spent.
     */
    private void resolveChallenge(final Run run, final BrowserSession session,
                                  final ChallengeArtifact first) {
        ChallengeArtifact artifact = first;
        String code = StringUtils.trimToNull(run.ctx.request().captchaCode());
        while (true) {
            checkpoint(run, SearchState.CHALLENGE_PENDING, artifact);
            if (code == null) {
                code = run.ctx.codes().nextCode(artifact, challengeWait(run));
                guard(run);
            }
            run.submissions++;
            ChallengeOutcome outcome = challenges.submitResponse(session, code);
            code = null;
            if (outcome == ChallengeOutcome.ACCEPTED) {
                return;
            }
            log.info("Search {}: CAPTCHA {} ({} of {})", run.ctx.attemptId(), outcome,
                    run.submissions, props.getChallengeRetryBudget());
            if (run.submissions >= props.getChallengeRetryBudget()) {
                throw new ChallengeExhaustedException(run.submissions);
            }

            pause(challengeBackoff.apply(run.submissions));
            guard(run);
            openForm(session);
            form.populate(session, run.key);
            if (challenges.extractChallenge(session).isEmpty()) {
                form.submit(session);
                return;
            }
            artifact = challenges.refresh(session);
        }
    }

    private void openForm(final BrowserSession session) {
        Runnable guarded = CircuitBreaker.decorateRunnable(siteBreaker, () -> form.open(session));
        Retry.decorateRunnable(navigationRetry, guarded).run();
    }

    private void awaitResult(final BrowserSession session) {
        Supplier<Boolean> stillLoading =
                () -> parser.classify(sessions.pageContent(session)) == PageKind.IN_PROGRESS;
        if (Boolean.TRUE.equals(Retry.decorateSupplier(resultPollRetry, stillLoading).get())) {
            throw new SiteUnreachableException("Result page did not settle");
        }
    }

    /** Wait allowed for the next code: the configured wait, capped by the remaining budget. */
    private Duration challengeWait(final Run run) {
        Duration left = Duration.between(clock.instant(), run.deadline);
        if (left.isNegative() || left.isZero()) {
            throw budgetSpent();
        }
        Duration wait = props.getChallengeWait();
        return wait.compareTo(left) <= 0 ? wait : left;
    }

    private void checkpoint(final Run run, final SearchState next, final ChallengeArtifact artifact) {
        guard(run);
        run.enter(next, artifact);
    }

    /** Stops the run when it was cancelled or ran out of time. */
    private void guard(final Run run) {
        if (run.ctx.cancelled().getAsBoolean()) {
            throw new SearchCancelledException("Search cancelled");
        }
        if (clock.instant().isAfter(run.deadline)) {
            throw budgetSpent();
        }
    }

    private AttemptTimeoutException budgetSpent() {
        return new AttemptTimeoutException("Search exceeded its time budget of "
                + props.getAttemptBudget().toSeconds() + "s");
    }

    private static void pause(final long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("Interrupted while backing off");
        }
    }

    private CaseSearchException fail(final Run run, final CaseSearchException ex) {
        log.warn("Search {} failed with {}: {}", run.ctx.attemptId(), ex.kind(), ex.getMessage());
        try {
            record(run, ex.outcome(), ex);
        } catch (CaseStoreException storeEx) {
            log.error("Search {}: failed attempt could not be recorded", run.ctx.attemptId(), storeEx);
            ex.addSuppressed(storeEx);
        }
        run.enter(SearchState.FAILED, null);
        return ex;
    }

    private void record(final Run run, final SearchOutcome outcome, final CaseSearchException ex) {
        CaseSearchRequest req = run.ctx.request();
        String caseType = run.key != null ? run.key.caseType() : StringUtils.trimToEmpty(req.caseType());
        String caseNumber = run.key != null ? run.key.caseNumber() : StringUtils.trimToEmpty(req.caseNumber());
        store.logAttempt(SearchAttempt.builder()
                .id(run.ctx.attemptId())
                .caseType(StringUtils.abbreviate(caseType, 64))
                .caseNumber(StringUtils.abbreviate(caseNumber, 32))
                .caseYear(req.year())
                .submittedAt(run.submittedAt)
                .completedAt(clock.instant())
                .outcome(outcome)
                .errorKind(ex != null ? ex.kind() : null)
                .errorDetail(ex != null ? StringUtils.abbreviate(ex.getMessage(), MAX_DETAIL) : null)
                .challengeSubmissions(run.submissions)
                .caseId(outcome == SearchOutcome.SUCCESS ? run.caseId : null)
                .build());
    }

    /** Mutable bookkeeping of one run; confined to the thread executing it. */
    private final class Run {

        private final SearchContext ctx;
        private final Instant submittedAt;
        private final Instant deadline;
        private CaseKey key;
        private String caseId;
        private int submissions;
        private SearchState state = SearchState.INIT;

        private Run(final SearchContext ctx, final Instant submittedAt) {
            this.ctx = ctx;
            this.submittedAt = submittedAt;
            this.deadline = submittedAt.plus(props.getAttemptBudget());
        }

        private void enter(final SearchState next, final ChallengeArtifact artifact) {
            if (next != state) {
                log.debug("Search {}: {} -> {}", ctx.attemptId(), state, next);
            }
            state = next;
            ctx.observer().onTransition(ctx.attemptId(), next, artifact);
        }
    }
}

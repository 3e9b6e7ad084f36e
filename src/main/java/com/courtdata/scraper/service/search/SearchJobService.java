package com.courtdata.scraper.service.search;

import com.courtdata.scraper.config.SearchProperties;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.exception.CaseNotFoundException;
import com.courtdata.scraper.exception.CaseSearchException;
import com.courtdata.scraper.exception.FailureKind;
import com.courtdata.scraper.exception.SearchFailure;
import com.courtdata.scraper.exception.SiteUnreachableException;
import com.courtdata.scraper.service.challenge.ChallengeArtifact;
import com.courtdata.scraper.service.challenge.ChallengeExchange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs searches on the bounded <code>searchExecutor</code> and keeps their
 * status for polling. CAPTCHA codes and cancellations reach the running
 * search through the {@link ChallengeExchange}.
 */
@Slf4j
@Service
public class SearchJobService {

    private final CaseSearchOrchestrator orchestrator;
    private final ChallengeExchange exchange;
    private final TaskExecutor executor;
    private final SearchProperties props;
    private final Clock clock;

    private final Map<UUID, SearchJob> jobs = new ConcurrentHashMap<>();

    public SearchJobService(final CaseSearchOrchestrator orchestrator,
                            final ChallengeExchange exchange,
                            @Qualifier("searchExecutor") final TaskExecutor executor,
                            final SearchProperties props,
                            final Clock clock) {
        this.orchestrator = orchestrator;
        this.exchange = exchange;
        this.executor = executor;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Queues a search and returns at once.
     *
     * @param request what to search for
     * @return the job, in state {@link SearchState#INIT}
     * @throws SiteUnreachableException when every worker is busy and the queue is full
     */
    public SearchJob start(final CaseSearchRequest request) {
        evictFinished();
        UUID id = UUID.randomUUID();
        SearchJob job = new SearchJob(id, request, clock.instant());
        SearchContext ctx = new SearchContext(id, request,
                (artifact, timeout) -> exchange.awaitCode(id, artifact, timeout),
                job::onTransition,
                () -> exchange.isCancelled(id));
        jobs.put(id, job);
        try {
            executor.execute(() -> run(job, ctx));
        } catch (TaskRejectedException ex) {
            jobs.remove(id);
            throw new SiteUnreachableException("Too many searches in progress, try again later", ex);
        }
        log.info("Queued search {} for {}", id, request);
        return job;
    }

    /**
     * @return the job, if it is running or finished recently
     */
    public Optional<SearchJob> find(final UUID attemptId) {
        evictFinished();
        return Optional.ofNullable(jobs.get(attemptId));
    }

    /**
     * @return the challenge the job is waiting on, if any
     */
    public Optional<ChallengeArtifact> pendingChallenge(final UUID attemptId) {
        return exchange.pending(attemptId);
    }

    /**
     * Hands a CAPTCHA code to a waiting job.
     *
     * @return {@code false} when the job is not waiting for a code
     * @throws CaseNotFoundException when the job is unknown
     */
    public boolean supplyCode(final UUID attemptId, final String code) {
        require(attemptId);
        return exchange.submitCode(attemptId, code.trim());
    }

    /**
     * Requests cancellation. A job that already finished is left as it is.
     *
     * @return the job
     * @throws CaseNotFoundException when the job is unknown
     */
    public SearchJob cancel(final UUID attemptId) {
        SearchJob job = require(attemptId);
        if (!job.isFinished()) {
            log.info("Cancelling search {}", attemptId);
            exchange.cancel(attemptId);
        }
        return job;
    }

    private void run(final SearchJob job, final SearchContext ctx) {
        try {
            CaseRecord record = orchestrator.search(ctx);
            job.succeed(record, clock.instant());
        } catch (CaseSearchException ex) {
            job.fail(SearchFailure.of(ex), clock.instant());
        } catch (RuntimeException ex) {
            log.error("Search {} ended with an unexpected error", job.getAttemptId(), ex);
            job.fail(new SearchFailure(FailureKind.SITE_UNREACHABLE, "Search failed unexpectedly"), clock.instant());
        } finally {
            exchange.release(job.getAttemptId());
        }
    }

    private SearchJob require(final UUID attemptId) {
        return find(attemptId)
                .orElseThrow(() -> new CaseNotFoundException("No search with id " + attemptId));
    }

    private void evictFinished() {
        Instant cutoff = clock.instant().minus(props.getJobRetention());
        jobs.values().removeIf(j -> j.isFinished() && j.getFinishedAt().isBefore(cutoff));
    }
}

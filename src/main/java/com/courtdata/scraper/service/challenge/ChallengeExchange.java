package com.courtdata.scraper.service.challenge;

import com.courtdata.scraper.exception.CaseSearchException;
import com.courtdata.scraper.exception.ChallengeTimeoutException;
import com.courtdata.scraper.exception.SearchCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hand-off point between a search run waiting on a CAPTCHA and the caller
 * who reads it. A run parks in {@link #awaitCode}; the API layer completes
 * the wait through {@link #submitCode} or aborts it through {@link #cancel}.
 */
@Slf4j
@Component
public class ChallengeExchange {

    private final Map<UUID, Pending> pending = new ConcurrentHashMap<>();
    private final Set<UUID> cancelled = ConcurrentHashMap.newKeySet();

    /**
     * Blocks the calling run until a code arrives, the wait elapses or the run
     * is cancelled.
     *
     * @param attemptId run waiting for the code
     * @param artifact  challenge shown to the caller
     * @param timeout   longest wait
     * @return the submitted code
     */
    public String awaitCode(final UUID attemptId, final ChallengeArtifact artifact, final Duration timeout) {
        Pending wait = new Pending(artifact, new CompletableFuture<>());
        pending.put(attemptId, wait);
        try {
            if (cancelled.contains(attemptId)) {
                throw new SearchCancelledException("Search cancelled");
            }
            log.info("Search {} waiting up to {} for a CAPTCHA code", attemptId, timeout);
            return wait.code().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new ChallengeTimeoutException("No CAPTCHA code received within " + timeout.toSeconds() + "s");
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof CaseSearchException cse) {
                throw cse;
            }
            throw new SearchCancelledException("CAPTCHA wait aborted");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SearchCancelledException("Interrupted while waiting for a CAPTCHA code");
        } finally {
            pending.remove(attemptId, wait);
        }
    }

    /**
     * @return {@code true} if a run was waiting and received the code
     */
    public boolean submitCode(final UUID attemptId, final String code) {
        Pending wait = pending.get(attemptId);
        return wait != null && wait.code().complete(code);
    }

    /**
     * @return the challenge a run is currently waiting on
     */
    public Optional<ChallengeArtifact> pending(final UUID attemptId) {
        return Optional.ofNullable(pending.get(attemptId)).map(Pending::artifact);
    }

    /**
     * Marks the run cancelled and wakes it if it is waiting.
     */
    public void cancel(final UUID attemptId) {
        cancelled.add(attemptId);
        Pending wait = pending.get(attemptId);
        if (wait != null) {
            wait.code().completeExceptionally(new SearchCancelledException("Search cancelled"));
        }
    }

    public boolean isCancelled(final UUID attemptId) {
        return cancelled.contains(attemptId);
    }

    /**
     * Forgets everything about a finished run.
     */
    public void release(final UUID attemptId) {
        pending.remove(attemptId);
        cancelled.remove(attemptId);
    }

    private record Pending(ChallengeArtifact artifact, CompletableFuture<String> code) {
    }
}

package com.courtdata.scraper.service.search;

import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.exception.ChallengeTimeoutException;
import com.courtdata.scraper.service.challenge.ChallengeCodeSource;

import java.util.Objects;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Everything one run needs from its caller.
 *
 * @param attemptId identifier allocated for the run; becomes the attempt row id
 * @param request   what to search for
 * @param codes     where CAPTCHA codes come from when none was pre-supplied
 * @param observer  transition listener
 * @param cancelled polled at every transition
 */
public record SearchContext(UUID attemptId,
                            CaseSearchRequest request,
                            ChallengeCodeSource codes,
                            SearchObserver observer,
                            BooleanSupplier cancelled) {

    public SearchContext {
        Objects.requireNonNull(attemptId, "attemptId");
        Objects.requireNonNull(request, "request");
        codes = codes != null ? codes : (artifact, timeout) -> {
            throw new ChallengeTimeoutException("CAPTCHA required but no code was supplied");
        };
        observer = observer != null ? observer : SearchObserver.NONE;
        cancelled = cancelled != null ? cancelled : () -> false;
    }

    /**
     * A synchronous run that can only use the request's pre-supplied code.
     */
    public static SearchContext of(final CaseSearchRequest request) {
        return new SearchContext(UUID.randomUUID(), request, null, null, null);
    }
}

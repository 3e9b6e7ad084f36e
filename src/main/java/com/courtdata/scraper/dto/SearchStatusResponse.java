package com.courtdata.scraper.dto;

import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.exception.SearchFailure;
import com.courtdata.scraper.service.challenge.ChallengeArtifact;
import com.courtdata.scraper.service.search.SearchJob;
import com.courtdata.scraper.service.search.SearchState;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

/**
 * Status of a background search.
 *
 * @param attemptId search id; also the id of its history row
 * @param state     current state
 * @param challenge CAPTCHA waiting for a code, if any
 * @param result    the case, once the search succeeded
 * @param failure   why the search failed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SearchStatusResponse(UUID attemptId,
                                   SearchState state,
                                   Challenge challenge,
                                   CaseRecord result,
                                   SearchFailure failure) {

    public static SearchStatusResponse of(final SearchJob job, final ChallengeArtifact pending) {
        Challenge challenge = pending == null ? null
                : new Challenge(job.getAttemptId(), pending.challengeId(),
                pending.imageReference(), pending.issuedAt());
        return new SearchStatusResponse(job.getAttemptId(), job.getState(), challenge,
                job.getResult(), job.getFailure());
    }

    /**
     * CAPTCHA hand-off shown to the caller.
     */
    public record Challenge(UUID attemptId, UUID challengeId, String imageReference, Instant issuedAt) {
    }
}

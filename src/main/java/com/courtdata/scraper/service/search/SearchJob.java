package com.courtdata.scraper.service.search;

import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.exception.SearchFailure;
import com.courtdata.scraper.service.challenge.ChallengeArtifact;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * A search run executing in the background, as seen by status polls.
 * Written by the worker thread, read by request threads.
 */
@Getter
public class SearchJob {

    private final UUID attemptId;
    private final CaseSearchRequest request;
    private final Instant createdAt;

    private volatile SearchState state = SearchState.INIT;
    private volatile CaseRecord result;
    private volatile SearchFailure failure;
    private volatile Instant finishedAt;

    SearchJob(final UUID attemptId, final CaseSearchRequest request, final Instant createdAt) {
        this.attemptId = attemptId;
        this.request = request;
        this.createdAt = createdAt;
    }

    void onTransition(final UUID id, final SearchState next, final ChallengeArtifact challenge) {
        if (!state.isTerminal()) {
            this.state = next;
        }
    }

    void succeed(final CaseRecord record, final Instant at) {
        this.result = record;
        this.finishedAt = at;
        this.state = SearchState.SUCCESS;
    }

    void fail(final SearchFailure why, final Instant at) {
        this.failure = why;
        this.finishedAt = at;
        this.state = SearchState.FAILED;
    }

    public boolean isFinished() {
        return state.isTerminal();
    }
}

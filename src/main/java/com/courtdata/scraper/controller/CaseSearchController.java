package com.courtdata.scraper.controller;

import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.dto.ChallengeCodeRequest;
import com.courtdata.scraper.dto.SearchStatusResponse;
import com.courtdata.scraper.exception.CaseNotFoundException;
import com.courtdata.scraper.exception.ChallengeTimeoutException;
import com.courtdata.scraper.service.search.SearchJob;
import com.courtdata.scraper.service.search.SearchJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller driving case searches against the court site.
 * <p>
 * A search runs in the background. Clients start it, poll its status, answer
 * the CAPTCHA when the status carries a {@code challenge}, and read the case
 * from {@code result} once the state is {@code SUCCESS}.
 * </p>
 *
 * <h3>Example flow</h3>
 * <pre>{@code
 * POST /api/searches
 * { "caseType": "W.P.(C)", "caseNumber": "1234", "year": 2023 }
 *   -> 202 { "attemptId": "6f1c...", "state": "INIT" }
 *
 * GET /api/searches/6f1c...
 *   -> 200 { "attemptId": "6f1c...", "state": "CHALLENGE_PENDING",
 *            "challenge": { "challengeId": "...", "imageReference": "https://.../captcha.png", ... } }
 *
 * POST /api/searches/6f1c.../challenge
 * { "code": "AB12" }
 *   -> 202
 * }</pre>
 */
@RestController
@RequestMapping("/api/searches")
@RequiredArgsConstructor
public class CaseSearchController {

    private final SearchJobService jobs;

    /**
     * Starts a search.
     *
     * @param request case type, number, year and an optional CAPTCHA code
     * @return 202 with the search id and its initial state
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SearchStatusResponse> start(@RequestBody final CaseSearchRequest request) {
        SearchJob job = jobs.start(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(SearchStatusResponse.of(job, null));
    }

    /**
     * @param attemptId search id
     * @return current status, pending challenge, result or failure
     */
    @GetMapping(path = "/{attemptId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchStatusResponse status(@PathVariable final UUID attemptId) {
        SearchJob job = jobs.find(attemptId)
                .orElseThrow(() -> new CaseNotFoundException("No search with id " + attemptId));
        return SearchStatusResponse.of(job, jobs.pendingChallenge(attemptId).orElse(null));
    }

    /**
     * Answers the CAPTCHA a search is waiting on.
     *
     * @param attemptId search id
     * @param body      the code
     * @return 202 when the search took the code
     * @throws ChallengeTimeoutException (422) when the search is not waiting for a code
     */
    @PostMapping(path = "/{attemptId}/challenge", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Void> answer(@PathVariable final UUID attemptId,
                                       @RequestBody @Validated final ChallengeCodeRequest body) {
        if (!jobs.supplyCode(attemptId, body.code())) {
            throw new ChallengeTimeoutException("Search " + attemptId + " is not waiting for a CAPTCHA code");
        }
        return ResponseEntity.accepted().build();
    }

    /**
     * Cancels a running search.
     *
     * @param attemptId search id
     * @return the search status at the time of the request
     */
    @DeleteMapping(path = "/{attemptId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SearchStatusResponse> cancel(@PathVariable final UUID attemptId) {
        SearchJob job = jobs.cancel(attemptId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SearchStatusResponse.of(job, null));
    }
}

package com.courtdata.scraper;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.domain.SearchOutcome;
import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.dto.HistoryFilter;
import com.courtdata.scraper.exception.FailureKind;
import com.courtdata.scraper.repo.SearchAttemptRepository;
import com.courtdata.scraper.service.search.SearchJob;
import com.courtdata.scraper.service.search.SearchJobService;
import com.courtdata.scraper.service.search.SearchState;
import com.courtdata.scraper.service.store.CaseRecordStore;
import com.courtdata.scraper.support.FakeCourtSite;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;

import java.time.Duration;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@SpringBootTest
@DisplayName("Search flow against a scripted court site")
class CaseSearchFlowIntegrationTest {

    @TestConfiguration
    static class FakeSiteConfig {

        @Bean
        @Primary
        FakeCourtSite fakeCourtSite(final CourtSiteCfg cfg) {
            return new FakeCourtSite(cfg).requireChallenge("AB12"::equals);
        }
    }

    @Autowired
    private SearchJobService jobs;

    @Autowired
    private CaseRecordStore store;

    @Autowired
    private SearchAttemptRepository attemptRepository;

    @Autowired
    private FakeCourtSite site;

    @AfterEach
    void cleanUp() {
        attemptRepository.deleteAll();
    }

    @Test
    @DisplayName("a human-solved challenge leads to a stored case and a SUCCESS attempt")
    void solvesChallengeAndStoresCase() {
        SearchJob job = jobs.start(new CaseSearchRequest("W.P.(C)", "1234", 2023));
        UUID id = job.getAttemptId();

        await().atMost(Duration.ofSeconds(10))
                .until(() -> jobs.pendingChallenge(id).isPresent());
        assertThat(jobs.supplyCode(id, "AB12")).isTrue();

        await().atMost(Duration.ofSeconds(10)).until(job::isFinished);

        assertThat(job.getState()).isEqualTo(SearchState.SUCCESS);
        CaseRecord result = job.getResult();
        assertThat(result.petitioner()).isEqualTo("X");
        assertThat(result.respondent()).isEqualTo("Y");
        assertThat(result.orders()).singleElement()
                .satisfies(o -> assertThat(o.orderDate()).isEqualTo(LocalDate.of(2023, 5, 1)));
        assertThat(site.submittedCodes()).contains("AB12");

        CaseRecord stored = store.getCase("W.P.(C)/1234/2023").orElseThrow();
        assertThat(stored.caseTitle()).isEqualTo("X VS. Y");
        assertThat(stored.orders()).hasSize(1);

        Page<SearchAttempt> history = store.listHistory(HistoryFilter.none(), PageRequest.of(0, 10));
        assertThat(history.getContent())
                .filteredOn(a -> a.getId().equals(id))
                .singleElement()
                .satisfies(a -> assertThat(a.getOutcome()).isEqualTo(SearchOutcome.SUCCESS));
    }

    @Test
    @DisplayName("an unsupported case type fails validation and is still logged")
    void invalidInputIsLogged() {
        SearchJob job = jobs.start(new CaseSearchRequest("NOPE", "1234", 2023));

        await().atMost(Duration.ofSeconds(10)).until(job::isFinished);

        assertThat(job.getState()).isEqualTo(SearchState.FAILED);
        assertThat(job.getFailure().kind()).isEqualTo(FailureKind.VALIDATION_ERROR);
        assertThat(attemptRepository.findById(job.getAttemptId()))
                .get()
                .satisfies(a -> {
                    assertThat(a.getOutcome()).isEqualTo(SearchOutcome.FAILURE);
                    assertThat(a.getErrorKind()).isEqualTo(FailureKind.VALIDATION_ERROR);
                });
    }
}

package com.courtdata.scraper.repo;

import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.domain.SearchOutcome;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SearchAttemptRepository
        extends JpaRepository<SearchAttempt, UUID>, JpaSpecificationExecutor<SearchAttempt> {

    long countByOutcome(SearchOutcome outcome);

    long countBySubmittedAtAfter(Instant since);

    @Query("select a.caseType as caseType, count(a) as total from SearchAttempt a "
            + "group by a.caseType order by count(a) desc, a.caseType asc")
    List<CaseTypeCount> countByCaseType(Pageable page);

    /** Projection for the most-searched case types. */
    interface CaseTypeCount {
        String getCaseType();

        long getTotal();
    }
}

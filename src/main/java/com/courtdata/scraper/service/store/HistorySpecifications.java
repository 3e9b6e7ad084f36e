package com.courtdata.scraper.service.store;

import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.dto.HistoryFilter;
import org.apache.commons.lang3.StringUtils;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the history query from a {@link HistoryFilter}.
 */
final class HistorySpecifications {

    private HistorySpecifications() {
    }

    static Specification<SearchAttempt> matching(final HistoryFilter f) {
        List<Specification<SearchAttempt>> parts = new ArrayList<>();
        if (StringUtils.isNotBlank(f.caseType())) {
            parts.add((root, q, cb) -> cb.equal(root.get("caseType"), f.caseType().trim()));
        }
        if (StringUtils.isNotBlank(f.caseNumber())) {
            parts.add((root, q, cb) -> cb.equal(root.get("caseNumber"), f.caseNumber().trim()));
        }
        if (f.year() != null) {
            parts.add((root, q, cb) -> cb.equal(root.get("caseYear"), f.year()));
        }
        if (f.outcome() != null) {
            parts.add((root, q, cb) -> cb.equal(root.get("outcome"), f.outcome()));
        }
        if (f.from() != null) {
            parts.add((root, q, cb) -> cb.greaterThanOrEqualTo(root.<Instant>get("submittedAt"), f.from()));
        }
        if (f.to() != null) {
            parts.add((root, q, cb) -> cb.lessThan(root.<Instant>get("submittedAt"), f.to()));
        }
        return Specification.allOf(parts);
    }
}

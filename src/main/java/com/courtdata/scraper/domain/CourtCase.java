package com.courtdata.scraper.domain;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical state of a case as last observed on the court site. Keyed by
 * {@link CaseKey#id()}; a re-fetch updates this row in place.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "court_cases",
        indexes = {
                @Index(name = "idx_case_last_fetched", columnList = "last_fetched_at DESC")
        }
)
public class CourtCase {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 128)
    private String id;

    @Column(name = "case_type", nullable = false, updatable = false, length = 64)
    private String caseType;

    @Column(name = "case_number", nullable = false, updatable = false, length = 32)
    private String caseNumber;

    @Column(name = "case_year", nullable = false, updatable = false)
    private int caseYear;

    @Column(name = "case_title", length = 1000)
    private String caseTitle;

    @Column(name = "petitioner", length = 1000)
    private String petitioner;

    @Column(name = "respondent", length = 1000)
    private String respondent;

    @Column(name = "filing_date")
    private LocalDate filingDate;

    @Column(name = "next_hearing_date")
    private LocalDate nextHearingDate;

    @Column(name = "status", length = 255)
    private String status;

    @Column(name = "bench", length = 500)
    private String bench;

    @Column(name = "first_fetched_at", nullable = false, updatable = false)
    private Instant firstFetchedAt;

    @Column(name = "last_fetched_at", nullable = false)
    private Instant lastFetchedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @OneToMany(mappedBy = "courtCase", cascade = CascadeType.ALL)
    @OrderBy("orderDate DESC, id ASC")
    private List<CaseOrder> orders = new ArrayList<>();

    public CourtCase(final CaseKey key, final Instant fetchedAt) {
        this.id = key.id();
        this.caseType = key.caseType();
        this.caseNumber = key.caseNumber();
        this.caseYear = key.year();
        this.firstFetchedAt = fetchedAt;
        this.lastFetchedAt = fetchedAt;
    }

    public CaseKey key() {
        return new CaseKey(caseType, caseNumber, caseYear);
    }

    public void addOrder(final CaseOrder order) {
        order.setCourtCase(this);
        orders.add(order);
    }
}

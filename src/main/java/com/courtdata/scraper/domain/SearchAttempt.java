package com.courtdata.scraper.domain;

import com.courtdata.scraper.exception.FailureKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * One search request and how it ended. Written once when the run reaches a
 * terminal state and never updated afterwards.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Entity
@Immutable
@Table(
        name = "search_attempts",
        indexes = {
                @Index(name = "idx_attempt_submitted_desc", columnList = "submitted_at DESC"),
                @Index(name = "idx_attempt_case", columnList = "case_type,case_number,case_year")
        }
)
public class SearchAttempt implements Persistable<UUID> {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "case_type", nullable = false, length = 64)
    private String caseType;

    @Column(name = "case_number", nullable = false, length = 32)
    private String caseNumber;

    /** Null when the submitted year was not a number. */
    @Column(name = "case_year")
    private Integer caseYear;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 32)
    private SearchOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind", length = 32)
    private FailureKind errorKind;

    @Column(name = "error_detail", length = 2000)
    private String errorDetail;

    @Column(name = "challenge_submissions", nullable = false)
    private int challengeSubmissions;

    @Column(name = "case_id", length = 128)
    private String caseId;

    @Transient
    @Builder.Default
    private boolean fresh = true;

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.fresh = false;
    }
}

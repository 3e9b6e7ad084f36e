package com.courtdata.scraper.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One order or judgment listed for a case. Within a case an entry is
 * identified by its date and description.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Table(
        name = "case_orders",
        indexes = {
                @Index(name = "idx_order_case_date", columnList = "case_id,order_date DESC")
        }
)
public class CaseOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "case_id", nullable = false, updatable = false)
    private CourtCase courtCase;

    @Column(name = "order_date")
    private LocalDate orderDate;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Column(name = "pdf_location", length = 1000)
    private String pdfLocation;

    public CaseOrder(final LocalDate orderDate, final String description, final String pdfLocation) {
        this.orderDate = orderDate;
        this.description = description;
        this.pdfLocation = pdfLocation;
    }

    public boolean sameEntry(final LocalDate date, final String desc) {
        return Objects.equals(orderDate, date) && Objects.equals(description, desc);
    }
}

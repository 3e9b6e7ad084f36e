package com.courtdata.scraper.domain;

import java.time.LocalDate;

/**
 * One order or judgment as read from the site or the store.
 *
 * @param orderDate   date of the order, {@code null} when it could not be read
 * @param description short text describing the order
 * @param pdfLocation absolute URL of the PDF, or {@code null}
 */
public record OrderEntry(LocalDate orderDate, String description, String pdfLocation) {
}

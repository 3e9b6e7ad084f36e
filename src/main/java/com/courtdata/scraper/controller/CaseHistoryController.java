package com.courtdata.scraper.controller;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.domain.SearchOutcome;
import com.courtdata.scraper.dto.HistoryFilter;
import com.courtdata.scraper.dto.SearchStatistics;
import com.courtdata.scraper.exception.CaseNotFoundException;
import com.courtdata.scraper.service.pdf.OrderPdf;
import com.courtdata.scraper.service.pdf.OrderPdfService;
import com.courtdata.scraper.service.store.CaseRecordStore;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to what earlier searches stored.
 *
 * <ul>
 *   <li><code>GET /api/history</code>: search attempts, newest first, filterable</li>
 *   <li><code>GET /api/history/statistics</code>: totals and most searched case types</li>
 *   <li><code>GET /api/cases?id=W.P.(C)/1234/2023</code>: a stored case with its orders</li>
 *   <li><code>GET /api/case-types</code>: case types offered by the site</li>
 *   <li><code>GET /api/orders/{orderId}/pdf</code>: the PDF of a stored order</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CaseHistoryController {

    private static final int MAX_PAGE_SIZE = 100;

    private final CaseRecordStore store;
    private final OrderPdfService pdfs;
    private final CourtSiteCfg site;

    @GetMapping(path = "/history", produces = MediaType.APPLICATION_JSON_VALUE)
    public Page<SearchAttempt> history(
            @RequestParam(required = false) final String caseType,
            @RequestParam(required = false) final String caseNumber,
            @RequestParam(required = false) final Integer year,
            @RequestParam(required = false) final SearchOutcome outcome,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) final Instant to,
            @RequestParam(defaultValue = "0") final int page,
            @RequestParam(defaultValue = "50") final int size) {
        HistoryFilter filter = new HistoryFilter(caseType, caseNumber, year, outcome, from, to);
        PageRequest pageable = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), MAX_PAGE_SIZE));
        return store.listHistory(filter, pageable);
    }

    @GetMapping(path = "/history/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
    public SearchStatistics statistics() {
        return store.statistics();
    }

    @GetMapping(path = "/cases", produces = MediaType.APPLICATION_JSON_VALUE)
    public CaseRecord caseById(@RequestParam("id") final String caseId) {
        return store.getCase(caseId)
                .orElseThrow(() -> new CaseNotFoundException("No stored case " + caseId));
    }

    @GetMapping(path = "/case-types", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<String> caseTypes() {
        return site.getCaseTypes();
    }

    @GetMapping(path = "/orders/{orderId}/pdf")
    public ResponseEntity<byte[]> orderPdf(@PathVariable final long orderId) {
        OrderPdf pdf = pdfs.download(orderId);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(pdf.fileName()).build().toString())
                .body(pdf.content());
    }
}

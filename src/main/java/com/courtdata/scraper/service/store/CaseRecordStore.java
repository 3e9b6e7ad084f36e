package com.courtdata.scraper.service.store;

import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.domain.CaseKey;
import com.courtdata.scraper.domain.CaseOrder;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.domain.CourtCase;
import com.courtdata.scraper.domain.OrderEntry;
import com.courtdata.scraper.domain.SearchAttempt;
import com.courtdata.scraper.domain.SearchOutcome;
import com.courtdata.scraper.dto.HistoryFilter;
import com.courtdata.scraper.dto.SearchStatistics;
import com.courtdata.scraper.exception.CaseStoreException;
import com.courtdata.scraper.repo.CaseOrderRepository;
import com.courtdata.scraper.repo.CourtCaseRepository;
import com.courtdata.scraper.repo.SearchAttemptRepository;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * <h2>Case Record Store</h2>
 *
 * <p>Relational home of search attempts, cases and their orders. Every public
 * operation runs in its own transaction; persistence failures surface as
 * {@link CaseStoreException}, with {@code conflict = true} when a concurrent
 * writer got to the same row first.</p>
 *
 * <ul>
 *   <li>Attempts are append-only: logging an id twice fails.</li>
 *   <li>Cases are upserted by natural key under a row lock. Fields the parser
 *       could not find keep their stored value.</li>
 *   <li>Orders merge by (date, description): known entries are kept, new ones
 *       appended, a changed PDF link is updated in place.</li>
 * </ul>
 */
@Slf4j
@Service
public class CaseRecordStore {

    private static final int TOP_CASE_TYPES = 10;
    private static final int MAX_DESCRIPTION = 2000;
    private static final int MAX_TEXT = 1000;
    private static final String DEFAULT_ORDER = "Order";

    private final SearchAttemptRepository attempts;
    private final CourtCaseRepository cases;
    private final CaseOrderRepository orders;
    private final TransactionTemplate writeTx;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public CaseRecordStore(final SearchAttemptRepository attempts,
                           final CourtCaseRepository cases,
                           final CaseOrderRepository orders,
                           final PlatformTransactionManager txManager,
                           final Clock clock) {
        this.attempts = attempts;
        this.cases = cases;
        this.orders = orders;
        this.writeTx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
        this.clock = clock;
    }

    /**
     * Appends an attempt row.
     *
     * @param attempt terminal attempt
     * @throws CaseStoreException when the id was already logged or the write fails
     */
    public void logAttempt(final SearchAttempt attempt) {
        UUID id = attempt.getId();
        write("log attempt " + id, () -> {
            if (attempts.existsById(id)) {
                throw new CaseStoreException("Search attempt " + id + " is already logged", null, false);
            }
            attempts.saveAndFlush(attempt);
            return null;
        });
        log.debug("Logged attempt {} -> {}", id, attempt.getOutcome());
    }

    /**
     * Inserts or updates a case and merges its orders in one transaction.
     *
     * @param record parsed record carrying its key
     * @return identifier of the stored case
     */
    public String upsertCase(final CaseRecord record) {
        CaseKey key = Objects.requireNonNull(record.key(), "record key");
        String id = key.id();
        return write("upsert case " + id, () -> {
            Instant now = clock.instant();
            CourtCase row = cases.findForUpdate(id)
                    .orElseGet(() -> cases.save(new CourtCase(key, now)));
            apply(row, record);
            row.setLastFetchedAt(now);
            int added = mergeOrders(row, record.orders());
            cases.saveAndFlush(row);
            log.info("Stored case {} ({} new order(s), {} total)", id, added, row.getOrders().size());
            return id;
        });
    }

    /**
     * @param filter   optional criteria
     * @param pageable page to return; sorting is always newest first
     * @return matching attempts
     */
    public Page<SearchAttempt> listHistory(final HistoryFilter filter, final Pageable pageable) {
        HistoryFilter f = filter != null ? filter : HistoryFilter.none();
        Pageable page = PageRequest.of(pageable.getPageNumber(), pageable.getPageSize(),
                Sort.by(Sort.Order.desc("submittedAt"), Sort.Order.asc("id")));
        return read("list history", () -> attempts.findAll(HistorySpecifications.matching(f), page));
    }

    /**
     * @param caseId identifier in <code>TYPE/NUMBER/YEAR</code> form
     * @return the stored case with its orders, newest order first
     */
    public Optional<CaseRecord> getCase(final String caseId) {
        return read("load case " + caseId, () -> cases.findWithOrders(caseId).map(CaseRecordStore::toRecord));
    }

    /**
     * @param orderId order surrogate id
     * @return the stored order
     */
    public Optional<OrderEntry> findOrder(final long orderId) {
        return read("load order " + orderId, () -> orders.findById(orderId)
                .map(o -> new OrderEntry(o.getOrderDate(), o.getDescription(), o.getPdfLocation())));
    }

    /**
     * @return totals over the whole history
     */
    public SearchStatistics statistics() {
        return read("compute statistics", () -> {
            long total = attempts.count();
            long successful = attempts.countByOutcome(SearchOutcome.SUCCESS);
            long recent = attempts.countBySubmittedAtAfter(clock.instant().minus(Duration.ofHours(24)));
            double rate = total == 0 ? 0.0 : Math.round(successful * 1000.0 / total) / 10.0;
            List<SearchStatistics.CaseTypeTotal> top = attempts
                    .countByCaseType(PageRequest.of(0, TOP_CASE_TYPES)).stream()
                    .map(c -> new SearchStatistics.CaseTypeTotal(c.getCaseType(), c.getTotal()))
                    .toList();
            return new SearchStatistics(total, successful, rate, recent, top);
        });
    }

    /**
     * @return {@code true} when the database answers a trivial query
     */
    public boolean isAvailable() {
        try {
            readTx.execute(status -> attempts.count());
            return true;
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Case store unavailable: {}", ex.getMessage());
            return false;
        }
    }

    /* ------------------------------------------------------------------ */
    /* helpers                                                            */
    /* ------------------------------------------------------------------ */

    private static void apply(final CourtCase row, final CaseRecord rec) {
        Set<CaseField> unknown = rec.unknownFields();
        if (!unknown.contains(CaseField.CASE_TITLE)) {
            row.setCaseTitle(StringUtils.abbreviate(rec.caseTitle(), MAX_TEXT));
        }
        if (!unknown.contains(CaseField.PETITIONER)) {
            row.setPetitioner(StringUtils.abbreviate(rec.petitioner(), MAX_TEXT));
        }
        if (!unknown.contains(CaseField.RESPONDENT)) {
            row.setRespondent(StringUtils.abbreviate(rec.respondent(), MAX_TEXT));
        }
        if (!unknown.contains(CaseField.FILING_DATE)) {
            row.setFilingDate(rec.filingDate());
        }
        if (!unknown.contains(CaseField.NEXT_HEARING_DATE)) {
            row.setNextHearingDate(rec.nextHearingDate());
        }
        if (!unknown.contains(CaseField.STATUS)) {
            row.setStatus(StringUtils.abbreviate(rec.status(), 255));
        }
        if (!unknown.contains(CaseField.BENCH)) {
            row.setBench(StringUtils.abbreviate(rec.bench(), 500));
        }
    }

    /** @return number of orders appended */
    private static int mergeOrders(final CourtCase row, final List<OrderEntry> incoming) {
        int added = 0;
        for (OrderEntry entry : incoming) {
            LocalDate date = entry.orderDate();
            String description = StringUtils.abbreviate(
                    StringUtils.defaultIfBlank(entry.description(), DEFAULT_ORDER), MAX_DESCRIPTION);
            String pdf = StringUtils.abbreviate(entry.pdfLocation(), MAX_TEXT);
            Optional<CaseOrder> known = row.getOrders().stream()
                    .filter(o -> o.sameEntry(date, description))
                    .findFirst();
            if (known.isPresent()) {
                CaseOrder order = known.get();
                if (pdf != null && !pdf.equals(order.getPdfLocation())) {
                    order.setPdfLocation(pdf);
                }
            } else {
                row.addOrder(new CaseOrder(date, description, pdf));
                added++;
            }
        }
        return added;
    }

    private static CaseRecord toRecord(final CourtCase c) {
        Set<CaseField> unknown = EnumSet.noneOf(CaseField.class);
        addIfNull(unknown, CaseField.CASE_TITLE, c.getCaseTitle());
        addIfNull(unknown, CaseField.PETITIONER, c.getPetitioner());
        addIfNull(unknown, CaseField.RESPONDENT, c.getRespondent());
        addIfNull(unknown, CaseField.FILING_DATE, c.getFilingDate());
        addIfNull(unknown, CaseField.NEXT_HEARING_DATE, c.getNextHearingDate());
        addIfNull(unknown, CaseField.STATUS, c.getStatus());
        addIfNull(unknown, CaseField.BENCH, c.getBench());
        List<OrderEntry> entries = new ArrayList<>();
        for (CaseOrder o : c.getOrders()) {
            entries.add(new OrderEntry(o.getOrderDate(), o.getDescription(), o.getPdfLocation()));
        }
        return new CaseRecord(c.key(), c.getCaseTitle(), c.getPetitioner(), c.getRespondent(),
                c.getFilingDate(), c.getNextHearingDate(), c.getStatus(), c.getBench(), entries, unknown);
    }

    private static void addIfNull(final Set<CaseField> unknown, final CaseField field, final Object value) {
        if (value == null) {
            unknown.add(field);
        }
    }

    private <T> T write(final String what, final Supplier<T> work) {
        try {
            return writeTx.execute(status -> work.get());
        } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
            log.warn("Conflict while trying to {}: {}", what, ex.getMessage());
            throw new CaseStoreException("Concurrent update, could not " + what, ex, true);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Storage failure while trying to {}", what, ex);
            throw new CaseStoreException("Storage failure, could not " + what, ex, false);
        }
    }

    private <T> T read(final String what, final Supplier<T> work) {
        try {
            return readTx.execute(status -> work.get());
        } catch (DataAccessException | TransactionException ex) {
            log.error("Storage failure while trying to {}", what, ex);
            throw new CaseStoreException("Storage failure, could not " + what, ex, false);
        }
    }
}

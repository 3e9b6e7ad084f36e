package com.courtdata.scraper.service.search;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.domain.CaseKey;
import com.courtdata.scraper.service.core.BrowserSession;
import com.courtdata.scraper.service.core.BrowserSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The case-status search form of the court site.
 */
@Component
@RequiredArgsConstructor
public class CourtSearchForm {

    private final BrowserSessionManager sessions;
    private final CourtSiteCfg cfg;

    /** Loads the empty search form. */
    public void open(final BrowserSession session) {
        sessions.navigate(session, cfg.searchUrl());
    }

    /** Enters case type, number and year. */
    public void populate(final BrowserSession session, final CaseKey key) {
        CourtSiteCfg.Form form = cfg.getForm();
        sessions.selectOption(session, form.getCaseType(), key.caseType());
        sessions.fill(session, form.getCaseNumber(), key.caseNumber());
        sessions.selectOption(session, form.getYear(), String.valueOf(key.year()));
    }

    /** Submits the form when no CAPTCHA stands in the way. */
    public void submit(final BrowserSession session) {
        sessions.click(session, cfg.getForm().getSubmit());
    }
}

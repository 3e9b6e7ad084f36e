package com.courtdata.scraper.config;

import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.courtdata.scraper.domain.CaseField;

/**
 * Holds configuration properties for the court records site.
 * <p>
 * Encapsulates the search page location, the selectors of the case-status
 * form and its CAPTCHA controls, and the text markers used to recognise
 * result, error and challenge-rejection pages.
 * </p>
 *
 * <p>Example YAML:</p>
 * <pre>{@code
 * court:
 *   site:
 *     base-url: https://delhihighcourt.nic.in
 *     search-path: /app/
 *     form:
 *       case-type: select[name=case_type]
 *     challenge:
 *       image: "#captcha-image"
 * }</pre>
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "court.site")
public class CourtSiteCfg {

    /**
     * The base URL to which the search path and relative PDF links are resolved.
     * <p>For example, "https://delhihighcourt.nic.in".</p>
     */
    private String baseUrl = "https://delhihighcourt.nic.in";

    /**
     * The path (relative to {@link #baseUrl}) of the case-status search form.
     */
    private String searchPath = "/app/";

    /**
     * Case types offered by the site's drop-down. When non-empty, requests
     * naming any other type are rejected before the site is contacted.
     */
    private List<String> caseTypes = new ArrayList<>();

    /**
     * Hosts the order PDF download is allowed to contact. Empty means "the
     * host of {@link #baseUrl} only".
     */
    private List<String> pdfHosts = new ArrayList<>();

    /** Selectors of the search form. */
    private Form form = new Form();

    /** Selectors and markers of the CAPTCHA challenge. */
    private Challenge challenge = new Challenge();

    /** Text markers used to classify the page returned after submission. */
    private Markers markers = new Markers();

    /**
     * Extra CSS selectors tried first for individual case fields, e.g.
     * {@code petitioner: "#petitioner-name"}.
     */
    private Map<CaseField, List<String>> fieldSelectors = new EnumMap<>(CaseField.class);

    /**
     * @return absolute URL of the search form
     */
    public String searchUrl() {
        return URI.create(baseUrl).resolve(searchPath).toString();
    }

    /**
     * @return the host part of {@link #baseUrl}
     */
    public String baseHost() {
        return URI.create(baseUrl).getHost();
    }

    @Data
    public static class Form {

        /** Drop-down holding the case type; selected by visible label. */
        private String caseType = "select[name=case_type]";

        /** Text input for the case number. */
        private String caseNumber = "input[name=case_number]";

        /** Drop-down holding the year; selected by visible label. */
        private String year = "select[name=year]";

        /** The control that submits the search. */
        private String submit = "input[type=submit]";
    }

    @Data
    public static class Challenge {

        /** Element carrying the CAPTCHA image (or text rendered as an image). */
        private String image = "img#captcha-image, img.captcha, #captcha-code";

        /** Text input that receives the CAPTCHA code. */
        private String input = "input[name=captcha]";

        /** Optional control that asks the site for a new CAPTCHA. */
        private String refresh = "#refresh-captcha, .captcha-refresh";

        /** Page text meaning the code was wrong. Matched case-insensitively. */
        private List<String> rejectedMarkers = new ArrayList<>(List.of(
                "captcha mismatch", "invalid captcha", "incorrect captcha", "wrong captcha"));

        /** Page text meaning the challenge or session expired. Matched case-insensitively. */
        private List<String> expiredMarkers = new ArrayList<>(List.of(
                "captcha expired", "session expired", "session has expired", "session timed out"));
    }

    @Data
    public static class Markers {

        /** Page text meaning the site found no case for the request. */
        private List<String> noRecord = new ArrayList<>(List.of(
                "no record found", "no records found", "invalid case number", "case not found"));

        /** Page text meaning an error or maintenance page was served. */
        private List<String> error = new ArrayList<>(List.of(
                "under maintenance", "scheduled maintenance", "service unavailable",
                "error occurred", "internal server error", "bad gateway", "try again later"));

        /** Page text meaning results are still being rendered. */
        private List<String> loading = new ArrayList<>(List.of("please wait", "loading..."));

        /** Containers that only appear on a result page. */
        private String resultContainer = ".case-details, #case-details, #caseDetails, table.case-info";
    }
}

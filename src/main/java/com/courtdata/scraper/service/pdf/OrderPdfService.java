package com.courtdata.scraper.service.pdf;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.config.PdfProperties;
import com.courtdata.scraper.domain.OrderEntry;
import com.courtdata.scraper.exception.CaseNotFoundException;
import com.courtdata.scraper.exception.SiteUnreachableException;
import com.courtdata.scraper.service.store.CaseRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Streams the PDF of a stored order from the court host.
 * <p>
 * Only hosts listed in <code>court.site.pdf-hosts</code> (by default the
 * site's own host) are contacted, so a stored link can never turn the
 * service into an open proxy.
 * </p>
 */
@Slf4j
@Service
public class OrderPdfService {

    private final CaseRecordStore store;
    private final CourtSiteCfg site;
    private final PdfProperties props;
    private final WebClient client;

    public OrderPdfService(final CaseRecordStore store,
                           final CourtSiteCfg site,
                           final PdfProperties props,
                           final WebClient.Builder builder) {
        this.store = store;
        this.site = site;
        this.props = props;
        this.client = builder.build();
    }

    /**
     * @param orderId stored order id
     * @return the PDF bytes
     * @throws CaseNotFoundException    when the order is unknown or has no PDF
     * @throws SiteUnreachableException when the download fails or its host is not allowed
     */
    public OrderPdf download(final long orderId) {
        OrderEntry order = store.findOrder(orderId)
                .orElseThrow(() -> new CaseNotFoundException("No order with id " + orderId));
        if (StringUtils.isBlank(order.pdfLocation())) {
            throw new CaseNotFoundException("Order " + orderId + " has no PDF");
        }
        URI uri = allowed(order.pdfLocation());
        log.info("Downloading PDF of order {} from {}", orderId, uri.getHost());
        try {
            byte[] body = client.get()
                    .uri(uri)
                    .header(HttpHeaders.REFERER, site.getBaseUrl())
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .block(props.getTimeout());
            if (body == null || body.length == 0) {
                throw new SiteUnreachableException("Empty PDF returned for order " + orderId);
            }
            return new OrderPdf(fileName(uri, orderId), body);
        } catch (WebClientResponseException ex) {
            throw new SiteUnreachableException("Court host answered HTTP " + ex.getStatusCode().value()
                    + " for order " + orderId, ex);
        } catch (WebClientException | DataBufferLimitException ex) {
            throw new SiteUnreachableException("PDF download failed for order " + orderId, ex);
        } catch (IllegalStateException ex) {
            throw new SiteUnreachableException("PDF download timed out for order " + orderId, ex);
        }
    }

    private URI allowed(final String location) {
        URI uri;
        try {
            uri = URI.create(location.trim());
        } catch (IllegalArgumentException ex) {
            throw new SiteUnreachableException("Stored PDF link is malformed", ex);
        }
        List<String> hosts = site.getPdfHosts().isEmpty() ? List.of(site.baseHost()) : site.getPdfHosts();
        String host = StringUtils.lowerCase(uri.getHost(), Locale.ROOT);
        boolean web = "https".equalsIgnoreCase(uri.getScheme()) || "http".equalsIgnoreCase(uri.getScheme());
        if (!web || host == null || hosts.stream().noneMatch(h -> h.equalsIgnoreCase(host))) {
            throw new SiteUnreachableException("PDF host not allowed: " + host);
        }
        return uri;
    }

    private static String fileName(final URI uri, final long orderId) {
        String last = StringUtils.substringAfterLast(uri.getPath(), "/");
        return StringUtils.endsWithIgnoreCase(last, ".pdf") ? last : "order-" + orderId + ".pdf";
    }
}

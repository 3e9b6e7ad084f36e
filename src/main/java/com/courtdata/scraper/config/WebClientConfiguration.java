package com.courtdata.scraper.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.logging.LogLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.transport.logging.AdvancedByteBufFormat;

import java.time.Duration;

/**
 * Builds the {@link WebClient.Builder} used to fetch order PDFs from the court
 * host. Search traffic goes through the browser instead.
 */
@Configuration
@Slf4j
public class WebClientConfiguration {

    private static final Duration ACQUIRE_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration MAX_IDLE = Duration.ofSeconds(30);

    @Bean
    public WebClient.Builder webClientBuilder(final BrowserProperties browser,
                                              final PdfProperties pdf) {

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(pdf.getMaxBytes()))
                .build();

        ConnectionProvider pool = ConnectionProvider.builder("court-pdf")
                .maxConnections(Math.max(1, pdf.getMaxConnections()))
                .pendingAcquireTimeout(ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE)
                .build();

        HttpClient http = HttpClient.create(pool)
                .followRedirect(true)
                .compress(true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) pdf.getConnectTimeout().toMillis())
                .responseTimeout(pdf.getTimeout())
                .wiretap("reactor.netty.http.client.HttpClient",
                        LogLevel.TRACE, AdvancedByteBufFormat.SIMPLE);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .defaultHeader(HttpHeaders.USER_AGENT, browser.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT,
                        MediaType.APPLICATION_PDF_VALUE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                .filter(logRequest())
                .filter(flagHtmlResponse())
                .exchangeStrategies(strategies);
    }

    private static ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(req -> {
            log.debug("--> {} {}", req.method(), req.url());
            return Mono.just(req);
        });
    }

    /** The court host answers missing files with an HTML page and status 200. */
    private static ExchangeFilterFunction flagHtmlResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(res -> {
            MediaType type = res.headers().contentType().orElse(null);
            log.debug("<-- {} {} ({} bytes)", res.statusCode().value(), type,
                    res.headers().contentLength().orElse(-1L));
            if (type != null && type.isCompatibleWith(MediaType.TEXT_HTML)) {
                log.warn("Court host returned HTML where a PDF was expected");
            }
            return Mono.just(res);
        });
    }
}

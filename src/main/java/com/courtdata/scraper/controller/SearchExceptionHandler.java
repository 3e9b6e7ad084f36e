package com.courtdata.scraper.controller;

import com.courtdata.scraper.exception.CaseSearchException;
import com.courtdata.scraper.exception.CaseStoreException;
import com.courtdata.scraper.exception.FailureKind;
import com.courtdata.scraper.exception.SearchFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps failures to <code>{kind, message}</code> bodies with a stable kind
 * code. Messages never carry stack traces or remote page content.
 */
@Slf4j
@RestControllerAdvice
public class SearchExceptionHandler {

    @ExceptionHandler(CaseSearchException.class)
    public ResponseEntity<SearchFailure> onSearchFailure(final CaseSearchException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.warn("{} -> {}: {}", ex.kind(), status.value(), ex.getMessage());
        } else {
            log.debug("{} -> {}: {}", ex.kind(), status.value(), ex.getMessage());
        }
        return body(status, SearchFailure.of(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SearchFailure> onInvalidBody(final MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(SearchExceptionHandler::formatFieldError)
                .collect(Collectors.joining("; "));
        return body(HttpStatus.BAD_REQUEST, new SearchFailure(FailureKind.VALIDATION_ERROR, details));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<SearchFailure> onUnreadable(final Exception ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST,
                new SearchFailure(FailureKind.VALIDATION_ERROR, "invalid parameters"));
    }

    static HttpStatus statusOf(final CaseSearchException ex) {
        return switch (ex.kind()) {
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case CASE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CANCELLED -> HttpStatus.CONFLICT;
            case CHALLENGE_TIMEOUT, CHALLENGE_EXHAUSTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PARSE_ERROR -> HttpStatus.BAD_GATEWAY;
            case SITE_UNREACHABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case STORAGE_ERROR -> ((CaseStoreException) ex).isConflict()
                    ? HttpStatus.CONFLICT : HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<SearchFailure> body(final HttpStatus status, final SearchFailure failure) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(failure);
    }

    private static String formatFieldError(final FieldError fe) {
        return fe.getField() + ": " + fe.getDefaultMessage();
    }
}

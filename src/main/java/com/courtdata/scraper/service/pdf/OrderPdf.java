package com.courtdata.scraper.service.pdf;

/**
 * A downloaded order PDF.
 *
 * @param fileName suggested file name for the download
 * @param content  raw bytes
 */
public record OrderPdf(String fileName, byte[] content) {
}

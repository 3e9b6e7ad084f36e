package com.courtdata.scraper.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/searches/{attemptId}/challenge}.
 *
 * @param code CAPTCHA text as read by the user
 */
public record ChallengeCodeRequest(@NotBlank @Size(max = 32) String code) {
}

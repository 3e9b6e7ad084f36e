package com.courtdata.scraper.service.challenge;

import java.time.Instant;
import java.util.UUID;

/**
 * A CAPTCHA presented by the court site.
 *
 * @param challengeId    identifier of this particular artifact; a refresh yields a new one
 * @param imageReference absolute image URL, or a {@code data:image/png;base64,...} URI
 * @param issuedAt       when the artifact was read from the page
 */
public record ChallengeArtifact(UUID challengeId, String imageReference, Instant issuedAt) {
}
